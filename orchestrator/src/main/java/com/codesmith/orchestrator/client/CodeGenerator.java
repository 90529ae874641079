package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.model.CancellationToken;
import com.codesmith.orchestrator.model.Tier;

/**
 * Produces a code artifact from a prompt on a given tier.
 *
 * Implementations may throw any runtime exception; the orchestrator records
 * it as a failed attempt.
 */
public interface CodeGenerator {

    /**
     * @param language target language; a fenced block labelled with it is preferred
     */
    Generation generate(String prompt, String language, Tier tier, CancellationToken cancellation);

    /**
     * @param artifact  generated code
     * @param modelUsed model that produced it
     */
    record Generation(String artifact, String modelUsed) {}
}
