package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.model.CancellationToken;
import com.codesmith.orchestrator.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Routes a generation request to the model configured for its tier.
 *
 *   LOCAL, LOCAL_PLUS  → Ollama
 *   PREMIUM            → Claude
 *
 * The reply is reduced to the code it contains with {@link ResponseParser}.
 */
@Component
public class TieredCodeGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TieredCodeGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are a senior software engineer. Write complete, compilable code for the task.
            Return the code in a single fenced code block. Do not leave placeholders or TODOs.
            When previous attempts are shown, fix every issue they list before adding anything new.""";

    private final OllamaClient ollama;
    private final ClaudeClient claude;
    private final String       localModel;
    private final String       localPlusModel;
    private final String       premiumModel;

    public TieredCodeGenerator(OllamaClient ollama,
                               ClaudeClient claude,
                               @Value("${codesmith.models.local:qwen2.5-coder:7b}") String localModel,
                               @Value("${codesmith.models.local-plus:qwen2.5-coder:32b}") String localPlusModel,
                               @Value("${codesmith.models.premium:claude-sonnet-4-5}") String premiumModel) {
        this.ollama         = ollama;
        this.claude         = claude;
        this.localModel     = localModel;
        this.localPlusModel = localPlusModel;
        this.premiumModel   = premiumModel;
    }

    @Override
    public Generation generate(String prompt, String language, Tier tier, CancellationToken cancellation) {
        cancellation.throwIfCancellationRequested();
        String model = modelFor(tier);
        log.debug("Generating on {} with {}", tier, model);

        String reply = switch (tier) {
            case LOCAL, LOCAL_PLUS -> ollama.generate(model, SYSTEM_PROMPT, prompt);
            case PREMIUM           -> claude.complete(model, SYSTEM_PROMPT, prompt);
        };
        String artifact = ResponseParser.extractArtifact(reply, language);
        if (artifact.isBlank()) {
            throw new ClientException(model + " returned no code");
        }
        return new Generation(artifact, model);
    }

    public String modelFor(Tier tier) {
        return switch (tier) {
            case LOCAL      -> localModel;
            case LOCAL_PLUS -> localPlusModel;
            case PREMIUM    -> premiumModel;
        };
    }
}
