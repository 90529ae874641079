package com.codesmith.orchestrator.logging;

import com.codesmith.orchestrator.model.Tier;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys carried by every log line a job's worker thread writes.
 */
public final class MdcContext {

    public static final String JOB_ID  = "jobId";
    public static final String ATTEMPT = "attempt";
    public static final String TIER    = "tier";

    private MdcContext() {}

    public static void setJob(UUID jobId) {
        MDC.put(JOB_ID, jobId.toString());
    }

    public static void setAttempt(int attemptNumber, Tier tier) {
        MDC.put(ATTEMPT, String.valueOf(attemptNumber));
        MDC.put(TIER, tier.name());
    }

    public static void clear() {
        MDC.remove(JOB_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(TIER);
    }
}
