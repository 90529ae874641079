package com.codesmith.orchestrator.model;

/**
 * Thrown inside a job's worker when its cancellation token has fired.
 * Caught by the orchestrator and turned into a CANCELLED result.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException() {
        super("Job cancelled");
    }
}
