package com.codesmith.orchestrator.model;

/**
 * Output of the escalation policy for one attempt.
 */
public sealed interface EscalationDecision
        permits EscalationDecision.Retry, EscalationDecision.Accept, EscalationDecision.Abort {

    /** Run another attempt on {@code nextTier}. */
    record Retry(Tier nextTier) implements EscalationDecision {}

    /** Stop and keep the latest attempt. */
    record Accept(TerminalReason reason) implements EscalationDecision {}

    /** Stop without an acceptable result. */
    record Abort(TerminalReason reason, String message) implements EscalationDecision {}
}
