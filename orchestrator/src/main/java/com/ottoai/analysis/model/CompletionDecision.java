package com.ottoai.analysis.model;

/**
 * What the completion rules decided for one candidate.
 * For anything but APPLIED the remaining fields are null/false and unused.
 */
public record CompletionDecision(
        CompletionOutcome outcome,
        JobStatus         status,
        String            outputHash,
        String            lastError,
        boolean           retryable
) {
    static CompletionDecision skipped(CompletionOutcome outcome) {
        return new CompletionDecision(outcome, null, null, null, false);
    }

    public boolean applied() {
        return outcome == CompletionOutcome.APPLIED;
    }
}
