package com.ottoai.analysis.model;

import java.util.Objects;

/**
 * Pure decision function behind the completion coordinator:
 * (current state, candidate) → (outcome, new state).
 *
 * No I/O, no locks, no clock. The coordinator runs this inside its critical
 * section against a freshly re-read job.
 */
public final class CompletionRules {

    private CompletionRules() {}

    /**
     * @param current       job state re-read under the lock
     * @param candidate     proposed terminal result
     * @param candidateHash hash of the candidate's output
     */
    public static CompletionDecision decide(JobSnapshot current,
                                            CompletionCandidate candidate,
                                            String candidateHash) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(candidate, "candidate");

        // Once terminal, no later candidate is applied. Covers webhook-then-poll,
        // poll-then-webhook and webhook redelivery.
        if (current.status().isTerminal()) {
            return CompletionDecision.skipped(CompletionOutcome.SKIPPED_TERMINAL);
        }

        // Result for an earlier attempt; the job was reset and resubmitted since.
        if (candidate.externalJobId() != null
                && !candidate.externalJobId().equals(current.externalJobId())) {
            return CompletionDecision.skipped(CompletionOutcome.SKIPPED_STALE);
        }

        // Output already applied by an earlier partial write.
        if (current.outputHash() != null && current.outputHash().equals(candidateHash)) {
            return CompletionDecision.skipped(CompletionOutcome.SKIPPED_DUPLICATE);
        }

        boolean succeeded = candidate.status() == JobStatus.SUCCEEDED;
        return new CompletionDecision(
                CompletionOutcome.APPLIED,
                candidate.status(),
                succeeded ? candidateHash : null,
                succeeded ? null : candidate.error(),
                !succeeded && candidate.retryable());
    }
}
