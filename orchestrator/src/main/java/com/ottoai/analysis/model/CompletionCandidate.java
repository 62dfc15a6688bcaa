package com.ottoai.analysis.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A proposed terminal result for a job, from a webhook, a poll, the
 * supervisor or the submitter.
 *
 * @param output        opaque result body; may be null (e.g. timeout)
 * @param error         error summary for FAILED/TIMEOUT, stored as last_error
 * @param retryable     whether the supervisor may retry the job after this result
 * @param externalJobId external attempt the result was reported for; null matches any attempt
 */
public record CompletionCandidate(JobStatus status, JsonNode output, String error, boolean retryable,
                                  String externalJobId) {

    public CompletionCandidate {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Completion candidate must be terminal, got " + status);
        }
    }

    public CompletionCandidate(JobStatus status, JsonNode output, String error, boolean retryable) {
        this(status, output, error, retryable, null);
    }

    public static CompletionCandidate succeeded(JsonNode output) {
        return new CompletionCandidate(JobStatus.SUCCEEDED, output, null, false);
    }

    public static CompletionCandidate failed(JsonNode output, String error, boolean retryable) {
        return new CompletionCandidate(JobStatus.FAILED, output, error, retryable);
    }

    public static CompletionCandidate timeout(String error) {
        return new CompletionCandidate(JobStatus.TIMEOUT, null, error, true);
    }

    /** Bind this result to one external attempt of the job. */
    public CompletionCandidate forAttempt(String externalJobId) {
        return new CompletionCandidate(status, output, error, retryable, externalJobId);
    }
}
