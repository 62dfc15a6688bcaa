package com.ottoai.analysis.webhook;

import com.ottoai.analysis.model.CompletionOutcome;

import java.util.UUID;

/**
 * What the webhook handler did with one delivery.
 *
 * @param outcome coordinator outcome; set only for {@link Disposition#PROCESSED}
 * @param jobId   local job id when the external id resolved to a job
 */
public record WebhookResult(Disposition disposition, CompletionOutcome outcome, UUID jobId, String detail) {

    public enum Disposition {
        /** Authenticity check failed. */
        UNAUTHORIZED,
        /** Body unreadable or missing external_job_id. */
        MALFORMED,
        /** Unknown job or still in flight; acknowledged so the sender stops redelivering. */
        IGNORED,
        /** tenant_id in the body does not own the job. */
        FORBIDDEN,
        /** Handed to the completion coordinator. */
        PROCESSED
    }

    static WebhookResult of(Disposition disposition, String detail) {
        return new WebhookResult(disposition, null, null, detail);
    }

    static WebhookResult ignored(UUID jobId, String detail) {
        return new WebhookResult(Disposition.IGNORED, null, jobId, detail);
    }

    static WebhookResult processed(UUID jobId, CompletionOutcome outcome) {
        return new WebhookResult(Disposition.PROCESSED, outcome, jobId, outcome.label());
    }
}
