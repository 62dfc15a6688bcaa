package com.ottoai.analysis.model;

import java.util.UUID;

/**
 * Published once per job completion that was actually applied, after the
 * transaction committed. Downstream CRM updates hang off this event.
 *
 * @param permanent true when no further retry will happen for this job
 */
public record JobCompletedEvent(
        UUID        jobId,
        String      tenantId,
        String      subjectId,
        SubjectType subjectType,
        JobKind     jobKind,
        JobStatus   status,
        int         retryCount,
        boolean     permanent,
        CompletionSource source
) {}
