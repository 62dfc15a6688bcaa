package com.ottoai.analysis.api.dto;

import com.ottoai.analysis.model.AnalysisJob;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /api/v1/analysis/jobs and GET /api/v1/analysis/jobs/{id}.
 * Output payloads are not included; callers read results through the CRM.
 */
public record JobResponse(
        UUID    id,
        String  tenantId,
        String  subjectId,
        String  jobKind,
        String  status,
        String  externalJobId,
        int     retryCount,
        String  lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {
    public static JobResponse from(AnalysisJob job) {
        return new JobResponse(
                job.getId(),
                job.getTenantId(),
                job.getSubjectId(),
                job.getJobKind().wireName(),
                job.getStatus().name(),
                job.getExternalJobId(),
                job.getRetryCount(),
                job.getLastError(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt()
        );
    }
}
