package com.ottoai.analysis.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Tenant-scoped reference to a job. Every lookup goes through both parts so a
 * job id from one tenant never resolves in another.
 */
public record JobRef(String tenantId, UUID jobId) {

    public JobRef {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(jobId, "jobId");
    }

    public static JobRef of(AnalysisJob job) {
        return new JobRef(job.getTenantId(), job.getId());
    }
}
