package com.ottoai.analysis;

import com.ottoai.analysis.model.AnalysisJob;
import com.ottoai.analysis.model.JobKind;
import com.ottoai.analysis.model.JobStatus;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;

/**
 * Builds AnalysisJob instances in arbitrary states. Fields JPA or the guarded
 * UPDATEs would normally set are written reflectively.
 */
public final class JobFixtures {

    public static final String INPUT = "{\"input_reference\":\"https://media.example.com/call-42.wav\"}";

    private JobFixtures() {}

    public static AnalysisJob job(JobStatus status) {
        return job("t1", "call-42", JobKind.CSR_CALL, status, Instant.parse("2026-01-01T00:00:00Z"));
    }

    public static AnalysisJob job(String tenantId, String subjectId, JobKind kind,
                                  JobStatus status, Instant createdAt) {
        AnalysisJob job = new AnalysisJob(tenantId, subjectId, kind, INPUT, createdAt);
        set(job, "id", UUID.randomUUID());
        set(job, "status", status);
        if (status != JobStatus.PENDING) {
            set(job, "externalJobId", "ext-" + UUID.randomUUID().toString().substring(0, 8));
        }
        return job;
    }

    public static AnalysisJob set(AnalysisJob job, String field, Object value) {
        try {
            Field f = AnalysisJob.class.getDeclaredField(field);
            f.setAccessible(true);
            f.set(job, value);
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
