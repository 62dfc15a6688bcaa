package com.ottoai.analysis.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of work handed to the external analysis service.
 *
 * At most one row per natural key (tenant_id, subject_id, job_kind) may be
 * PENDING or RUNNING at a time; the partial unique index in the V1 migration
 * enforces it.
 *
 * Terminal fields (status, output_payload, output_hash, completed_at) are only
 * written by {@link #applyCompletion} inside the CompletionCoordinator's
 * critical section. Every other transition is a guarded UPDATE in
 * AnalysisJobRepository.
 *
 * DB table: analysis_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "analysis_jobs")
public class AnalysisJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_kind", nullable = false, updatable = false)
    private JobKind jobKind;

    // Null until the external service accepts the submission.
    @Column(name = "external_job_id")
    private String externalJobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "input_payload", nullable = false, columnDefinition = "TEXT")
    private String inputPayload;

    @Column(name = "output_payload", columnDefinition = "TEXT")
    private String outputPayload;

    // Set if and only if status = SUCCEEDED.
    @Column(name = "output_hash")
    private String outputHash;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    // False after a failure that must not be retried (malformed request, job not found).
    @Column(nullable = false)
    private boolean retryable = true;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    // Start of the current dispatch attempt; max_job_lifetime is measured from here.
    @Column(name = "attempt_started_at", nullable = false)
    private Instant attemptStartedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected AnalysisJob() {}   // required by JPA

    public AnalysisJob(String tenantId, String subjectId, JobKind jobKind,
                       String inputPayload, Instant now) {
        this.tenantId         = tenantId;
        this.subjectId        = subjectId;
        this.jobKind          = jobKind;
        this.inputPayload     = inputPayload;
        this.createdAt        = now;
        this.updatedAt        = now;
        this.attemptStartedAt = now;
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    public JobSnapshot snapshot() {
        return new JobSnapshot(status, outputHash, externalJobId);
    }

    /**
     * Write an APPLIED decision. Caller must hold the job's completion lock.
     *
     * @param nextAttemptAt earliest retry time; ignored for SUCCEEDED
     */
    public void applyCompletion(CompletionDecision decision, String outputJson,
                                Instant now, Instant nextAttemptAt) {
        if (decision.outcome() != CompletionOutcome.APPLIED) {
            throw new IllegalArgumentException("Only APPLIED decisions change a job: " + decision.outcome());
        }
        this.status        = decision.status();
        this.outputPayload = outputJson;
        this.outputHash    = decision.outputHash();
        this.lastError     = decision.lastError();
        this.retryable     = decision.retryable();
        this.completedAt   = now;
        this.updatedAt     = now;
        this.nextAttemptAt = decision.status() == JobStatus.SUCCEEDED ? null : nextAttemptAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID      getId()               { return id; }
    public String    getTenantId()         { return tenantId; }
    public String    getSubjectId()        { return subjectId; }
    public JobKind   getJobKind()          { return jobKind; }
    public String    getExternalJobId()    { return externalJobId; }
    public JobStatus getStatus()           { return status; }
    public String    getInputPayload()     { return inputPayload; }
    public String    getOutputPayload()    { return outputPayload; }
    public String    getOutputHash()       { return outputHash; }
    public int       getRetryCount()       { return retryCount; }
    public boolean   isRetryable()         { return retryable; }
    public String    getLastError()        { return lastError; }
    public Instant   getNextAttemptAt()    { return nextAttemptAt; }
    public Instant   getAttemptStartedAt() { return attemptStartedAt; }
    public Instant   getCompletedAt()      { return completedAt; }
    public Instant   getCreatedAt()        { return createdAt; }
    public Instant   getUpdatedAt()        { return updatedAt; }

    @Override
    public String toString() {
        return "AnalysisJob{id=" + id + ", tenant=" + tenantId + ", kind=" + jobKind
                + ", status=" + status + ", externalJobId=" + externalJobId
                + ", retryCount=" + retryCount + "}";
    }
}
