package com.ottoai.analysis.repository;

import com.ottoai.analysis.model.AnalysisJob;
import com.ottoai.analysis.model.JobKind;
import com.ottoai.analysis.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job Store queries for the analysis_jobs table.
 *
 * Sweep queries are served by the (status, updated_at) index. Non-terminal
 * transitions are single guarded UPDATEs: they return the number of rows
 * changed, and 0 means another actor moved the job first.
 */
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {

    // ------------------------------------------------------------------
    // Tenant-scoped lookups
    // ------------------------------------------------------------------

    Optional<AnalysisJob> findByIdAndTenantId(UUID id, String tenantId);

    /** The active (PENDING/RUNNING) job for a natural key, if any. */
    Optional<AnalysisJob> findFirstByTenantIdAndSubjectIdAndJobKindAndStatusIn(
            String tenantId, String subjectId, JobKind jobKind, Collection<JobStatus> statuses);

    Optional<AnalysisJob> findByExternalJobId(String externalJobId);

    /**
     * Re-read a job with a row lock for the completion critical section.
     * Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM AnalysisJob j WHERE j.id = :id AND j.tenantId = :tenantId")
    Optional<AnalysisJob> lockByIdAndTenantId(@Param("id") UUID id, @Param("tenantId") String tenantId);

    // ------------------------------------------------------------------
    // Sweep queries (Poller, RetrySupervisor)
    // ------------------------------------------------------------------

    /** Active jobs known to the external service that have not changed since 'cutoff'. */
    List<AnalysisJob> findByStatusInAndExternalJobIdIsNotNullAndUpdatedAtBefore(
            Collection<JobStatus> statuses, Instant cutoff, Pageable page);

    /** Active jobs whose current attempt started before 'cutoff'. */
    List<AnalysisJob> findByStatusInAndAttemptStartedAtBefore(
            Collection<JobStatus> statuses, Instant cutoff, Pageable page);

    /** PENDING jobs whose outbound submission failed transiently and are due again. */
    List<AnalysisJob> findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(
            JobStatus status, Instant now, Pageable page);

    /** FAILED/TIMEOUT jobs that may be retried and are due. */
    List<AnalysisJob> findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
            Collection<JobStatus> statuses, int maxRetries, Instant now, Pageable page);

    long countByStatusAndRetryCountGreaterThanEqual(JobStatus status, int retryCount);

    // ------------------------------------------------------------------
    // Guarded transitions
    // ------------------------------------------------------------------

    /** PENDING → RUNNING once the external service returned its job id. */
    @Transactional
    @Modifying
    @Query("""
            UPDATE AnalysisJob j
               SET j.status = com.ottoai.analysis.model.JobStatus.RUNNING,
                   j.externalJobId = :externalJobId,
                   j.lastError = null,
                   j.nextAttemptAt = null,
                   j.updatedAt = :now
             WHERE j.id = :id
               AND j.status = com.ottoai.analysis.model.JobStatus.PENDING
            """)
    int markRunning(@Param("id") UUID id,
                    @Param("externalJobId") String externalJobId,
                    @Param("now") Instant now);

    /** Record a transient submission failure; the job stays PENDING until 'nextAttemptAt'. */
    @Transactional
    @Modifying
    @Query("""
            UPDATE AnalysisJob j
               SET j.lastError = :error,
                   j.nextAttemptAt = :nextAttemptAt,
                   j.updatedAt = :now
             WHERE j.id = :id
               AND j.status = com.ottoai.analysis.model.JobStatus.PENDING
               AND j.externalJobId IS NULL
            """)
    int recordSubmissionFailure(@Param("id") UUID id,
                                @Param("error") String error,
                                @Param("nextAttemptAt") Instant nextAttemptAt,
                                @Param("now") Instant now);

    /**
     * Claim a re-dispatch of a PENDING job whose submission failed.
     * The retry-count guard makes the claim succeed on at most one host.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE AnalysisJob j
               SET j.retryCount = j.retryCount + 1,
                   j.nextAttemptAt = null,
                   j.attemptStartedAt = :now,
                   j.updatedAt = :now
             WHERE j.id = :id
               AND j.status = com.ottoai.analysis.model.JobStatus.PENDING
               AND j.externalJobId IS NULL
               AND j.nextAttemptAt IS NOT NULL
               AND j.retryCount = :expectedRetryCount
            """)
    int claimResubmission(@Param("id") UUID id,
                          @Param("expectedRetryCount") int expectedRetryCount,
                          @Param("now") Instant now);

    /**
     * FAILED/TIMEOUT → PENDING for a bounded retry. Reuses the row; the
     * external id is cleared so late notifications for the old attempt no
     * longer resolve to this job.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE AnalysisJob j
               SET j.status = com.ottoai.analysis.model.JobStatus.PENDING,
                   j.retryCount = j.retryCount + 1,
                   j.externalJobId = null,
                   j.outputPayload = null,
                   j.outputHash = null,
                   j.completedAt = null,
                   j.nextAttemptAt = null,
                   j.attemptStartedAt = :now,
                   j.updatedAt = :now
             WHERE j.id = :id
               AND j.status = :expectedStatus
               AND j.retryCount = :expectedRetryCount
               AND j.retryable = true
            """)
    int resetForRetry(@Param("id") UUID id,
                      @Param("expectedStatus") JobStatus expectedStatus,
                      @Param("expectedRetryCount") int expectedRetryCount,
                      @Param("now") Instant now);

    /**
     * Stop retrying a FAILED/TIMEOUT job because a newer submission for the
     * same natural key is already active.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE AnalysisJob j
               SET j.retryable = false,
                   j.nextAttemptAt = null,
                   j.updatedAt = :now
             WHERE j.id = :id
               AND j.status IN (com.ottoai.analysis.model.JobStatus.FAILED,
                                com.ottoai.analysis.model.JobStatus.TIMEOUT)
            """)
    int markSuperseded(@Param("id") UUID id, @Param("now") Instant now);
}
