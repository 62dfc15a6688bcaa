package com.ottoai.analysis.service;

import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Bounded retries and lifetime enforcement.
 *
 * One sweep runs three passes:
 *   1. expire    PENDING/RUNNING jobs whose current attempt is older than
 *                max-job-lifetime → TIMEOUT through the coordinator
 *   2. resubmit  PENDING jobs whose outbound submission failed transiently
 *   3. retry     FAILED/TIMEOUT jobs that are retryable, under max-retries
 *                and due according to the backoff policy
 *
 * Passes 2 and 3 claim each job with a guarded UPDATE before dispatching,
 * so when several hosts sweep at once a job is retried at most once.
 */
@Component
public class RetrySupervisor {

    private static final Logger log = LoggerFactory.getLogger(RetrySupervisor.class);

    private final AnalysisJobRepository jobRepo;
    private final AnalysisJobService    jobService;
    private final CompletionCoordinator coordinator;
    private final Clock                 clock;
    private final int                   maxRetries;
    private final Duration              maxJobLifetime;
    private final int                   batchSize;

    public RetrySupervisor(AnalysisJobRepository jobRepo,
                           AnalysisJobService jobService,
                           CompletionCoordinator coordinator,
                           Clock clock,
                           AnalysisProperties properties) {
        this.jobRepo        = jobRepo;
        this.jobService     = jobService;
        this.coordinator    = coordinator;
        this.clock          = clock;
        this.maxRetries     = properties.getJobs().getMaxRetries();
        this.maxJobLifetime = properties.getJobs().getMaxJobLifetime();
        this.batchSize      = properties.getJobs().getSweepBatchSize();
    }

    @Scheduled(fixedDelayString = "#{@analysisProperties.jobs.supervisorInterval.toMillis()}",
               initialDelayString = "#{@analysisProperties.jobs.supervisorInterval.toMillis()}")
    public void sweep() {
        expireOverdueJobs();
        resubmitFailedSubmissions();
        retryFailedJobs();
    }

    // ------------------------------------------------------------------
    // Pass 1: lifetime
    // ------------------------------------------------------------------

    void expireOverdueJobs() {
        Instant cutoff = clock.instant().minus(maxJobLifetime);
        List<AnalysisJob> overdue = jobRepo.findByStatusInAndAttemptStartedAtBefore(
                JobStatus.ACTIVE, cutoff, page("attemptStartedAt"));
        forEachJob(overdue, "expire", job -> {
            CompletionOutcome outcome = coordinator.complete(JobRef.of(job),
                    CompletionCandidate.timeout("no completion within " + maxJobLifetime),
                    CompletionSource.SUPERVISOR);
            log.info("Timeout of job {} (attempt started {}) -> {}",
                    job.getId(), job.getAttemptStartedAt(), outcome.label());
        });
    }

    // ------------------------------------------------------------------
    // Pass 2: outbound submissions that failed transiently
    // ------------------------------------------------------------------

    void resubmitFailedSubmissions() {
        Instant now = clock.instant();
        List<AnalysisJob> due = jobRepo.findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(
                JobStatus.PENDING, now, page("nextAttemptAt"));
        forEachJob(due, "resubmit", job -> {
            if (job.getRetryCount() >= maxRetries) {
                String error = job.getLastError() != null ? job.getLastError() : "submission failed";
                CompletionOutcome outcome = coordinator.complete(JobRef.of(job),
                        CompletionCandidate.failed(null, error, true),
                        CompletionSource.SUPERVISOR);
                log.info("Submission retries of job {} exhausted ({}/{}) -> {}",
                        job.getId(), job.getRetryCount(), maxRetries, outcome.label());
                return;
            }
            if (jobRepo.claimResubmission(job.getId(), job.getRetryCount(), now) != 1) {
                log.debug("Resubmission of job {} claimed elsewhere", job.getId());
                return;
            }
            log.info("Resubmitting job {} (retry {}/{})", job.getId(), job.getRetryCount() + 1, maxRetries);
            jobRepo.findById(job.getId()).ifPresent(jobService::dispatch);
        });
    }

    // ------------------------------------------------------------------
    // Pass 3: FAILED / TIMEOUT → PENDING
    // ------------------------------------------------------------------

    void retryFailedJobs() {
        Instant now = clock.instant();
        List<AnalysisJob> due = jobRepo
                .findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
                        JobStatus.RETRYABLE, maxRetries, now, page("nextAttemptAt"));
        forEachJob(due, "retry", job -> {
            Optional<AnalysisJob> active = jobRepo.findFirstByTenantIdAndSubjectIdAndJobKindAndStatusIn(
                    job.getTenantId(), job.getSubjectId(), job.getJobKind(), JobStatus.ACTIVE);
            if (active.isPresent()) {
                jobRepo.markSuperseded(job.getId(), now);
                log.info("Job {} not retried: superseded by active job {}", job.getId(), active.get().getId());
                return;
            }
            if (jobRepo.resetForRetry(job.getId(), job.getStatus(), job.getRetryCount(), now) != 1) {
                log.debug("Retry of job {} claimed elsewhere", job.getId());
                return;
            }
            log.info("Retrying {} job {} (retry {}/{}, last error: {})",
                    job.getStatus(), job.getId(), job.getRetryCount() + 1, maxRetries, job.getLastError());
            jobRepo.findById(job.getId()).ifPresent(jobService::dispatch);
        });
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Pageable page(String orderBy) {
        return PageRequest.of(0, batchSize, Sort.by(orderBy));
    }

    /** Run the action per job with MDC set; one job's failure never stops the pass. */
    private void forEachJob(List<AnalysisJob> jobs, String pass, Consumer<AnalysisJob> action) {
        for (AnalysisJob job : jobs) {
            MDC.put("jobId", String.valueOf(job.getId()));
            MDC.put("tenantId", job.getTenantId());
            try {
                action.accept(job);
            } catch (RuntimeException e) {
                log.error("Supervisor {} pass failed for job {}: {}", pass, job.getId(), e.getMessage(), e);
            } finally {
                MDC.remove("jobId");
                MDC.remove("tenantId");
            }
        }
    }
}
