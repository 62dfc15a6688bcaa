package com.ottoai.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.lock.JobLock;
import com.ottoai.analysis.lock.LockLease;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The single writer of terminal job state.
 *
 * Webhook handler, poller, supervisor and submitter all hand their candidate
 * results here. For each call:
 *   1. try the per-job distributed lock once; if held, return LOCK_BUSY
 *   2. in one transaction, re-read the job (row-locked) and run
 *      {@link CompletionRules#decide}; write the job only if APPLIED
 *   3. release the lock
 *   4. on APPLIED only, publish {@link JobCompletedEvent} (after commit)
 *
 * First committer wins; every later candidate sees SKIPPED_TERMINAL. A
 * candidate bound to an external attempt the job no longer carries sees
 * SKIPPED_STALE. Losing
 * callers do nothing further: the other delivery path or a later poll
 * covers them.
 */
@Service
public class CompletionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CompletionCoordinator.class);

    static final String LOCK_PREFIX = "analysis-job-lock:";

    private final AnalysisJobRepository     jobRepo;
    private final JobLock                   jobLock;
    private final TransactionOperations     tx;
    private final OutputHasher              hasher;
    private final BackoffPolicy             backoff;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meterRegistry;
    private final ObjectMapper              json;
    private final Clock                     clock;
    private final Duration                  lockTtl;
    private final int                       maxRetries;

    public CompletionCoordinator(AnalysisJobRepository jobRepo,
                                 JobLock jobLock,
                                 TransactionOperations tx,
                                 OutputHasher hasher,
                                 BackoffPolicy backoff,
                                 ApplicationEventPublisher events,
                                 MeterRegistry meterRegistry,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 AnalysisProperties properties) {
        this.jobRepo       = jobRepo;
        this.jobLock       = jobLock;
        this.tx            = tx;
        this.hasher        = hasher;
        this.backoff       = backoff;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.json          = objectMapper;
        this.clock         = clock;
        this.lockTtl       = properties.getJobs().getLockTtl();
        this.maxRetries    = properties.getJobs().getMaxRetries();
    }

    /**
     * Apply a candidate terminal result to a job, at most once.
     * Never throws for contention, duplicates or already-finished jobs.
     */
    public CompletionOutcome complete(JobRef ref, CompletionCandidate candidate, CompletionSource source) {
        Optional<LockLease> lease = jobLock.tryAcquire(lockKey(ref), lockTtl);
        if (lease.isEmpty()) {
            log.info("Completion of job {} via {} skipped: lock busy", ref.jobId(), source);
            return record(CompletionOutcome.LOCK_BUSY, source);
        }

        Result result;
        try {
            result = tx.execute(status -> applyLocked(ref, candidate, source));
        } finally {
            jobLock.release(lease.get());
        }

        if (result.event() != null) {
            publish(result.event());
        }
        return record(result.outcome(), source);
    }

    static String lockKey(JobRef ref) {
        return LOCK_PREFIX + ref.tenantId() + ":" + ref.jobId();
    }

    // ------------------------------------------------------------------
    // Critical section
    // ------------------------------------------------------------------

    private Result applyLocked(JobRef ref, CompletionCandidate candidate, CompletionSource source) {
        Optional<AnalysisJob> found = jobRepo.lockByIdAndTenantId(ref.jobId(), ref.tenantId());
        if (found.isEmpty()) {
            log.warn("Completion via {} for unknown job {} in tenant {}", source, ref.jobId(), ref.tenantId());
            return new Result(CompletionOutcome.NOT_FOUND, null);
        }
        AnalysisJob job = found.get();

        String candidateHash = hasher.hash(candidate.output());
        CompletionDecision decision = CompletionRules.decide(job.snapshot(), candidate, candidateHash);
        if (!decision.applied()) {
            log.info("Completion of job {} via {} as {} -> {} (current status {})",
                    job.getId(), source, candidate.status(), decision.outcome(), job.getStatus());
            return new Result(decision.outcome(), null);
        }

        Instant now = clock.instant();
        job.applyCompletion(decision, toJson(candidate.output()), now,
                backoff.nextAttemptAt(job.getRetryCount(), now));
        jobRepo.save(job);

        boolean permanent = decision.status() == JobStatus.SUCCEEDED
                || !decision.retryable()
                || job.getRetryCount() >= maxRetries;

        if (decision.status() == JobStatus.SUCCEEDED) {
            log.info("Job {} SUCCEEDED via {} (kind={}, retryCount={})",
                    job.getId(), source, job.getJobKind(), job.getRetryCount());
        } else if (permanent) {
            log.error("Job {} {} via {} with no retries left (retryCount={}/{}, retryable={}): {}",
                    job.getId(), decision.status(), source, job.getRetryCount(), maxRetries,
                    decision.retryable(), decision.lastError());
        } else {
            log.warn("Job {} {} via {}, eligible for retry {}/{} at {}: {}",
                    job.getId(), decision.status(), source, job.getRetryCount() + 1, maxRetries,
                    job.getNextAttemptAt(), decision.lastError());
        }

        return new Result(CompletionOutcome.APPLIED, new JobCompletedEvent(
                job.getId(),
                job.getTenantId(),
                job.getSubjectId(),
                job.getJobKind().subjectType(),
                job.getJobKind(),
                decision.status(),
                job.getRetryCount(),
                permanent,
                source));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void publish(JobCompletedEvent event) {
        try {
            events.publishEvent(event);
        } catch (RuntimeException e) {
            // The state change is committed; a failing listener must not turn it into an error.
            log.error("Listener failed for completed job {}: {}", event.jobId(), e.getMessage(), e);
        }
    }

    private CompletionOutcome record(CompletionOutcome outcome, CompletionSource source) {
        meterRegistry.counter("analysis.completion.outcomes",
                "outcome", outcome.label(),
                "source", source.name().toLowerCase()).increment();
        return outcome;
    }

    private String toJson(JsonNode output) {
        if (output == null || output.isNull()) return null;
        try {
            return json.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Output is not serializable", e);
        }
    }

    private record Result(CompletionOutcome outcome, JobCompletedEvent event) {}
}
