package com.ottoai.analysis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.external.AnalysisServiceClient;
import com.ottoai.analysis.external.AnalysisServiceException;
import com.ottoai.analysis.external.RemoteJobStatus;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pull-side fallback for lost webhooks.
 *
 * Every poll-interval it loads active jobs that have an external id and have
 * not changed for min-poll-age, fetches their status in parallel on a fixed
 * worker pool, and hands terminal results to the {@link CompletionCoordinator}.
 *
 * A poll that fails is logged and counted; the job is simply polled again on
 * the next sweep. Polling has no retry budget of its own.
 */
@Component
@EnableScheduling
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    static final String NOT_FOUND_ERROR = "external_job_not_found";

    private final AnalysisJobRepository jobRepo;
    private final AnalysisServiceClient client;
    private final CompletionCoordinator coordinator;
    private final ObjectMapper          json;
    private final Clock                 clock;
    private final ExecutorService       workers;
    private final Counter               pollErrors;
    private final Duration              minPollAge;
    private final int                   batchSize;

    @Autowired
    public JobPoller(AnalysisJobRepository jobRepo,
                     AnalysisServiceClient client,
                     CompletionCoordinator coordinator,
                     ObjectMapper objectMapper,
                     MeterRegistry meterRegistry,
                     Clock clock,
                     AnalysisProperties properties) {
        this(jobRepo, client, coordinator, objectMapper, meterRegistry, clock, properties,
                Executors.newFixedThreadPool(properties.getJobs().getPollerWorkers()));
    }

    JobPoller(AnalysisJobRepository jobRepo,
              AnalysisServiceClient client,
              CompletionCoordinator coordinator,
              ObjectMapper objectMapper,
              MeterRegistry meterRegistry,
              Clock clock,
              AnalysisProperties properties,
              ExecutorService workers) {
        this.jobRepo     = jobRepo;
        this.client      = client;
        this.coordinator = coordinator;
        this.json        = objectMapper;
        this.clock       = clock;
        this.workers     = workers;
        this.pollErrors  = meterRegistry.counter("analysis.poll.errors");
        this.minPollAge  = properties.getJobs().getMinPollAge();
        this.batchSize   = properties.getJobs().getSweepBatchSize();
    }

    /**
     * One sweep. fixedDelay means the next sweep starts poll-interval after
     * this one finished, so sweeps on one host never overlap.
     */
    @Scheduled(fixedDelayString = "#{@analysisProperties.jobs.pollInterval.toMillis()}",
               initialDelayString = "#{@analysisProperties.jobs.minPollAge.toMillis()}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(minPollAge);
        List<AnalysisJob> due = jobRepo.findByStatusInAndExternalJobIdIsNotNullAndUpdatedAtBefore(
                JobStatus.ACTIVE, cutoff, PageRequest.of(0, batchSize, Sort.by("updatedAt")));
        if (due.isEmpty()) return;

        log.debug("Polling {} active job(s)", due.size());
        List<Callable<Optional<CompletionOutcome>>> tasks = due.stream()
                .<Callable<Optional<CompletionOutcome>>>map(job -> () -> pollSafely(job))
                .toList();
        try {
            workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Poll sweep interrupted");
        }
    }

    /**
     * Poll one job and forward a terminal result.
     *
     * @return the coordinator outcome, or empty if the job is still in flight
     */
    Optional<CompletionOutcome> poll(AnalysisJob job) {
        RemoteJobStatus remote = client.fetchStatus(job.getTenantId(), job.getExternalJobId());
        CompletionCandidate candidate = switch (remote.state()) {
            case IN_FLIGHT -> null;
            case SUCCEEDED -> CompletionCandidate.succeeded(remote.output());
            case FAILED    -> CompletionCandidate.failed(remote.output(),
                    remote.error() != null ? remote.error() : "analysis failed", true);
            case NOT_FOUND -> CompletionCandidate.failed(notFoundOutput(job),
                    "external job " + job.getExternalJobId() + " not found or expired", false);
        };
        if (candidate == null) {
            log.debug("Job {} still in flight", job.getId());
            return Optional.empty();
        }
        return Optional.of(coordinator.complete(JobRef.of(job),
                candidate.forAttempt(job.getExternalJobId()), CompletionSource.POLLER));
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Optional<CompletionOutcome> pollSafely(AnalysisJob job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        MDC.put("tenantId", job.getTenantId());
        try {
            return poll(job);
        } catch (AnalysisServiceException e) {
            pollErrors.increment();
            log.warn("Poll of job {} failed ({}): {}", job.getId(), e.getKind(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            pollErrors.increment();
            log.error("Unexpected error polling job {}: {}", job.getId(), e.getMessage(), e);
            return Optional.empty();
        } finally {
            MDC.remove("jobId");
            MDC.remove("tenantId");
        }
    }

    private ObjectNode notFoundOutput(AnalysisJob job) {
        ObjectNode output = json.createObjectNode();
        output.put("error", NOT_FOUND_ERROR);
        output.put("external_job_id", job.getExternalJobId());
        return output;
    }
}
