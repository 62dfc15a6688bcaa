package com.ottoai.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ottoai.analysis.external.AnalysisServiceClient;
import com.ottoai.analysis.external.AnalysisServiceException;
import com.ottoai.analysis.external.SubmitAnalysisRequest;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Job submission and the outbound dispatch path.
 *
 * Submission is idempotent per natural key (tenant, subject, kind): while a
 * job for the key is PENDING or RUNNING, {@link #submit} returns it and makes
 * no outbound call. Only malformed input is reported to the caller; every
 * failure of the external service is recorded on the job instead.
 *
 * No transaction spans the outbound call. Each state change after it is a
 * guarded UPDATE or goes through the {@link CompletionCoordinator}.
 */
@Service
public class AnalysisJobService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);

    static final String INPUT_REFERENCE = "input_reference";

    private final AnalysisJobRepository jobRepo;
    private final AnalysisServiceClient client;
    private final CompletionCoordinator coordinator;
    private final BackoffPolicy         backoff;
    private final ObjectMapper          json;
    private final Clock                 clock;

    public AnalysisJobService(AnalysisJobRepository jobRepo,
                              AnalysisServiceClient client,
                              CompletionCoordinator coordinator,
                              BackoffPolicy backoff,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.jobRepo     = jobRepo;
        this.client      = client;
        this.coordinator = coordinator;
        this.backoff     = backoff;
        this.json        = objectMapper;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Submit an analysis job.
     *
     * Steps:
     *  1. Validate input (throws {@link InvalidSubmissionException})
     *  2. Return the active job for the natural key if there is one
     *  3. Insert a PENDING row; on a unique-index race, return the winner's row
     *  4. Dispatch to the external service
     *
     * @return the job as it stands after dispatch; never null
     */
    public AnalysisJob submit(String tenantId, String subjectId, String jobKind, JsonNode inputPayload) {
        requireText(tenantId, "tenant_id");
        requireText(subjectId, "subject_id");
        if (jobKind == null || jobKind.isBlank()) {
            throw new InvalidSubmissionException("job_kind is required");
        }
        JobKind kind = JobKind.fromWire(jobKind)
                .orElseThrow(() -> new InvalidSubmissionException("Unknown job_kind: " + jobKind));
        validateInput(inputPayload);

        Optional<AnalysisJob> active = findActive(tenantId, subjectId, kind);
        if (active.isPresent()) {
            log.info("Job {} already active for ({}, {}, {}), returning it",
                    active.get().getId(), tenantId, subjectId, kind.wireName());
            return active.get();
        }

        AnalysisJob job;
        try {
            job = jobRepo.saveAndFlush(new AnalysisJob(
                    tenantId, subjectId, kind, toJson(inputPayload), clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // Another submitter inserted the same natural key between our read and insert.
            return findActive(tenantId, subjectId, kind).orElseThrow(() -> e);
        }
        log.info("Created job {} ({}, subject={}, tenant={})",
                job.getId(), kind.wireName(), subjectId, tenantId);

        return dispatch(job);
    }

    public Optional<AnalysisJob> findJob(String tenantId, UUID id) {
        return jobRepo.findByIdAndTenantId(id, tenantId);
    }

    // ------------------------------------------------------------------
    // Dispatch (also used by RetrySupervisor)
    // ------------------------------------------------------------------

    /**
     * Make the outbound submission call for a PENDING job and record the result:
     *   success       → RUNNING with the external job id
     *   transient     → stays PENDING, next_attempt_at set from the backoff policy
     *   non-retryable → FAILED through the coordinator, retryable=false
     *   id not stored → handled like a transient failure
     *
     * @return the job re-read after the update
     */
    public AnalysisJob dispatch(AnalysisJob job) {
        JobKind kind = job.getJobKind();
        JsonNode input = readInput(job);
        SubmitAnalysisRequest request = new SubmitAnalysisRequest(
                job.getTenantId(),
                job.getSubjectId(),
                kind.wireName(),
                kind.pipeline().wireName(),
                input.path(INPUT_REFERENCE).asText(),
                input);

        String externalJobId;
        try {
            externalJobId = client.submit(request);
        } catch (AnalysisServiceException e) {
            if (e.isRetryable()) {
                recordTransientFailure(job, e.getMessage());
            } else {
                failPermanently(job, e);
            }
            return jobRepo.findById(job.getId()).orElse(job);
        }

        try {
            if (jobRepo.markRunning(job.getId(), externalJobId, clock.instant()) == 1) {
                log.info("Job {} RUNNING (externalJobId={})", job.getId(), externalJobId);
            } else {
                log.warn("Job {} changed state before it could be marked RUNNING (externalJobId={})",
                        job.getId(), externalJobId);
            }
        } catch (DataAccessException e) {
            // Unrecorded external job; a PENDING row without next_attempt_at is never swept.
            log.error("Job {} was accepted as {} but could not be marked RUNNING: {}",
                    job.getId(), externalJobId, e.getMessage(), e);
            recordTransientFailure(job, "could not record external job " + externalJobId + ": " + e.getMessage());
        }

        return jobRepo.findById(job.getId()).orElse(job);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void recordTransientFailure(AnalysisJob job, String error) {
        Instant now = clock.instant();
        Instant next = backoff.nextAttemptAt(job.getRetryCount(), now);
        jobRepo.recordSubmissionFailure(job.getId(), error, next, now);
        log.warn("Submission of job {} failed transiently (retryCount={}), next attempt at {}: {}",
                job.getId(), job.getRetryCount(), next, error);
    }

    private void failPermanently(AnalysisJob job, AnalysisServiceException e) {
        CompletionOutcome outcome = coordinator.complete(JobRef.of(job),
                CompletionCandidate.failed(null, e.getMessage(), false),
                CompletionSource.SUBMITTER);
        if (outcome == CompletionOutcome.LOCK_BUSY) {
            // Leave it PENDING; the supervisor picks it up on its next sweep.
            recordTransientFailure(job, e.getMessage());
        }
    }

    private Optional<AnalysisJob> findActive(String tenantId, String subjectId, JobKind kind) {
        return jobRepo.findFirstByTenantIdAndSubjectIdAndJobKindAndStatusIn(
                tenantId, subjectId, kind, JobStatus.ACTIVE);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidSubmissionException(field + " is required");
        }
    }

    private static void validateInput(JsonNode inputPayload) {
        if (inputPayload == null || !inputPayload.isObject()) {
            throw new InvalidSubmissionException("input_payload must be a JSON object");
        }
        JsonNode ref = inputPayload.get(INPUT_REFERENCE);
        if (ref == null || !ref.isTextual() || ref.asText().isBlank()) {
            throw new InvalidSubmissionException("input_payload." + INPUT_REFERENCE + " is required");
        }
        try {
            URI uri = new URI(ref.asText().trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new InvalidSubmissionException(
                        "input_payload." + INPUT_REFERENCE + " must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new InvalidSubmissionException(
                    "input_payload." + INPUT_REFERENCE + " is not a valid URL: " + e.getReason());
        }
    }

    private JsonNode readInput(AnalysisJob job) {
        try {
            return json.readTree(job.getInputPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored input of job " + job.getId() + " is not JSON", e);
        }
    }

    private String toJson(JsonNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new InvalidSubmissionException("input_payload is not serializable");
        }
    }
}
