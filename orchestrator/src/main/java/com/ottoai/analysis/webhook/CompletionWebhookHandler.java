package com.ottoai.analysis.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import com.ottoai.analysis.service.CompletionCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Push side of completion delivery.
 *
 * Order matters: the signature is checked on the raw bytes before the body is
 * parsed and before the Job Store is touched, so forged requests cost nothing
 * beyond one HMAC.
 */
@Service
public class CompletionWebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionWebhookHandler.class);

    private final WebhookSignatureVerifier verifier;
    private final AnalysisJobRepository    jobRepo;
    private final CompletionCoordinator    coordinator;
    private final ObjectMapper             json;
    private final MeterRegistry            meterRegistry;
    private final AnalysisProperties       properties;

    public CompletionWebhookHandler(WebhookSignatureVerifier verifier,
                                    AnalysisJobRepository jobRepo,
                                    CompletionCoordinator coordinator,
                                    ObjectMapper objectMapper,
                                    MeterRegistry meterRegistry,
                                    AnalysisProperties properties) {
        this.verifier      = verifier;
        this.jobRepo       = jobRepo;
        this.coordinator   = coordinator;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.properties    = properties;
    }

    /**
     * @param taskId optional delivery id from the sender, logged only
     */
    public WebhookResult handle(byte[] rawBody, String signature, String timestamp, String taskId) {
        WebhookSignatureVerifier.Verdict verdict =
                verifier.check(rawBody, signature, timestamp, properties.getWebhook().getSecret());
        if (verdict != WebhookSignatureVerifier.Verdict.VALID) {
            meterRegistry.counter("analysis.webhook.rejected", "reason", verdict.tag()).increment();
            log.warn("Rejected analysis webhook (taskId={}): {}", taskId, verdict.tag());
            return WebhookResult.of(WebhookResult.Disposition.UNAUTHORIZED, verdict.tag());
        }

        AnalysisWebhookPayload payload;
        try {
            payload = json.readValue(rawBody, AnalysisWebhookPayload.class);
        } catch (IOException e) {
            log.warn("Unreadable analysis webhook body (taskId={}): {}", taskId, e.getMessage());
            return WebhookResult.of(WebhookResult.Disposition.MALFORMED, "body is not valid JSON");
        }
        if (payload == null || payload.externalJobId() == null || payload.externalJobId().isBlank()) {
            return WebhookResult.of(WebhookResult.Disposition.MALFORMED, "external_job_id is required");
        }

        Optional<AnalysisJob> found = jobRepo.findByExternalJobId(payload.externalJobId().trim());
        if (found.isEmpty()) {
            log.info("Webhook for unknown external job {} ignored (taskId={})", payload.externalJobId(), taskId);
            return WebhookResult.ignored(null, "unknown external job");
        }
        AnalysisJob job = found.get();

        MDC.put("jobId", String.valueOf(job.getId()));
        MDC.put("tenantId", job.getTenantId());
        try {
            return complete(job, payload, taskId);
        } finally {
            MDC.remove("jobId");
            MDC.remove("tenantId");
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private WebhookResult complete(AnalysisJob job, AnalysisWebhookPayload payload, String taskId) {
        if (payload.tenantId() != null && !payload.tenantId().isBlank()
                && !payload.tenantId().equals(job.getTenantId())) {
            meterRegistry.counter("analysis.webhook.rejected", "reason", "tenant_mismatch").increment();
            log.warn("Webhook tenant {} does not own job {} (taskId={})", payload.tenantId(), job.getId(), taskId);
            return WebhookResult.of(WebhookResult.Disposition.FORBIDDEN, "tenant mismatch");
        }

        CompletionCandidate candidate = switch (RemoteJobState.fromWire(payload.status())) {
            case IN_FLIGHT -> null;
            case SUCCEEDED -> CompletionCandidate.succeeded(payload.output());
            case FAILED    -> CompletionCandidate.failed(payload.output(),
                    payload.error() != null ? payload.error() : "analysis failed", true);
            case NOT_FOUND -> CompletionCandidate.failed(payload.output(),
                    payload.error() != null ? payload.error() : "external job expired", false);
        };
        if (candidate == null) {
            log.info("Webhook for job {} reports non-terminal status '{}', ignored", job.getId(), payload.status());
            return WebhookResult.ignored(job.getId(), "status not terminal");
        }

        CompletionOutcome outcome = coordinator.complete(JobRef.of(job),
                candidate.forAttempt(job.getExternalJobId()), CompletionSource.WEBHOOK);
        log.info("Webhook for job {} ({}, taskId={}) -> {}", job.getId(), candidate.status(), taskId, outcome.label());
        return WebhookResult.processed(job.getId(), outcome);
    }
}
