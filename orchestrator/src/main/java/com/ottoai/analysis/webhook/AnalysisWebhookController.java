package com.ottoai.analysis.webhook;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Completion callbacks from the external analysis service.
 *
 * POST /api/v1/analysis/webhook
 *   401  signature or timestamp rejected
 *   400  body unreadable or external_job_id missing
 *   403  tenant_id does not own the job
 *   200  {"status":"ignored"} or {"status":"<outcome>","jobId":...}
 *
 * The body is taken as raw bytes: the signature covers the exact bytes sent.
 */
@RestController
@RequestMapping("/api/v1/analysis/webhook")
public class AnalysisWebhookController {

    static final String SIGNATURE_HEADER = "X-Analysis-Signature";
    static final String TIMESTAMP_HEADER = "X-Analysis-Timestamp";
    static final String TASK_ID_HEADER   = "X-Analysis-Task-Id";

    private final CompletionWebhookHandler handler;

    public AnalysisWebhookController(CompletionWebhookHandler handler) {
        this.handler = handler;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp,
            @RequestHeader(value = TASK_ID_HEADER,   required = false) String taskId) {

        WebhookResult result = handler.handle(rawBody == null ? new byte[0] : rawBody, signature, timestamp, taskId);

        return switch (result.disposition()) {
            case UNAUTHORIZED -> error(HttpStatus.UNAUTHORIZED, "invalid signature");
            case MALFORMED    -> error(HttpStatus.BAD_REQUEST, result.detail());
            case FORBIDDEN    -> error(HttpStatus.FORBIDDEN, result.detail());
            case IGNORED      -> ResponseEntity.ok(Map.of("status", "ignored"));
            case PROCESSED    -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", result.outcome().label());
                body.put("jobId",  result.jobId().toString());
                yield ResponseEntity.ok(body);
            }
        };
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
