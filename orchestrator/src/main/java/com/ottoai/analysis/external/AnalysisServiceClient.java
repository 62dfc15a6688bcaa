package com.ottoai.analysis.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.model.RemoteJobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * HTTP client for the external analysis service.
 *
 * Two calls: submit a job, fetch a job's status. Every request is bounded by
 * the configured request timeout and failures are classified into
 * {@link AnalysisServiceException.Kind} so callers can decide whether to retry.
 *
 * Blocking I/O; callers must not hold a job lock while calling this.
 */
@Component
public class AnalysisServiceClient {

    private static final Logger log = LoggerFactory.getLogger(AnalysisServiceClient.class);

    private static final String JOBS_PATH = "/api/v1/analysis/jobs";

    // The service has used several names for its job id over time.
    private static final List<String> JOB_ID_FIELDS = List.of("job_id", "task_id", "transcript_id", "id");

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     requestTimeout;

    public AnalysisServiceClient(AnalysisProperties properties, ObjectMapper objectMapper) {
        AnalysisProperties.Service cfg = properties.getService();
        this.baseUrl        = stripTrailingSlash(cfg.getBaseUrl());
        this.apiKey         = cfg.getApiKey();
        this.requestTimeout = cfg.getRequestTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Submit a job for analysis.
     *
     * @return the external job id
     * @throws AnalysisServiceException TRANSIENT or REJECTED
     */
    public String submit(SubmitAnalysisRequest request) {
        String requestId = UUID.randomUUID().toString();
        log.info("Submitting {} job for subject {} (tenant={}, requestId={})",
                request.jobKind(), request.subjectId(), request.tenantId(), requestId);

        HttpRequest req = baseRequest(JOBS_PATH, request.tenantId(), requestId)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                .build();
        HttpResponse<String> resp = send(req, "submit");
        if (!isSuccess(resp.statusCode())) {
            throw httpError("submit", resp, AnalysisServiceException.classify(resp.statusCode()));
        }

        JsonNode body = parse(resp.body(), "submit");
        String externalJobId = extractJobId(body);
        if (externalJobId == null) {
            throw new AnalysisServiceException(AnalysisServiceException.Kind.REJECTED,
                    "submit response carried no job id");
        }
        return externalJobId;
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    /**
     * Fetch the current status of an external job. A 404 is returned as
     * {@link RemoteJobState#NOT_FOUND}, not thrown.
     *
     * @throws AnalysisServiceException TRANSIENT or REJECTED
     */
    public RemoteJobStatus fetchStatus(String tenantId, String externalJobId) {
        String path = JOBS_PATH + "/" + URLEncoder.encode(externalJobId, StandardCharsets.UTF_8);
        HttpRequest req = baseRequest(path, tenantId, UUID.randomUUID().toString())
                .GET()
                .build();
        HttpResponse<String> resp = send(req, "fetchStatus");
        if (resp.statusCode() == 404) {
            return RemoteJobStatus.notFound();
        }
        if (!isSuccess(resp.statusCode())) {
            throw httpError("fetchStatus", resp, AnalysisServiceException.classify(resp.statusCode()));
        }

        JsonNode body = parse(resp.body(), "fetchStatus");
        RemoteJobState state = RemoteJobState.fromWire(textOrNull(body, "status"));
        JsonNode output = body.get("output");
        if (output == null || output.isNull()) {
            output = body.get("result");
        }
        String error = textOrNull(body, "error");
        if (error == null) error = textOrNull(body, "error_message");
        return new RemoteJobStatus(state, output == null || output.isNull() ? null : output, error);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder baseRequest(String path, String tenantId, String requestId) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept",       "application/json")
                .header("X-Company-ID", tenantId)
                .header("X-Request-ID", requestId);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AnalysisServiceException(AnalysisServiceException.Kind.TRANSIENT,
                    opName + " timed out after " + requestTimeout, e);
        } catch (IOException e) {
            throw new AnalysisServiceException(AnalysisServiceException.Kind.TRANSIENT,
                    opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisServiceException(AnalysisServiceException.Kind.TRANSIENT,
                    opName + " interrupted", e);
        }
    }

    private AnalysisServiceException httpError(String opName, HttpResponse<String> resp,
                                               AnalysisServiceException.Kind kind) {
        return new AnalysisServiceException(kind,
                opName + " failed: HTTP " + resp.statusCode() + ": " + abbreviate(resp.body()),
                resp.statusCode(), null);
    }

    private JsonNode parse(String body, String opName) {
        try {
            JsonNode node = json.readTree(body == null ? "" : body);
            if (node == null || !node.isObject()) {
                throw new AnalysisServiceException(AnalysisServiceException.Kind.REJECTED,
                        opName + " response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new AnalysisServiceException(AnalysisServiceException.Kind.REJECTED,
                    "Failed to parse " + opName + " response", e);
        }
    }

    static String extractJobId(JsonNode body) {
        for (String field : JOB_ID_FIELDS) {
            JsonNode value = body.get(field);
            if (value == null || value.isNull()) continue;
            if (value.isIntegralNumber()) return value.asText();
            if (value.isTextual() && !value.asText().isBlank()) return value.asText().trim();
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AnalysisServiceException(AnalysisServiceException.Kind.REJECTED,
                    "JSON serialization failed", e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
