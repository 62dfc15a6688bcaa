package com.ottoai.analysis.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of a completion webhook. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisWebhookPayload(
        @JsonProperty("external_job_id") String   externalJobId,
        @JsonProperty("status")          String   status,
        @JsonProperty("output")          JsonNode output,
        @JsonProperty("error")           String   error,
        @JsonProperty("tenant_id")       String   tenantId
) {}
