package com.ottoai.analysis.external;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of the outbound submission call.
 */
public record SubmitAnalysisRequest(
        @JsonProperty("tenant_id")       String   tenantId,
        @JsonProperty("subject_id")      String   subjectId,
        @JsonProperty("job_kind")        String   jobKind,
        @JsonProperty("pipeline")        String   pipeline,
        @JsonProperty("input_reference") String   inputReference,
        @JsonProperty("input")           JsonNode input
) {}
