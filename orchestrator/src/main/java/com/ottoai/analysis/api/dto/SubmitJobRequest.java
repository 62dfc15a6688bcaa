package com.ottoai.analysis.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /api/v1/analysis/jobs.
 *
 * Required: subjectId, jobKind ("csr_call", "sales_visit", "segmentation"),
 *   inputPayload with an absolute http(s) "input_reference".
 * The tenant comes from the X-Tenant-ID header, not the body.
 */
public record SubmitJobRequest(String subjectId, String jobKind, JsonNode inputPayload) {}
