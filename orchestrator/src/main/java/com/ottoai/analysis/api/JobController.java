package com.ottoai.analysis.api;

import com.ottoai.analysis.api.dto.JobResponse;
import com.ottoai.analysis.api.dto.SubmitJobRequest;
import com.ottoai.analysis.model.AnalysisJob;
import com.ottoai.analysis.service.AnalysisJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for analysis jobs. Every call is scoped to the X-Tenant-ID tenant.
 *
 * POST /api/v1/analysis/jobs        submit (idempotent per subject and kind)
 * GET  /api/v1/analysis/jobs/{id}   current state of a job
 */
@RestController
@RequestMapping("/api/v1/analysis/jobs")
public class JobController {

    static final String TENANT_HEADER = "X-Tenant-ID";

    private final AnalysisJobService jobService;

    public JobController(AnalysisJobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Submit an analysis job. Returns 202: the result arrives asynchronously.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/analysis/jobs \
     *     -H "Content-Type: application/json" -H "X-Tenant-ID: t1" \
     *     -d '{"subjectId":"call-42","jobKind":"csr_call",
     *          "inputPayload":{"input_reference":"https://media.example.com/call-42.wav"}}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestHeader(TENANT_HEADER) String tenantId,
                                              @RequestBody SubmitJobRequest req) {
        AnalysisJob job = jobService.submit(tenantId, req.subjectId(), req.jobKind(), req.inputPayload());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
    }

    /**
     * Returns 404 if the job does not exist in the caller's tenant.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@RequestHeader(TENANT_HEADER) String tenantId, @PathVariable UUID id) {
        return jobService.findJob(tenantId, id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }
}
