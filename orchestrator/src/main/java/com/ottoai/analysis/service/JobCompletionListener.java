package com.ottoai.analysis.service;

import com.ottoai.analysis.model.JobCompletedEvent;
import com.ottoai.analysis.model.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Downstream side of an applied completion. Runs once per applied transition,
 * never for skipped or lock-busy outcomes.
 *
 * Retry exhaustion is reported here as a counter rather than an exception so
 * operators can alert on it.
 */
@Component
public class JobCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(JobCompletionListener.class);

    private final MeterRegistry meterRegistry;

    public JobCompletionListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void onJobCompleted(JobCompletedEvent event) {
        meterRegistry.counter("analysis.jobs.completed",
                "kind",   event.jobKind().wireName(),
                "status", event.status().name().toLowerCase()).increment();

        if (event.status() != JobStatus.SUCCEEDED && event.permanent()) {
            meterRegistry.counter("analysis.jobs.retries.exhausted",
                    "kind", event.jobKind().wireName()).increment();
            log.error("Job {} permanently {} after {} retries ({} {} in tenant {})",
                    event.jobId(), event.status(), event.retryCount(),
                    event.subjectType(), event.subjectId(), event.tenantId());
            return;
        }

        log.info("Job {} {} for {} {} (tenant={}, via {})",
                event.jobId(), event.status(), event.subjectType(), event.subjectId(),
                event.tenantId(), event.source());
    }
}
