package com.ottoai.analysis.service;

import com.ottoai.analysis.config.AnalysisProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay: {@code base * 2^retryCount * jitter}, jitter uniform in
 * [0.5, 1.5), capped at the configured maximum.
 */
@Component
public class BackoffPolicy {

    private static final int MAX_EXPONENT = 30;

    private final Duration       base;
    private final Duration       max;
    private final DoubleSupplier jitter;

    @Autowired
    public BackoffPolicy(AnalysisProperties properties) {
        this(properties.getJobs().getBackoffBase(),
             properties.getJobs().getBackoffMax(),
             () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    }

    BackoffPolicy(Duration base, Duration max, DoubleSupplier jitter) {
        this.base   = base;
        this.max    = max;
        this.jitter = jitter;
    }

    public Duration delayFor(int retryCount) {
        int exponent = Math.min(Math.max(retryCount, 0), MAX_EXPONENT);
        double millis = base.toMillis() * Math.pow(2, exponent) * jitter.getAsDouble();
        long capped = (long) Math.min(millis, (double) max.toMillis());
        return Duration.ofMillis(capped);
    }

    public Instant nextAttemptAt(int retryCount, Instant now) {
        return now.plus(delayFor(retryCount));
    }
}
