package com.ottoai.analysis.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an {@link AnalysisJob}.
 *
 * Transitions:
 *   PENDING → RUNNING                      (external service acknowledged the submission)
 *   PENDING/RUNNING → SUCCEEDED | FAILED   (CompletionCoordinator only)
 *   PENDING/RUNNING → TIMEOUT              (RetrySupervisor, through the CompletionCoordinator)
 *   FAILED/TIMEOUT → PENDING               (bounded retry cycle)
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMEOUT;

    public static final Set<JobStatus> ACTIVE   = EnumSet.of(PENDING, RUNNING);
    public static final Set<JobStatus> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, TIMEOUT);
    public static final Set<JobStatus> RETRYABLE = EnumSet.of(FAILED, TIMEOUT);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
