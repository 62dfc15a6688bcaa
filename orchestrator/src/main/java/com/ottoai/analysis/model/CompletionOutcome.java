package com.ottoai.analysis.model;

import java.util.Locale;

/**
 * Result of one call to the completion coordinator.
 *
 * Only APPLIED changes the job and fires downstream side effects.
 */
public enum CompletionOutcome {
    APPLIED,
    SKIPPED_DUPLICATE,
    SKIPPED_TERMINAL,
    SKIPPED_STALE,
    LOCK_BUSY,
    NOT_FOUND;

    /** Lowercase name used in webhook responses and metric tags. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
