package com.ottoai.analysis.model;

import java.util.Locale;

/**
 * Job state as reported by the external analysis service, either in a webhook
 * body or a status poll.
 */
public enum RemoteJobState {
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    NOT_FOUND;

    /**
     * Map the service's free-form status string.
     * Anything not recognised as finished is treated as still in flight.
     */
    public static RemoteJobState fromWire(String status) {
        if (status == null) return IN_FLIGHT;
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "completed", "succeeded", "success" -> SUCCEEDED;
            case "failed", "error"                   -> FAILED;
            case "not_found", "expired"              -> NOT_FOUND;
            default                                  -> IN_FLIGHT;
        };
    }
}
