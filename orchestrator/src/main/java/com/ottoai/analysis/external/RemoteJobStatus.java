package com.ottoai.analysis.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.ottoai.analysis.model.RemoteJobState;

/**
 * Result of a status poll.
 *
 * @param output result body when the job finished; may be null
 * @param error  error text reported by the service; may be null
 */
public record RemoteJobStatus(RemoteJobState state, JsonNode output, String error) {

    public static RemoteJobStatus notFound() {
        return new RemoteJobStatus(RemoteJobState.NOT_FOUND, null, null);
    }
}
