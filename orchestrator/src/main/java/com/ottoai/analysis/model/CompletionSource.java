package com.ottoai.analysis.model;

/** Which path delivered a completion candidate. Used for logs and metrics only. */
public enum CompletionSource {
    WEBHOOK,
    POLLER,
    SUPERVISOR,
    SUBMITTER
}
