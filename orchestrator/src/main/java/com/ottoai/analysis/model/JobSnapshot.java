package com.ottoai.analysis.model;

/**
 * The part of a job's state the completion rules look at.
 *
 * @param externalJobId id of the current external attempt; null while unsubmitted
 */
public record JobSnapshot(JobStatus status, String outputHash, String externalJobId) {

    public JobSnapshot(JobStatus status, String outputHash) {
        this(status, outputHash, null);
    }
}
