package com.ottoai.analysis.model;

/**
 * CRM entity a job result is written back to.
 */
public enum SubjectType {
    CALL,
    RECORDING_SESSION
}
