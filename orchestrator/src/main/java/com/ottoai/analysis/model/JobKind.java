package com.ottoai.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * What kind of analysis a job asks for.
 *
 * The subject type and external pipeline are exhaustive switches, so adding a
 * kind without deciding both mappings does not compile.
 */
public enum JobKind {
    CSR_CALL("csr_call"),
    SALES_VISIT("sales_visit"),
    SEGMENTATION("segmentation");

    private final String wireName;

    JobKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public SubjectType subjectType() {
        return switch (this) {
            case CSR_CALL     -> SubjectType.CALL;
            case SALES_VISIT  -> SubjectType.RECORDING_SESSION;
            case SEGMENTATION -> SubjectType.RECORDING_SESSION;
        };
    }

    public AnalysisPipeline pipeline() {
        return switch (this) {
            case CSR_CALL     -> AnalysisPipeline.TRANSCRIPTION;
            case SALES_VISIT  -> AnalysisPipeline.ANALYSIS;
            case SEGMENTATION -> AnalysisPipeline.SEGMENTATION;
        };
    }

    /** Parse a wire name ("csr_call") or enum name ("CSR_CALL"); empty if unknown. */
    public static Optional<JobKind> fromWire(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(normalized))
                .findFirst();
    }
}
