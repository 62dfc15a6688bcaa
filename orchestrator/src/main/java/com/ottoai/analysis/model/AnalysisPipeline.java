package com.ottoai.analysis.model;

/**
 * Pipeline name the external analysis service expects for a {@link JobKind}.
 */
public enum AnalysisPipeline {
    TRANSCRIPTION("transcription"),
    ANALYSIS("analysis"),
    SEGMENTATION("segmentation");

    private final String wireName;

    AnalysisPipeline(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
