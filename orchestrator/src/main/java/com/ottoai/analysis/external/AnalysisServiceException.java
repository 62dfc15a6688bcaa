package com.ottoai.analysis.external;

/**
 * Thrown when the external analysis service returns an error or is unreachable.
 */
public class AnalysisServiceException extends RuntimeException {

    public enum Kind {
        /** Timeout, I/O error, 5xx, 408, 429. Worth another attempt. */
        TRANSIENT,
        /** The service refused the request (other 4xx, unusable response). */
        REJECTED,
        /** The service does not know the job (404 on status). */
        NOT_FOUND
    }

    private final Kind kind;
    private final int  httpStatus;

    public AnalysisServiceException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public AnalysisServiceException(Kind kind, String message, Throwable cause) {
        this(kind, message, 0, cause);
    }

    public AnalysisServiceException(Kind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.httpStatus = httpStatus;
    }

    public Kind getKind()       { return kind; }
    public int  getHttpStatus() { return httpStatus; }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

    /** Classify a non-2xx HTTP status. */
    static Kind classify(int httpStatus) {
        if (httpStatus >= 500 || httpStatus == 408 || httpStatus == 429) return Kind.TRANSIENT;
        if (httpStatus == 404) return Kind.NOT_FOUND;
        return Kind.REJECTED;
    }
}
