package com.llmrelay.relay_backend.error;

/**
 * Classification of everything that can go wrong between a caller and a completion backend.
 * Each kind knows whether retrying can help and which HTTP status the responder answers with.
 */
public enum ErrorKind {

    CONFIGURATION(false, 503),
    CONNECTIVITY(true, 502),
    TIMEOUT(true, 504),
    UPSTREAM_AUTH(false, 502),
    UPSTREAM_RATE_LIMIT(true, 429),
    UPSTREAM_SERVER(true, 502),
    UPSTREAM_REJECTED(false, 502),   // other 4xx, or a body we could not read
    INTERNAL(false, 500);

    private final boolean retryable;
    private final int httpStatus;

    ErrorKind(boolean retryable, int httpStatus) {
        this.retryable  = retryable;
        this.httpStatus = httpStatus;
    }

    public boolean isRetryable() { return retryable; }
    public int getHttpStatus()   { return httpStatus; }

    public static ErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) return UPSTREAM_AUTH;
        if (status == 408) return TIMEOUT;
        if (status == 429) return UPSTREAM_RATE_LIMIT;
        if (status >= 500) return UPSTREAM_SERVER;
        return UPSTREAM_REJECTED;
    }

    /** Lenient parse of a kind name received over the wire; unknown names map to INTERNAL. */
    public static ErrorKind parse(String name) {
        if (name == null || name.isBlank()) return INTERNAL;
        try {
            return ErrorKind.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}
