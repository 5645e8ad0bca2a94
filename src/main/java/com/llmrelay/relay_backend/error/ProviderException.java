package com.llmrelay.relay_backend.error;

/**
 * Raised by completion providers. Always carries an {@link ErrorKind} so callers can decide
 * between surfacing and retrying without inspecting messages.
 */
public class ProviderException extends RuntimeException {

    private final ErrorKind kind;
    private final Integer upstreamStatus;

    public ProviderException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ProviderException(ErrorKind kind, String message, Integer upstreamStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.upstreamStatus = upstreamStatus;
    }

    public ErrorKind getKind()          { return kind; }
    public Integer getUpstreamStatus()  { return upstreamStatus; }
    public boolean isRetryable()        { return kind.isRetryable(); }

    /** Wraps anything that is not already a ProviderException as {@link ErrorKind#INTERNAL}. */
    public static ProviderException wrap(Throwable t) {
        if (t instanceof ProviderException pe) return pe;
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new ProviderException(ErrorKind.INTERNAL, msg, null, t);
    }
}
