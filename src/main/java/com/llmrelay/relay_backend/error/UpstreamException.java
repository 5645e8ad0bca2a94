package com.llmrelay.relay_backend.error;

/** The backend answered, but not with a usable completion. */
public class UpstreamException extends ProviderException {

    public UpstreamException(int status, String message) {
        super(ErrorKind.fromStatus(status), message, status, null);
    }

    public UpstreamException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, null, cause);
    }
}
