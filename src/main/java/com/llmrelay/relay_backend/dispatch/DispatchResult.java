package com.llmrelay.relay_backend.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmrelay.relay_backend.error.ErrorKind;

/**
 * Tagged result of a dispatcher call. The dispatcher never throws on remote failure;
 * callers branch on {@link #isSuccess()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult<T> {

    private final DispatchState state;
    private final T value;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final Integer httpStatus;
    private final int attempts;

    private DispatchResult(DispatchState state, T value, ErrorKind errorKind, String errorMessage,
                           Integer httpStatus, int attempts) {
        this.state        = state;
        this.value        = value;
        this.errorKind    = errorKind;
        this.errorMessage = errorMessage;
        this.httpStatus   = httpStatus;
        this.attempts     = attempts;
    }

    public static <T> DispatchResult<T> success(T value, int attempts) {
        return new DispatchResult<>(DispatchState.SUCCESS, value, null, null, null, attempts);
    }

    public static <T> DispatchResult<T> failure(ErrorKind kind, String message, Integer httpStatus, int attempts) {
        return new DispatchResult<>(DispatchState.EXHAUSTED, null, kind, message, httpStatus, attempts);
    }

    public boolean isSuccess()       { return state == DispatchState.SUCCESS; }
    public DispatchState getState()  { return state; }
    public T getValue()              { return value; }
    public ErrorKind getErrorKind()  { return errorKind; }
    public String getErrorMessage()  { return errorMessage; }
    public Integer getHttpStatus()   { return httpStatus; }
    public int getAttempts()         { return attempts; }
}
