package com.llmrelay.relay_backend.dispatch;

/**
 * Lifecycle of one dispatcher call: ATTEMPTING, then SUCCESS, or RETRY back into ATTEMPTING,
 * or EXHAUSTED. SUCCESS and EXHAUSTED are terminal.
 */
public enum DispatchState {
    ATTEMPTING,
    RETRY,
    SUCCESS,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXHAUSTED;
    }
}
