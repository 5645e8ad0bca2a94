package com.llmrelay.relay_backend.dispatch;

import lombok.Data;

import java.time.Duration;

/**
 * Retry budget for outbound calls to the responder.
 *
 * <pre>
 * maxAttempts = 3, backoffUnit = 1s  →  attempt, wait 1s, attempt, wait 2s, attempt
 * </pre>
 */
@Data
public class RetryPolicy {

    /** Total attempts, the first one included. Clamped to [1, 10]. */
    private int maxAttempts = 3;

    /** Attempt i (0-indexed) waits 2^i units before attempt i+1. */
    private Duration backoffUnit = Duration.ofSeconds(1);

    public RetryPolicy() {}

    public RetryPolicy(int maxAttempts, Duration backoffUnit) {
        this.maxAttempts = maxAttempts;
        this.backoffUnit = backoffUnit;
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public int effectiveAttempts() {
        return Math.max(1, Math.min(10, maxAttempts));
    }

    public Duration backoffAfter(int attemptIndex) {
        Duration unit = backoffUnit != null && !backoffUnit.isNegative() ? backoffUnit : Duration.ZERO;
        return unit.multipliedBy(1L << attemptIndex);
    }
}
