package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.usage.CostRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * What the orchestrator hands back for one request: either a result with its cost,
 * or a classified failure. Exactly one side is populated.
 */
public class CompletionOutcome {

    private final boolean success;
    private final CompletionResult result;
    private final CostRecord cost;
    private final Duration processingTime;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final Integer upstreamStatus;
    private final Instant timestamp;

    private CompletionOutcome(boolean success, CompletionResult result, CostRecord cost, Duration processingTime,
                              ErrorKind errorKind, String errorMessage, Integer upstreamStatus) {
        this.success        = success;
        this.result         = result;
        this.cost           = cost;
        this.processingTime = processingTime;
        this.errorKind      = errorKind;
        this.errorMessage   = errorMessage;
        this.upstreamStatus = upstreamStatus;
        this.timestamp      = Instant.now();
    }

    public static CompletionOutcome ok(CompletionResult result, CostRecord cost, Duration processingTime) {
        return new CompletionOutcome(true, result, cost, processingTime, null, null, null);
    }

    public static CompletionOutcome error(ProviderException e, Duration processingTime) {
        return new CompletionOutcome(false, null, null, processingTime,
                e.getKind(), e.getMessage(), e.getUpstreamStatus());
    }

    public boolean isSuccess()          { return success; }
    public CompletionResult getResult() { return result; }
    public CostRecord getCost()         { return cost; }
    public Duration getProcessingTime() { return processingTime; }
    public ErrorKind getErrorKind()     { return errorKind; }
    public String getErrorMessage()     { return errorMessage; }
    public Integer getUpstreamStatus()  { return upstreamStatus; }
    public Instant getTimestamp()       { return timestamp; }

    /** Seconds, rounded to three decimals. */
    public double processingSeconds() {
        return Math.round(processingTime.toNanos() / 1_000_000.0) / 1000.0;
    }
}
