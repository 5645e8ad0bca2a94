package com.llmrelay.relay_backend.model.usage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a {@code UsageAggregator}. Immutable.
 */
public record UsageAggregate(long totalRequests,
                             long totalTokens,
                             double totalCost,
                             Map<String, ModelUsage> perModel,
                             @JsonIgnore List<Duration> latencies) {

    public UsageAggregate {
        perModel = Map.copyOf(perModel);
        latencies = List.copyOf(latencies);
    }

    /** Arithmetic mean of recorded latencies, zero when none were recorded. */
    public Duration averageLatency() {
        if (latencies.isEmpty()) return Duration.ZERO;
        long totalNanos = 0;
        for (Duration d : latencies) totalNanos += d.toNanos();
        return Duration.ofNanos(totalNanos / latencies.size());
    }

    @JsonProperty("averageLatencySeconds")
    public double averageLatencySeconds() {
        return averageLatency().toNanos() / 1_000_000_000.0;
    }

    @JsonProperty("recordedLatencies")
    public int recordedLatencies() {
        return latencies.size();
    }
}
