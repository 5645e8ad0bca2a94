package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.model.usage.ModelUsage;
import com.llmrelay.relay_backend.model.usage.UsageAggregate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running usage totals shared by every request handled on one side of the relay.
 *
 * <p>Append-or-increment only; nothing is ever evicted, so the latency list grows for the life
 * of the process. All access goes through the instance monitor.
 */
public class UsageAggregator {

    private long totalRequests;
    private long totalTokens;
    private double totalCost;
    private final Map<String, ModelUsage> perModel = new LinkedHashMap<>();
    private final List<Duration> latencies = new ArrayList<>();

    public synchronized void record(String model, int totalTokens, int promptTokens, int completionTokens,
                                    double cost, Duration latency) {
        this.totalRequests++;
        this.totalTokens += totalTokens;
        this.totalCost += cost;
        this.latencies.add(latency != null ? latency : Duration.ZERO);
        perModel.merge(model != null ? model : "unknown",
                ModelUsage.EMPTY.plus(totalTokens, cost),
                (current, ignored) -> current.plus(totalTokens, cost));
    }

    public synchronized UsageAggregate snapshot() {
        return new UsageAggregate(totalRequests, totalTokens, totalCost, perModel, latencies);
    }

    public synchronized long getTotalRequests() {
        return totalRequests;
    }
}
