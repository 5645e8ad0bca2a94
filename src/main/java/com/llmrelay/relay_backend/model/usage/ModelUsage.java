package com.llmrelay.relay_backend.model.usage;

/** Per-model slice of the running totals. */
public record ModelUsage(long requests, long tokens, double cost) {

    public static final ModelUsage EMPTY = new ModelUsage(0, 0, 0.0);

    public ModelUsage plus(long tokens, double cost) {
        return new ModelUsage(this.requests + 1, this.tokens + tokens, this.cost + cost);
    }
}
