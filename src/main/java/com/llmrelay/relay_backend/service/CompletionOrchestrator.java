package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.dto.ProcessRequest;
import com.llmrelay.relay_backend.model.llm.ChatMessage;
import com.llmrelay.relay_backend.model.llm.CompletionRequest;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.usage.CostRecord;
import com.llmrelay.relay_backend.provider.ChunkStream;
import com.llmrelay.relay_backend.provider.CompletionProvider;
import com.llmrelay.relay_backend.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Responder side of the relay: turns one incoming message into one provider call.
 *
 * <p>Per request, strictly in this order: build messages, call the provider, price the result
 * by the model the provider actually used, record usage. Provider failures never escape
 * {@link #handle}; they come back as a failed {@link CompletionOutcome}.
 */
@Slf4j
@Service
public class CompletionOrchestrator {

    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful AI assistant.";

    private final ProviderRegistry registry;
    private final CostEstimator costEstimator;
    private final UsageAggregator usage;
    private final RelayProperties props;
    private final AtomicLong messagesProcessed = new AtomicLong();

    public CompletionOrchestrator(ProviderRegistry registry,
                                  CostEstimator costEstimator,
                                  @Qualifier("responderUsage") UsageAggregator usage,
                                  RelayProperties props) {
        this.registry = registry;
        this.costEstimator = costEstimator;
        this.usage = usage;
        this.props = props;
    }

    public CompletionOutcome handle(ProcessRequest req) {
        long start = System.nanoTime();
        try {
            CompletionProvider provider = registry.get();
            CompletionRequest request = buildRequest(req, provider);

            CompletionResult result = provider.complete(request);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            CostRecord cost = costEstimator.record(result.getResolvedModel(),
                    result.getPromptTokens(), result.getCompletionTokens());
            usage.record(result.getResolvedModel(), result.getTotalTokens(),
                    result.getPromptTokens(), result.getCompletionTokens(), cost.cost(), elapsed);

            log.debug("Completion via {} model={} tokens={} cost={} in {} ms",
                    provider.getType().getId(), result.getResolvedModel(), result.getTotalTokens(),
                    cost.cost(), elapsed.toMillis());
            messagesProcessed.incrementAndGet();
            return CompletionOutcome.ok(result, cost, elapsed);

        } catch (RuntimeException e) {
            ProviderException pe = ProviderException.wrap(e);
            log.warn("Completion failed ({}): {}", pe.getKind(), pe.getMessage());
            return CompletionOutcome.error(pe, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Same message construction as {@link #handle}, but chunks are handed straight to the caller.
     * A provider that cannot be built yields a stream holding only the error.
     */
    public ChunkStream stream(ProcessRequest req) {
        try {
            CompletionProvider provider = registry.get();
            return provider.completeStreaming(buildRequest(req, provider));
        } catch (RuntimeException e) {
            ProviderException pe = ProviderException.wrap(e);
            log.warn("Streaming completion could not start ({}): {}", pe.getKind(), pe.getMessage());
            return ChunkStream.failed(pe);
        }
    }

    CompletionRequest buildRequest(ProcessRequest req, CompletionProvider provider) {
        String system = req.context() != null && !req.context().isBlank() ? req.context() : DEFAULT_SYSTEM_PROMPT;
        List<ChatMessage> messages = List.of(ChatMessage.system(system), ChatMessage.user(req.message()));

        String model = req.model() != null && !req.model().isBlank() ? req.model() : provider.getDefaultModel();
        double temperature = req.temperature() != null ? req.temperature() : props.getTemperature();
        int maxTokens = req.maxTokens() != null ? req.maxTokens() : props.getMaxTokens();

        return new CompletionRequest(messages, model, temperature, maxTokens);
    }

    public UsageAggregator getUsage() {
        return usage;
    }

    /** Successful {@link #handle} calls only; streams and failures are not counted. */
    public long getMessagesProcessed() {
        return messagesProcessed.get();
    }
}
