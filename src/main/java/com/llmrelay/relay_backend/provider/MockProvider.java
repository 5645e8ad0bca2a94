package com.llmrelay.relay_backend.provider;

import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.domain.ProviderType;
import com.llmrelay.relay_backend.model.llm.CompletionRequest;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.llm.ProviderHealth;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic provider for exercising the relay without a live backend.
 *
 * <p>Token counts are a fixed heuristic (two tokens per whitespace-separated word), not a
 * tokenizer. Tests depend on the exact numbers.
 */
@Slf4j
public class MockProvider implements CompletionProvider {

    public static final String MODEL = "mock-model";
    static final String NOTE = "Mock provider for testing - no external API calls";
    static final Duration DEFAULT_LATENCY = Duration.ofMillis(100);
    static final Duration DEFAULT_WORD_DELAY = Duration.ofMillis(50);

    private final AtomicInteger requestCount = new AtomicInteger();
    private final Executor streamExecutor;
    private final Duration latency;
    private final Duration wordDelay;

    public MockProvider(Executor streamExecutor) {
        this(streamExecutor, DEFAULT_LATENCY, DEFAULT_WORD_DELAY);
    }

    public MockProvider(Executor streamExecutor, Duration latency, Duration wordDelay) {
        this.streamExecutor = streamExecutor;
        this.latency   = latency != null ? latency : DEFAULT_LATENCY;
        this.wordDelay = wordDelay != null ? wordDelay : DEFAULT_WORD_DELAY;
    }

    @Override
    public ProviderType getType() { return ProviderType.MOCK; }

    @Override
    public String getDefaultModel() { return MODEL; }

    @Override
    public List<String> listModels() { return List.of(MODEL); }

    @Override
    public String getNote() { return NOTE; }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        int n = requestCount.incrementAndGet();
        pause(latency);

        String userMessage = request.firstUserMessage();
        String response = "[MOCK RESPONSE #" + n + "] You said: '" + userMessage
                + "'. This is a test response without calling any external API.";

        int promptTokens = wordCount(userMessage) * 2;
        int completionTokens = wordCount(response) * 2;
        log.debug("[Mock] request #{} promptTokens={} completionTokens={}", n, promptTokens, completionTokens);
        return CompletionResult.of(response, promptTokens, completionTokens, MODEL);
    }

    @Override
    public ChunkStream completeStreaming(CompletionRequest request) {
        int n = requestCount.incrementAndGet();
        String userMessage = request.firstUserMessage();
        String text = "[MOCK STREAM #" + n + "] You said: '" + userMessage + "'. This is a streaming test response.";
        List<String> words = words(text);
        return ChunkStream.open(streamExecutor, sink -> {
            for (String word : words) {
                Thread.sleep(wordDelay.toMillis());
                sink.emit(word + " ");
            }
        });
    }

    @Override
    public ProviderHealth healthCheck() {
        return ProviderHealth.healthy("Mock provider - no external API");
    }

    int getRequestCount() {
        return requestCount.get();
    }

    static int wordCount(String text) {
        return words(text).size();
    }

    private static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        return List.of(text.trim().split("\\s+"));
    }

    private static void pause(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ErrorKind.INTERNAL, "Mock completion interrupted", null, e);
        }
    }
}
