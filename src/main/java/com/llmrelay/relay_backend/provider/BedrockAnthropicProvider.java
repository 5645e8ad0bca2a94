package com.llmrelay.relay_backend.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.error.ConfigurationException;
import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.error.UpstreamException;
import com.llmrelay.relay_backend.model.domain.ProviderType;
import com.llmrelay.relay_backend.model.llm.ChatMessage;
import com.llmrelay.relay_backend.model.llm.CompletionRequest;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.llm.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrock.BedrockClient;
import software.amazon.awssdk.services.bedrock.model.ListFoundationModelsRequest;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponseHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Anthropic models on AWS Bedrock.
 *
 * <p>The system message travels as a top-level {@code system} field, the rest keep their
 * role/content. The SDK's runtime call is blocking, so it always runs on the worker executor
 * and the caller only waits on the future.
 */
public class BedrockAnthropicProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(BedrockAnthropicProvider.class);
    static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";
    private static final String JSON = "application/json";

    private final BedrockRuntimeClient runtime;
    private final BedrockRuntimeAsyncClient streamingRuntime;
    private final BedrockClient controlPlane;
    private final String defaultModel;
    private final Map<String, String> modelAliases;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Executor worker;

    public BedrockAnthropicProvider(BedrockRuntimeClient runtime,
                                    BedrockRuntimeAsyncClient streamingRuntime,
                                    BedrockClient controlPlane,
                                    String defaultModel,
                                    Map<String, String> modelAliases,
                                    Duration timeout,
                                    ObjectMapper mapper,
                                    Executor worker) {
        if (runtime == null || streamingRuntime == null) {
            throw new ConfigurationException("Bedrock runtime clients are not configured");
        }
        this.runtime = runtime;
        this.streamingRuntime = streamingRuntime;
        this.controlPlane = controlPlane;
        this.defaultModel = defaultModel != null ? defaultModel : "";
        this.modelAliases = modelAliases != null ? Map.copyOf(modelAliases) : Map.of();
        this.timeout = timeout;
        this.mapper = mapper;
        this.worker = worker;
    }

    @Override
    public ProviderType getType() { return ProviderType.BEDROCK; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    /** The configured short names, in configuration order. */
    @Override
    public List<String> listModels() { return new ArrayList<>(modelAliases.keySet()); }

    String resolveModel(String model) {
        String requested = model != null && !model.isBlank() ? model : defaultModel;
        if (requested == null || requested.isBlank()) {
            throw new ProviderException(ErrorKind.CONFIGURATION,
                    "No Bedrock model requested and relay.bedrock.default-model is empty");
        }
        return modelAliases.getOrDefault(requested, requested);
    }

    @Override
    public CompletionResult complete(CompletionRequest req) {
        String modelId = resolveModel(req.getModel());
        InvokeModelRequest invoke = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType(JSON)
                .accept(JSON)
                .body(SdkBytes.fromUtf8String(toJson(buildBody(req))))
                .build();

        InvokeModelResponse response = offload(() -> runtime.invokeModel(invoke), modelId);
        JsonNode body = readTree(response.body().asUtf8String());

        String content = "";
        JsonNode blocks = body.path("content");
        if (blocks.isArray() && !blocks.isEmpty()) {
            content = blocks.get(0).path("text").asText("");
        }
        JsonNode usage = body.path("usage");
        int inputTokens = usage.path("input_tokens").asInt(0);
        int outputTokens = usage.path("output_tokens").asInt(0);
        return CompletionResult.of(content, inputTokens, outputTokens, modelId);
    }

    @Override
    public ChunkStream completeStreaming(CompletionRequest req) {
        String modelId;
        String json;
        try {
            modelId = resolveModel(req.getModel());
            json = toJson(buildBody(req));
        } catch (ProviderException e) {
            return ChunkStream.failed(e);
        }
        InvokeModelWithResponseStreamRequest invoke = InvokeModelWithResponseStreamRequest.builder()
                .modelId(modelId)
                .contentType(JSON)
                .accept(JSON)
                .body(SdkBytes.fromUtf8String(json))
                .build();

        return ChunkStream.open(worker, sink -> {
            // SDK callbacks run on its own threads; hand payloads over without blocking them
            BlockingQueue<Object> events = new LinkedBlockingQueue<>();
            Object completed = new Object();
            InvokeModelWithResponseStreamResponseHandler handler = InvokeModelWithResponseStreamResponseHandler.builder()
                    .subscriber(InvokeModelWithResponseStreamResponseHandler.Visitor.builder()
                            .onChunk(part -> events.add(part.bytes().asUtf8String()))
                            .build())
                    .onError(events::add)
                    .onComplete(() -> events.add(completed))
                    .build();

            CompletableFuture<Void> call = streamingRuntime.invokeModelWithResponseStream(invoke, handler);
            try {
                while (true) {
                    Object event = events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (event == null) {
                        throw new ProviderException(ErrorKind.TIMEOUT,
                                "Bedrock stream produced nothing for " + timeout.toSeconds() + "s");
                    }
                    if (event == completed) break;
                    if (event instanceof Throwable t) throw translate(t, modelId);
                    String text = extractTextDelta((String) event);
                    if (text != null) sink.emit(text);
                }
            } finally {
                if (!call.isDone()) call.cancel(true);
            }
        });
    }

    @Override
    public ProviderHealth healthCheck() {
        if (controlPlane == null) {
            return ProviderHealth.unhealthy("Bedrock control-plane client is not configured");
        }
        try {
            offload(() -> controlPlane.listFoundationModels(ListFoundationModelsRequest.builder().build()), "-");
            return ProviderHealth.healthy();
        } catch (RuntimeException e) {
            return ProviderHealth.unhealthy(ProviderException.wrap(e).getMessage());
        }
    }

    // ── wire format ──────────────────────────────────────────────────────────

    Map<String, Object> buildBody(CompletionRequest req) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage m : req.conversationMessages()) {
            messages.add(Map.of("role", m.role().wireName(), "content", m.content()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("anthropic_version", ANTHROPIC_VERSION);
        body.put("max_tokens", req.getMaxTokens());
        body.put("temperature", req.getTemperature());
        body.put("messages", messages);
        req.systemPrompt()
                .filter(s -> !s.isEmpty())
                .ifPresent(s -> body.put("system", s));
        return body;
    }

    /** Text of a {@code content_block_delta}/{@code text_delta} event; null for every other event type. */
    String extractTextDelta(String eventJson) {
        JsonNode event = readTree(eventJson);
        if (!"content_block_delta".equals(event.path("type").asText())) return null;
        JsonNode delta = event.path("delta");
        if (!"text_delta".equals(delta.path("type").asText())) return null;
        return delta.path("text").asText("");
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private <T> T offload(Supplier<T> call, String modelId) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, worker);
        } catch (RejectedExecutionException e) {
            log.error("[Bedrock] Worker pool rejected the call for model '{}'", modelId);
            throw new ProviderException(ErrorKind.INTERNAL, "Bedrock worker pool is saturated", null, e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[Bedrock] Timed out after {} for model '{}'", timeout, modelId);
            throw new ProviderException(ErrorKind.TIMEOUT, "Bedrock call timed out after " + timeout.toSeconds() + "s", null, e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), modelId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ErrorKind.INTERNAL, "Interrupted while calling Bedrock", null, e);
        }
    }

    private ProviderException translate(Throwable t, String modelId) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException pe) return pe;
        if (cause instanceof AwsServiceException ase) {
            String msg = ase.awsErrorDetails() != null && ase.awsErrorDetails().errorMessage() != null
                    ? ase.awsErrorDetails().errorMessage() : ase.getMessage();
            log.error("[Bedrock] HTTP {} for model '{}': {}", ase.statusCode(), modelId, msg);
            return new UpstreamException(ase.statusCode(), "Bedrock error " + ase.statusCode() + ": " + msg);
        }
        if (cause instanceof ApiCallTimeoutException || cause instanceof ApiCallAttemptTimeoutException) {
            return new ProviderException(ErrorKind.TIMEOUT, "Bedrock call timed out: " + cause.getMessage(), null, cause);
        }
        if (cause instanceof SdkClientException) {
            log.error("[Bedrock] Client error for model '{}': {}", modelId, cause.getMessage());
            return new ProviderException(ErrorKind.CONNECTIVITY, "Cannot reach Bedrock: " + cause.getMessage(), null, cause);
        }
        return ProviderException.wrap(cause);
    }

    private String toJson(Map<String, Object> body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.INTERNAL, "Could not serialise Bedrock request", null, e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(ErrorKind.UPSTREAM_REJECTED, "Malformed Bedrock payload", e);
        }
    }
}
