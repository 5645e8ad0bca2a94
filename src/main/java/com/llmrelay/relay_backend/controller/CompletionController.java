package com.llmrelay.relay_backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.dto.ConfigResponse;
import com.llmrelay.relay_backend.model.dto.FailureResponse;
import com.llmrelay.relay_backend.model.dto.HealthResponse;
import com.llmrelay.relay_backend.model.dto.ProcessRequest;
import com.llmrelay.relay_backend.model.dto.ProcessResponse;
import com.llmrelay.relay_backend.model.dto.ProviderListing;
import com.llmrelay.relay_backend.model.dto.UsageDto;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.llm.ProviderHealth;
import com.llmrelay.relay_backend.model.llm.StreamChunk;
import com.llmrelay.relay_backend.model.usage.UsageAggregate;
import com.llmrelay.relay_backend.provider.ChunkStream;
import com.llmrelay.relay_backend.provider.CompletionProvider;
import com.llmrelay.relay_backend.provider.ProviderRegistry;
import com.llmrelay.relay_backend.service.CompletionOrchestrator;
import com.llmrelay.relay_backend.service.CompletionOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;

/** Responder endpoints: completions, streaming, and what the active provider looks like. */
@Slf4j
@RestController
@RequestMapping("/api/completions")
@RequiredArgsConstructor
public class CompletionController {

    static final String SERVER_NAME = "responder";
    static final String DONE = "[DONE]";

    private final CompletionOrchestrator orchestrator;
    private final ProviderRegistry registry;
    private final RelayProperties props;
    private final ObjectMapper mapper;

    /** POST /api/completions/process — one full completion, or a classified failure. */
    @PostMapping("/process")
    public ResponseEntity<?> process(@Valid @RequestBody ProcessRequest request) {
        CompletionOutcome outcome = orchestrator.handle(request);
        if (!outcome.isSuccess()) {
            return ResponseEntity.status(outcome.getErrorKind().getHttpStatus())
                    .body(FailureResponse.of(outcome.getErrorKind(), outcome.getErrorMessage(),
                            outcome.getUpstreamStatus(), outcome.getTimestamp().toString()));
        }
        CompletionResult result = outcome.getResult();
        UsageDto usage = new UsageDto(result.getPromptTokens(), result.getCompletionTokens(),
                result.getTotalTokens(), outcome.getCost().cost());
        return ResponseEntity.ok(new ProcessResponse(
                ProcessResponse.SUCCESS,
                result.getContent(),
                result.getResolvedModel(),
                usage,
                outcome.getTimestamp().toString(),
                outcome.processingSeconds(),
                registry.getType().getId()));
    }

    /**
     * POST /api/completions/stream — content frames, then {@code [DONE]};
     * a failure ends the stream with an error frame instead.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@Valid @RequestBody ProcessRequest request) {
        return Flux.using(
                        () -> orchestrator.stream(request),
                        chunks -> Flux.fromIterable(() -> chunks).map(this::toEvent),
                        ChunkStream::close)
                .subscribeOn(Schedulers.boundedElastic());
    }

    ServerSentEvent<String> toEvent(StreamChunk chunk) {
        String data = switch (chunk.getType()) {
            case CONTENT -> mapper.createObjectNode().put("content", chunk.getText()).toString();
            case END -> DONE;
            case ERROR -> mapper.createObjectNode()
                    .put("error", chunk.getError().getMessage())
                    .put("type", chunk.errorKind().name())
                    .toString();
        };
        return ServerSentEvent.<String>builder(data).build();
    }

    @GetMapping("/models")
    public ProviderListing models() {
        CompletionProvider provider = registry.get();
        return new ProviderListing(provider.getType().getId(), provider.listModels(), provider.getDefaultModel(), provider.getNote());
    }

    /** Always 200; a provider that cannot be built or reached only degrades the status. */
    @GetMapping("/health")
    public HealthResponse health() {
        ProviderHealth ai;
        try {
            ai = registry.get().healthCheck();
        } catch (RuntimeException e) {
            ai = ProviderHealth.unhealthy(ProviderException.wrap(e).getMessage());
        }
        return new HealthResponse(
                ai.isHealthy() ? HealthResponse.HEALTHY : HealthResponse.DEGRADED,
                SERVER_NAME,
                Instant.now().toString(),
                orchestrator.getMessagesProcessed(),
                registry.getType().getId(),
                new HealthResponse.AiStatus(registry.isConfigured(), ai.status(), ai.error(), ai.note()));
    }

    @GetMapping("/config")
    public ConfigResponse config() {
        return new ConfigResponse(registry.getType().getId(), registry.configuredDefaultModel(),
                props.getTemperature(), props.getMaxTokens());
    }

    @GetMapping("/usage")
    public UsageAggregate usage() {
        return orchestrator.getUsage().snapshot();
    }
}
