package com.llmrelay.relay_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.error.ConfigurationException;
import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.llm.ChatMessage;
import com.llmrelay.relay_backend.model.llm.CompletionRequest;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.llm.StreamChunk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import reactor.core.publisher.Flux;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.async.SdkPublisher;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrock.BedrockClient;
import software.amazon.awssdk.services.bedrock.model.ListFoundationModelsRequest;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponseHandler;
import software.amazon.awssdk.services.bedrockruntime.model.ResponseStream;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class BedrockAnthropicProviderTest {

    private static final String HAIKU_ID = "anthropic.claude-3-haiku-20240307-v1:0";
    private static final String RESPONSE_JSON = """
            {"id":"msg_1","type":"message","role":"assistant",
             "content":[{"type":"text","text":"Four."}],
             "usage":{"input_tokens":21,"output_tokens":4}}
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private BedrockRuntimeClient runtime;
    private BedrockRuntimeAsyncClient streamingRuntime;
    private BedrockAnthropicProvider provider;

    @BeforeEach
    void setUp() {
        runtime = mock(BedrockRuntimeClient.class);
        streamingRuntime = mock(BedrockRuntimeAsyncClient.class);
        provider = new BedrockAnthropicProvider(runtime, streamingRuntime, null, HAIKU_ID,
                Map.of("claude-3-haiku", HAIKU_ID), Duration.ofSeconds(5), mapper, pool);
    }

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private static ResponseStream event(String json) {
        return ResponseStream.chunkBuilder().bytes(SdkBytes.fromUtf8String(json)).build();
    }

    private static List<StreamChunk> drain(ChunkStream stream) {
        List<StreamChunk> chunks = new ArrayList<>();
        try (stream) {
            stream.forEachRemaining(chunks::add);
        }
        return chunks;
    }

    private void givenStreamEvents(ResponseStream... events) {
        given(streamingRuntime.invokeModelWithResponseStream(any(InvokeModelWithResponseStreamRequest.class),
                any(InvokeModelWithResponseStreamResponseHandler.class))).willAnswer(inv -> {
            InvokeModelWithResponseStreamResponseHandler handler = inv.getArgument(1);
            handler.responseReceived(InvokeModelWithResponseStreamResponse.builder().build());
            handler.onEventStream(SdkPublisher.adapt(Flux.just(events)));
            handler.complete();
            return CompletableFuture.completedFuture(null);
        });
    }

    private static CompletionRequest request(String model) {
        return new CompletionRequest(
                List.of(ChatMessage.system("Answer in one word."), ChatMessage.user("What is 2+2?")),
                model, 0.3, 64);
    }

    @Test
    void construction_withoutRuntimeClient_failsFast() {
        assertThatThrownBy(() -> new BedrockAnthropicProvider(null, streamingRuntime, null, HAIKU_ID,
                Map.of(), Duration.ofSeconds(5), mapper, pool))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void complete_hoistsSystemPromptAndResolvesAlias() throws Exception {
        given(runtime.invokeModel(any(InvokeModelRequest.class))).willReturn(InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String(RESPONSE_JSON))
                .contentType("application/json")
                .build());

        CompletionResult result = provider.complete(request("claude-3-haiku"));

        assertThat(result.getContent()).isEqualTo("Four.");
        assertThat(result.getPromptTokens()).isEqualTo(21);
        assertThat(result.getCompletionTokens()).isEqualTo(4);
        assertThat(result.getResolvedModel()).isEqualTo(HAIKU_ID);

        ArgumentCaptor<InvokeModelRequest> sent = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(runtime).invokeModel(sent.capture());
        assertThat(sent.getValue().modelId()).isEqualTo(HAIKU_ID);

        JsonNode body = mapper.readTree(sent.getValue().body().asUtf8String());
        assertThat(body.path("anthropic_version").asText()).isEqualTo("bedrock-2023-05-31");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(64);
        assertThat(body.path("system").asText()).isEqualTo("Answer in one word.");
        assertThat(body.path("messages").size()).isEqualTo(1);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("user");
    }

    @Test
    void buildBody_withoutSystemMessage_omitsSystemField() {
        CompletionRequest noSystem = new CompletionRequest(
                List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello"), ChatMessage.user("again")),
                HAIKU_ID, 0.7, 10);

        Map<String, Object> body = provider.buildBody(noSystem);

        assertThat(body).doesNotContainKey("system");
        assertThat((List<?>) body.get("messages")).hasSize(3);
    }

    @Test
    void complete_throttled_isRetryableRateLimit() {
        given(runtime.invokeModel(any(InvokeModelRequest.class))).willThrow(
                AwsServiceException.builder().statusCode(429).message("Too many requests").build());

        assertThatThrownBy(() -> provider.complete(request(null)))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> {
                    ProviderException pe = (ProviderException) e;
                    assertThat(pe.getKind()).isEqualTo(ErrorKind.UPSTREAM_RATE_LIMIT);
                    assertThat(pe.getUpstreamStatus()).isEqualTo(429);
                    assertThat(pe.isRetryable()).isTrue();
                });
    }

    @Test
    void complete_clientFailure_isConnectivityError() {
        given(runtime.invokeModel(any(InvokeModelRequest.class))).willThrow(
                SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> provider.complete(request(null)))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ErrorKind.CONNECTIVITY);
    }

    @Test
    void completeStreaming_withoutAnyModel_failsBeforeCallingBedrock() {
        BedrockAnthropicProvider unconfigured = new BedrockAnthropicProvider(runtime, streamingRuntime, null, "",
                Map.of(), Duration.ofSeconds(5), mapper, pool);

        try (ChunkStream stream = unconfigured.completeStreaming(request(null))) {
            StreamChunk only = stream.next();
            assertThat(only.errorKind()).isEqualTo(ErrorKind.CONFIGURATION);
            assertThat(stream.hasNext()).isFalse();
        }
        verifyNoInteractions(streamingRuntime);
    }

    @Test
    void extractTextDelta_onlyTextDeltasContribute() {
        assertThat(provider.extractTextDelta(
                "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}"))
                .isEqualTo("Hi");
        assertThat(provider.extractTextDelta("{\"type\":\"message_start\",\"message\":{}}")).isNull();
        assertThat(provider.extractTextDelta(
                "{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\"}}"))
                .isNull();
        assertThat(provider.extractTextDelta("{\"type\":\"message_stop\"}")).isNull();
    }

    @Test
    void listModels_returnsConfiguredAliases() {
        assertThat(provider.listModels()).containsExactly("claude-3-haiku");
    }

    @Test
    void healthCheck_withoutControlPlane_isUnhealthyNotThrown() {
        assertThat(provider.healthCheck().isHealthy()).isFalse();
    }

    @Test
    void completeStreaming_emitsOnlyTextDeltasThenEnd() {
        givenStreamEvents(
                event("{\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":9}}}"),
                event("{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}"),
                event("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Fo\"}}"),
                event("{\"type\":\"ping\"}"),
                event("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"ur.\"}}"),
                event("{\"type\":\"content_block_stop\",\"index\":0}"),
                event("{\"type\":\"message_stop\"}"));

        List<StreamChunk> chunks = drain(provider.completeStreaming(request("claude-3-haiku")));

        assertThat(chunks).extracting(StreamChunk::getType).containsExactly(
                StreamChunk.Type.CONTENT, StreamChunk.Type.CONTENT, StreamChunk.Type.END);
        assertThat(chunks).extracting(StreamChunk::getText).containsExactly("Fo", "ur.", null);

        ArgumentCaptor<InvokeModelWithResponseStreamRequest> sent =
                ArgumentCaptor.forClass(InvokeModelWithResponseStreamRequest.class);
        verify(streamingRuntime).invokeModelWithResponseStream(sent.capture(),
                any(InvokeModelWithResponseStreamResponseHandler.class));
        assertThat(sent.getValue().modelId()).isEqualTo(HAIKU_ID);
    }

    @Test
    void completeStreaming_sdkErrorAfterContent_endsWithConnectivityError() {
        given(streamingRuntime.invokeModelWithResponseStream(any(InvokeModelWithResponseStreamRequest.class),
                any(InvokeModelWithResponseStreamResponseHandler.class))).willAnswer(inv -> {
            InvokeModelWithResponseStreamResponseHandler handler = inv.getArgument(1);
            SdkClientException reset = SdkClientException.create("Connection reset");
            handler.onEventStream(SdkPublisher.adapt(Flux.just(event(
                    "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Partial\"}}"))));
            handler.exceptionOccurred(reset);
            return CompletableFuture.failedFuture(reset);
        });

        List<StreamChunk> chunks = drain(provider.completeStreaming(request(null)));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).getText()).isEqualTo("Partial");
        assertThat(chunks.get(1).getType()).isEqualTo(StreamChunk.Type.ERROR);
        assertThat(chunks.get(1).errorKind()).isEqualTo(ErrorKind.CONNECTIVITY);
    }

    @Test
    void completeStreaming_silentStream_timesOutAndCancelsTheCall() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        given(streamingRuntime.invokeModelWithResponseStream(any(InvokeModelWithResponseStreamRequest.class),
                any(InvokeModelWithResponseStreamResponseHandler.class))).willReturn(pending);
        BedrockAnthropicProvider impatient = new BedrockAnthropicProvider(runtime, streamingRuntime, null, HAIKU_ID,
                Map.of(), Duration.ofMillis(200), mapper, pool);

        List<StreamChunk> chunks = drain(impatient.completeStreaming(request(null)));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(pending.isCancelled()).isTrue();
    }

    @Test
    void complete_saturatedWorkerPool_isProviderFailure() {
        BedrockAnthropicProvider saturated = new BedrockAnthropicProvider(runtime, streamingRuntime, null, HAIKU_ID,
                Map.of(), Duration.ofSeconds(5), mapper, task -> { throw new RejectedExecutionException("full"); });

        assertThatThrownBy(() -> saturated.complete(request(null)))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ErrorKind.INTERNAL);
        verifyNoInteractions(runtime);
    }

    @Test
    void healthCheck_saturatedWorkerPool_isUnhealthyNotThrown() {
        BedrockClient controlPlane = mock(BedrockClient.class);
        BedrockAnthropicProvider saturated = new BedrockAnthropicProvider(runtime, streamingRuntime, controlPlane,
                HAIKU_ID, Map.of(), Duration.ofSeconds(5), mapper, task -> { throw new RejectedExecutionException("full"); });

        assertThat(saturated.healthCheck().isHealthy()).isFalse();
        assertThat(saturated.healthCheck().error()).contains("saturated");
        verify(controlPlane, never()).listFoundationModels(any(ListFoundationModelsRequest.class));
    }
}
