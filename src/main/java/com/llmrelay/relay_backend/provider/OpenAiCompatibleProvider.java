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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Chat-completions client for OpenAI and any endpoint speaking the same protocol.
 * Messages are passed through unchanged; usage is read from the response envelope.
 */
public class OpenAiCompatibleProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Executor streamExecutor;

    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final Duration timeout;

    public OpenAiCompatibleProvider(String apiKey, String baseUrl, String defaultModel, Duration timeout,
                                    ObjectMapper mapper, Executor streamExecutor) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("OpenAI API key is not set. Configure relay.openai.api-key or OPENAI_API_KEY.");
        }
        this.apiKey = apiKey.trim();
        this.baseUrl = trimTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL);
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel : "gpt-4";
        this.timeout = timeout;
        this.mapper = mapper;
        this.streamExecutor = streamExecutor;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public ProviderType getType() { return ProviderType.OPENAI; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public CompletionResult complete(CompletionRequest req) {
        String model = effectiveModel(req);
        HttpResponse<String> httpResp = send(post("/chat/completions", buildBody(req, model, false)),
                HttpResponse.BodyHandlers.ofString());
        if (!isSuccess(httpResp.statusCode())) {
            log.error("[OpenAI] HTTP {} for model '{}'", httpResp.statusCode(), model);
            throw new UpstreamException(httpResp.statusCode(),
                    "OpenAI API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
        }
        JsonNode resp = readTree(httpResp.body());
        JsonNode choices = resp.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new UpstreamException(ErrorKind.UPSTREAM_REJECTED, "OpenAI response has no choices", null);
        }
        String text = choices.get(0).path("message").path("content").asText("");
        JsonNode usage = resp.path("usage");
        int promptTokens = usage.path("prompt_tokens").asInt(0);
        int completionTokens = usage.path("completion_tokens").asInt(0);
        return CompletionResult.of(text, promptTokens, completionTokens, model);
    }

    @Override
    public ChunkStream completeStreaming(CompletionRequest req) {
        String model = effectiveModel(req);
        HttpRequest httpReq = post("/chat/completions", buildBody(req, model, true));
        return ChunkStream.open(streamExecutor, sink -> {
            HttpResponse<Stream<String>> httpResp = send(httpReq, HttpResponse.BodyHandlers.ofLines());
            try (Stream<String> lines = httpResp.body()) {
                if (!isSuccess(httpResp.statusCode())) {
                    String body = lines.collect(Collectors.joining("\n"));
                    log.error("[OpenAI] HTTP {} opening stream for model '{}'", httpResp.statusCode(), model);
                    throw new UpstreamException(httpResp.statusCode(),
                            "OpenAI API error " + httpResp.statusCode() + ": " + extractError(body));
                }
                var it = lines.iterator();
                while (it.hasNext()) {
                    String delta = parseStreamLine(it.next());
                    if (delta == null) continue;
                    if (DONE_MARKER.equals(delta)) break;
                    sink.emit(delta);
                }
            } catch (UncheckedIOException e) {
                log.error("[OpenAI] Stream for model '{}' broke off: {}", model, e.getCause().getMessage());
                throw new ProviderException(ErrorKind.CONNECTIVITY,
                        "OpenAI stream interrupted: " + e.getCause().getMessage(), null, e);
            }
        });
    }

    @Override
    public ProviderHealth healthCheck() {
        try {
            HttpResponse<String> resp = send(get("/models"), HttpResponse.BodyHandlers.ofString());
            if (isSuccess(resp.statusCode())) return ProviderHealth.healthy();
            return ProviderHealth.unhealthy("OpenAI API error " + resp.statusCode() + ": " + extractError(resp.body()));
        } catch (ProviderException e) {
            return ProviderHealth.unhealthy(e.getMessage());
        }
    }

    @Override
    public List<String> listModels() {
        HttpResponse<String> resp = send(get("/models"), HttpResponse.BodyHandlers.ofString());
        if (!isSuccess(resp.statusCode())) {
            throw new UpstreamException(resp.statusCode(),
                    "OpenAI API error " + resp.statusCode() + ": " + extractError(resp.body()));
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode m : readTree(resp.body()).path("data")) {
            String id = m.path("id").asText("");
            if (id.startsWith("gpt-3.5") || id.startsWith("gpt-4")) ids.add(id);
        }
        ids.sort(null);
        return ids;
    }

    // ── wire format ──────────────────────────────────────────────────────────

    Map<String, Object> buildBody(CompletionRequest req, String model, boolean stream) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ChatMessage m : req.getMessages()) {
            messages.add(Map.of("role", m.role().wireName(), "content", m.content()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", req.getTemperature());
        body.put("max_tokens", req.getMaxTokens());
        if (stream) body.put("stream", true);
        return body;
    }

    /**
     * Returns the content delta of one server-sent line, {@code [DONE]} for the end marker,
     * or null for anything that carries no text (keep-alives, role-only deltas, empty deltas).
     */
    String parseStreamLine(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) return null;
        String data = line.substring(DATA_PREFIX.length()).trim();
        if (data.isEmpty()) return null;
        if (DONE_MARKER.equals(data)) return DONE_MARKER;
        JsonNode chunk = readTree(data);
        JsonNode choices = chunk.path("choices");
        if (!choices.isArray() || choices.isEmpty()) return null;
        JsonNode content = choices.get(0).path("delta").path("content");
        if (content.isMissingNode() || content.isNull()) return null;
        String text = content.asText();
        return text.isEmpty() ? null : text;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private String effectiveModel(CompletionRequest req) {
        return req.getModel() != null && !req.getModel().isBlank() ? req.getModel() : defaultModel;
    }

    private HttpRequest post(String path, Map<String, Object> body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.INTERNAL, "Could not serialise OpenAI request", null, e);
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .GET()
                .build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            log.error("[OpenAI] Timed out after {} calling {}", timeout, request.uri());
            throw new ProviderException(ErrorKind.TIMEOUT, "OpenAI request timed out after " + timeout.toSeconds() + "s", null, e);
        } catch (ConnectException e) {
            log.error("[OpenAI] Cannot connect to {}", baseUrl);
            throw new ProviderException(ErrorKind.CONNECTIVITY, "Cannot reach OpenAI at " + baseUrl, null, e);
        } catch (IOException e) {
            log.error("[OpenAI] I/O error calling {}: {}", request.uri(), e.toString());
            throw new ProviderException(ErrorKind.CONNECTIVITY, "OpenAI connection error: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ErrorKind.INTERNAL, "Interrupted while calling OpenAI", null, e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(ErrorKind.UPSTREAM_REJECTED, "Malformed OpenAI response: " + fallbackBody(body), e);
        }
    }

    private String extractError(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) return msg.asText();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("[OpenAI] Error body is not JSON: {}", e.getMessage());
        }
        return fallbackBody(body);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }

    private static String trimTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
