package com.llmrelay.relay_backend.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.model.dto.ProcessRequest;
import com.llmrelay.relay_backend.model.dto.ProcessResponse;
import com.llmrelay.relay_backend.model.dto.UsageDto;
import com.llmrelay.relay_backend.model.usage.ConversationEntry;
import com.llmrelay.relay_backend.service.ConversationLog;
import com.llmrelay.relay_backend.service.UsageAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Messenger side of the relay: forwards messages to a remote responder over HTTP.
 *
 * <p>Connection failures, timeouts and non-2xx answers are retried with exponential backoff
 * up to the configured attempt budget. Auth failures, and failures the responder marks as
 * {@code retryable:false}, stop at once. Every outcome comes back as a {@link DispatchResult};
 * nothing is thrown at the caller.
 */
@Slf4j
@Service
public class RequestDispatcher {

    static final String PROCESS_PATH = "/api/completions/process";
    static final String STREAM_PATH  = "/api/completions/stream";
    static final String HEALTH_PATH  = "/api/completions/health";
    static final String MODELS_PATH  = "/api/completions/models";
    static final String CONFIG_PATH  = "/api/completions/config";

    static final String MESSENGER = "messenger";
    static final String RESPONDER = "responder";
    private static final String DONE = "[DONE]";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final UsageAggregator usage;
    private final ConversationLog conversation;
    private final Sleeper sleeper;
    private final String baseUrl;
    private final RetryPolicy retryPolicy;

    public RequestDispatcher(@Qualifier("responderRestTemplate") RestTemplate restTemplate,
                             ObjectMapper mapper,
                             RelayProperties props,
                             @Qualifier("messengerUsage") UsageAggregator usage,
                             ConversationLog conversation,
                             Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.mapper       = mapper;
        this.usage        = usage;
        this.conversation = conversation;
        this.sleeper      = sleeper;
        this.baseUrl      = trimTrailingSlash(props.getDispatcher().getResponderUrl());
        this.retryPolicy  = new RetryPolicy(props.getDispatcher().getRetryAttempts(), props.getDispatcher().getBackoffUnit());
    }

    public DispatchResult<ProcessResponse> send(ProcessRequest request) {
        DispatchResult<ProcessResponse> result = withRetry("send", retryPolicy, () -> {
            ResponseEntity<String> response = restTemplate.exchange(
                    url(PROCESS_PATH), HttpMethod.POST, jsonEntity(request), String.class);
            ProcessResponse body = readBody(response.getBody(), ProcessResponse.class);
            if (!ProcessResponse.SUCCESS.equals(body.status())) {
                throw new DispatchFailure(ErrorKind.UPSTREAM_REJECTED,
                        "Responder answered without a success status", response.getStatusCode().value(), false);
            }
            return body;
        });
        if (result.isSuccess()) {
            recordExchange(request, result.getValue());
        }
        return result;
    }

    /** Consumes the responder's event stream and returns the concatenated content. */
    public DispatchResult<String> sendStreaming(ProcessRequest request) {
        return withRetry("stream", retryPolicy, () -> restTemplate.execute(
                url(STREAM_PATH), HttpMethod.POST,
                req -> {
                    req.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    req.getHeaders().setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
                    req.getBody().write(mapper.writeValueAsBytes(request));
                },
                this::readEventStream));
    }

    public DispatchResult<JsonNode> remoteHealth() {
        return getJson("health", HEALTH_PATH);
    }

    public DispatchResult<JsonNode> remoteModels() {
        return getJson("models", MODELS_PATH);
    }

    public DispatchResult<JsonNode> remoteConfig() {
        return getJson("config", CONFIG_PATH);
    }

    public UsageAggregator getUsage() {
        return usage;
    }

    public ConversationLog getConversation() {
        return conversation;
    }

    public String getResponderUrl() {
        return baseUrl;
    }

    // ── Retry loop ──────────────────────────────────────────────────────────

    @FunctionalInterface
    interface RemoteCall<T> {
        T execute();
    }

    <T> DispatchResult<T> withRetry(String operation, RetryPolicy policy, RemoteCall<T> call) {
        int maxAttempts = policy.effectiveAttempts();
        int attempt = 0;
        DispatchFailure last = null;

        while (attempt < maxAttempts) {
            attempt++;
            log.debug("{} -> {} [{} {}/{}]", operation, baseUrl, DispatchState.ATTEMPTING, attempt, maxAttempts);
            try {
                T value = call.execute();
                log.debug("{} -> {} [{} after {} attempt(s)]", operation, baseUrl, DispatchState.SUCCESS, attempt);
                return DispatchResult.success(value, attempt);
            } catch (DispatchFailure f) {
                last = f;
            } catch (HttpStatusCodeException e) {
                last = classify(e);
            } catch (ResourceAccessException e) {
                last = classify(e);
            } catch (RestClientException e) {
                last = new DispatchFailure(ErrorKind.INTERNAL, e.getMessage(), null, false);
            } catch (IllegalArgumentException e) {
                // unusable responder URL, e.g. blank or relative
                last = new DispatchFailure(ErrorKind.CONFIGURATION,
                        "Invalid responder URL '" + baseUrl + "': " + e.getMessage(), null, false);
            }

            if (!last.retryable) {
                log.warn("{} to {} failed on attempt {}/{} with non-retryable {}: {}",
                        operation, baseUrl, attempt, maxAttempts, last.kind, last.getMessage());
                break;
            }
            if (attempt >= maxAttempts) break;

            Duration wait = policy.backoffAfter(attempt - 1);
            log.warn("{} to {} failed on attempt {}/{} ({}: {}). {} in {} ms",
                    operation, baseUrl, attempt, maxAttempts, last.kind, last.getMessage(),
                    DispatchState.RETRY, wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Retry sleep interrupted for {}; aborting further retries", operation);
                break;
            }
        }

        log.warn("{} to {} {} after {} attempt(s): {}", operation, baseUrl, DispatchState.EXHAUSTED, attempt, last.getMessage());
        return DispatchResult.failure(last.kind, last.getMessage(), last.status, attempt);
    }

    private DispatchFailure classify(ResourceAccessException e) {
        Throwable root = e.getMostSpecificCause();
        if (root instanceof SocketTimeoutException || root instanceof HttpTimeoutException) {
            return new DispatchFailure(ErrorKind.TIMEOUT, "Responder timed out: " + root.getMessage(), null, true);
        }
        return new DispatchFailure(ErrorKind.CONNECTIVITY, "Cannot reach responder at " + baseUrl + ": " + root.getMessage(), null, true);
    }

    private DispatchFailure classify(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        ErrorKind kind = ErrorKind.fromStatus(status);
        boolean retryable = status != 401 && status != 403;
        String message = "Responder returned HTTP " + status;

        JsonNode error = parseErrorNode(e.getResponseBodyAsString());
        if (error != null) {
            if (error.hasNonNull("type"))    kind = ErrorKind.parse(error.get("type").asText());
            if (error.hasNonNull("message")) message = error.get("message").asText();
            if (error.has("retryable") && !error.get("retryable").asBoolean(true)) retryable = false;
        }
        return new DispatchFailure(kind, message, status, retryable);
    }

    private JsonNode parseErrorNode(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode error = mapper.readTree(body).path("error");
            return error.isObject() ? error : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private DispatchResult<JsonNode> getJson(String operation, String path) {
        return withRetry(operation, RetryPolicy.once(), () -> {
            ResponseEntity<String> response = restTemplate.exchange(url(path), HttpMethod.GET, HttpEntity.EMPTY, String.class);
            return readBody(response.getBody(), JsonNode.class);
        });
    }

    private String readEventStream(ClientHttpResponse response) throws IOException {
        StringBuilder text = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.startsWith("data:")) continue;
                String data = line.substring(5).trim();
                if (data.isEmpty()) continue;
                if (DONE.equals(data)) return text.toString();

                JsonNode frame = readBody(data, JsonNode.class);
                if (frame.hasNonNull("error")) {
                    ErrorKind kind = ErrorKind.parse(frame.path("type").asText(null));
                    throw new DispatchFailure(kind, frame.get("error").asText(), null, kind.isRetryable());
                }
                text.append(frame.path("content").asText(""));
            }
        }
        throw new DispatchFailure(ErrorKind.CONNECTIVITY, "Event stream ended before " + DONE, null, true);
    }

    private void recordExchange(ProcessRequest request, ProcessResponse response) {
        UsageDto u = response.usage();
        int prompt     = u != null ? u.promptTokens() : 0;
        int completion = u != null ? u.completionTokens() : 0;
        int total      = u != null ? u.totalTokens() : 0;
        double cost    = u != null ? u.estimatedCost() : 0.0;

        conversation.appendExchange(
                ConversationEntry.outgoing(MESSENGER, RESPONDER, request.message()),
                ConversationEntry.reply(RESPONDER, MESSENGER, response.aiResponse(), response.model(), total));
        usage.record(response.model(), total, prompt, completion, cost,
                Duration.ofMillis(Math.round(response.processingTime() * 1000)));
    }

    private <B> B readBody(String body, Class<B> type) {
        if (body == null || body.isBlank()) {
            throw new DispatchFailure(ErrorKind.UPSTREAM_REJECTED, "Responder sent an empty body", null, false);
        }
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new DispatchFailure(ErrorKind.UPSTREAM_REJECTED,
                    "Unreadable responder body: " + e.getOriginalMessage(), null, false);
        }
    }

    private HttpEntity<ProcessRequest> jsonEntity(ProcessRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(request, headers);
    }

    private String url(String path) {
        return baseUrl + path;
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        String t = s.trim();
        return t.endsWith("/") ? t.substring(0, t.length() - 1) : t;
    }

    /** One failed attempt, already classified. */
    static final class DispatchFailure extends RuntimeException {
        final ErrorKind kind;
        final Integer status;
        final boolean retryable;

        DispatchFailure(ErrorKind kind, String message, Integer status, boolean retryable) {
            super(message, null, false, false);
            this.kind = kind;
            this.status = status;
            this.retryable = retryable;
        }
    }
}
