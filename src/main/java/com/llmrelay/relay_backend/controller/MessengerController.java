package com.llmrelay.relay_backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.llmrelay.relay_backend.dispatch.DispatchResult;
import com.llmrelay.relay_backend.dispatch.RequestDispatcher;
import com.llmrelay.relay_backend.model.dto.ProcessRequest;
import com.llmrelay.relay_backend.model.dto.ProcessResponse;
import com.llmrelay.relay_backend.model.usage.ConversationEntry;
import com.llmrelay.relay_backend.model.usage.UsageAggregate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Messenger endpoints. Everything here goes through {@link RequestDispatcher} to the remote
 * responder; failures come back as a dispatch result with a gateway-style status.
 */
@RestController
@RequestMapping("/api/messenger")
@RequiredArgsConstructor
public class MessengerController {

    private final RequestDispatcher dispatcher;

    @PostMapping("/send")
    public ResponseEntity<DispatchResult<ProcessResponse>> send(@Valid @RequestBody ProcessRequest request) {
        return toResponse(dispatcher.send(request));
    }

    @PostMapping("/stream")
    public ResponseEntity<DispatchResult<String>> stream(@Valid @RequestBody ProcessRequest request) {
        return toResponse(dispatcher.sendStreaming(request));
    }

    @GetMapping("/remote/health")
    public ResponseEntity<DispatchResult<JsonNode>> remoteHealth() {
        return toResponse(dispatcher.remoteHealth());
    }

    @GetMapping("/remote/models")
    public ResponseEntity<DispatchResult<JsonNode>> remoteModels() {
        return toResponse(dispatcher.remoteModels());
    }

    @GetMapping("/remote/config")
    public ResponseEntity<DispatchResult<JsonNode>> remoteConfig() {
        return toResponse(dispatcher.remoteConfig());
    }

    @GetMapping("/conversation")
    public List<ConversationEntry> conversation() {
        return dispatcher.getConversation().entries();
    }

    @GetMapping("/usage")
    public UsageAggregate usage() {
        return dispatcher.getUsage().snapshot();
    }

    private static <T> ResponseEntity<DispatchResult<T>> toResponse(DispatchResult<T> result) {
        if (result.isSuccess()) return ResponseEntity.ok(result);
        HttpStatus status = switch (result.getErrorKind()) {
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case CONFIGURATION -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }
}
