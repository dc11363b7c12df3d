package me.golemcore.comfyagent.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.comfyagent.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.comfyagent.domain.model.TurnOutcome;
import me.golemcore.comfyagent.domain.service.SessionRunCoordinator;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Non-streaming chat: runs one turn and answers with its outcome. Events of the
 * turn are still published for WebSocket followers.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String API_SESSION_TITLE = "API Session";

    private final SessionPort sessionPort;
    private final SessionRunCoordinator coordinator;

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }

        String sessionId = request.getSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = sessionPort.create(API_SESSION_TITLE).getId();
            log.info("[API] Created session {} for chat", sessionId);
        } else if (sessionPort.get(sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
        }

        return Mono.fromFuture(coordinator.submit(sessionId, request.getMessage().trim()))
                .map(outcome -> ResponseEntity.ok(toResponse(outcome)));
    }

    static ChatResponse toResponse(TurnOutcome outcome) {
        return ChatResponse.builder()
                .sessionId(outcome.sessionId())
                .status(outcome.status().name().toLowerCase(Locale.ROOT))
                .response(outcome.content())
                .error(outcome.error())
                .errorKind(outcome.errorKind() != null ? outcome.errorKind().wireName() : null)
                .iterations(outcome.iterations())
                .usage(outcome.usage() != null ? outcome.usage().toPayload() : null)
                .build();
    }
}
