package me.golemcore.comfyagent.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.events.AgentEvent;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.exception.TurnInProgressException;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.service.SessionRunCoordinator;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Live chat protocol on {@code /api/chat/ws}.
 *
 * <p>
 * Client messages: {@code ping}, {@code chat{session_id?, message}},
 * {@code cancel{session_id}} and {@code subscribe{session_id}}. A chat without
 * a session id creates one and answers {@code session_created} before the
 * turn starts. Every followed session's events are forwarded as
 * {@code event} frames; the three terminal events become {@code response},
 * {@code error} and {@code cancelled}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionGatewayHandler implements WebSocketHandler {

    static final String WS_SESSION_TITLE = "WS Session";

    private static final String KEY_TYPE = "type";
    private static final String KEY_SESSION_ID = "session_id";
    private static final String KEY_ERROR = "error";
    private static final String KEY_CONTENT = "content";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final SessionPort sessionPort;
    private final SessionRunCoordinator coordinator;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        LiveConnection connection = new LiveConnection(UUID.randomUUID().toString());
        log.info("[Gateway] Connection established: {}", connection.getId());

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(payload -> handleIncoming(connection, payload))
                .doFinally(signal -> {
                    log.info("[Gateway] Connection closed: {}, signal={}", connection.getId(), signal);
                    connection.close();
                })
                .then();

        return session.send(connection.outbound().map(session::textMessage))
                .and(inbound);
    }

    void handleIncoming(LiveConnection connection, String payload) {
        Map<String, Object> json;
        try {
            json = objectMapper.readValue(payload, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            sendError(connection, null, "Invalid JSON");
            return;
        }

        String type = text(json.get(KEY_TYPE));
        String sessionId = text(json.get(KEY_SESSION_ID));
        try {
            switch (type != null ? type : "") {
            case "ping" -> send(connection, Map.of(KEY_TYPE, "pong"));
            case "chat" -> handleChat(connection, sessionId, text(json.get("message")));
            case "cancel" -> handleCancel(connection, sessionId);
            case "subscribe" -> handleSubscribe(connection, sessionId);
            default -> sendError(connection, sessionId, "Unknown message type: " + type);
            }
        } catch (RuntimeException e) { // NOSONAR - one failed request must not drop the connection
            log.warn("[Gateway] Failed to handle '{}' on connection {}: {}", type, connection.getId(),
                    e.getMessage(), e);
            sendError(connection, sessionId, "Request failed: " + e.getMessage());
        }
    }

    private void handleChat(LiveConnection connection, String sessionId, String message) {
        if (message == null) {
            sendError(connection, sessionId, "message is required");
            return;
        }

        String targetId = sessionId;
        if (targetId == null) {
            Session created = sessionPort.create(WS_SESSION_TITLE);
            targetId = created.getId();
            follow(connection, targetId);
            Map<String, Object> reply = new LinkedHashMap<>();
            reply.put(KEY_TYPE, "session_created");
            reply.put(KEY_SESSION_ID, targetId);
            send(connection, reply);
        } else if (sessionPort.get(targetId).isEmpty()) {
            sendError(connection, targetId, "Session not found: " + targetId);
            return;
        } else {
            follow(connection, targetId);
        }

        String runningId = targetId;
        try {
            coordinator.submit(runningId, message).whenComplete((outcome, error) -> {
                if (error != null) {
                    sendError(connection, runningId, "Turn failed: " + error.getMessage());
                }
            });
        } catch (TurnInProgressException | IllegalArgumentException e) {
            sendError(connection, runningId, e.getMessage());
        }
    }

    private void handleCancel(LiveConnection connection, String sessionId) {
        if (sessionId == null) {
            sendError(connection, null, "session_id is required");
            return;
        }
        if (!coordinator.cancel(sessionId)) {
            sendError(connection, sessionId, "No turn in progress for session " + sessionId);
        }
    }

    private void handleSubscribe(LiveConnection connection, String sessionId) {
        if (sessionId == null) {
            sendError(connection, null, "session_id is required");
            return;
        }
        if (sessionPort.get(sessionId).isEmpty()) {
            sendError(connection, sessionId, "Session not found: " + sessionId);
            return;
        }
        follow(connection, sessionId);
    }

    private void follow(LiveConnection connection, String sessionId) {
        Flux<String> events = eventBus.stream(sessionId).map(event -> toJson(toFrame(event)));
        if (connection.follow(sessionId, events)) {
            log.debug("[Gateway] Connection {} follows session {}", connection.getId(), sessionId);
        }
    }

    /**
     * Wire frame for one bus event.
     */
    static Map<String, Object> toFrame(AgentEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        switch (event.type()) {
        case TURN_RESPONSE -> {
            frame.put(KEY_TYPE, "response");
            frame.put(KEY_SESSION_ID, event.sessionId());
            frame.put(KEY_CONTENT, event.get(KEY_CONTENT));
        }
        case TURN_ERROR -> {
            frame.put(KEY_TYPE, KEY_ERROR);
            frame.put(KEY_SESSION_ID, event.sessionId());
            frame.put(KEY_ERROR, event.get(KEY_ERROR));
            frame.put("kind", event.get("kind"));
        }
        case TURN_CANCELLED -> {
            frame.put(KEY_TYPE, "cancelled");
            frame.put(KEY_SESSION_ID, event.sessionId());
            frame.put(KEY_CONTENT, event.get(KEY_CONTENT));
        }
        default -> {
            frame.put(KEY_TYPE, "event");
            frame.put("event_type", event.type().getWireName());
            frame.put("data", event.data() != null ? event.data() : Map.of());
            frame.put(KEY_SESSION_ID, event.sessionId());
            frame.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : null);
        }
        }
        return frame;
    }

    private void sendError(LiveConnection connection, String sessionId, String error) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(KEY_TYPE, KEY_ERROR);
        if (sessionId != null) {
            frame.put(KEY_SESSION_ID, sessionId);
        }
        frame.put(KEY_ERROR, error);
        send(connection, frame);
    }

    private void send(LiveConnection connection, Map<String, Object> frame) {
        connection.send(toJson(frame));
    }

    private String toJson(Map<String, Object> frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String text(Object value) {
        return value instanceof String s && !s.isBlank() ? s.trim() : null;
    }
}
