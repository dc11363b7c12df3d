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
import me.golemcore.comfyagent.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.comfyagent.adapter.inbound.web.dto.RenameSessionRequest;
import me.golemcore.comfyagent.adapter.inbound.web.dto.SessionMessagesDto;
import me.golemcore.comfyagent.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.service.SessionRunCoordinator;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Session management endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    static final String DEFAULT_SESSION_TITLE = "New Session";
    private static final int TITLE_MAX_LEN = 120;

    private final SessionPort sessionPort;
    private final SessionRunCoordinator coordinator;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = sessionPort.listTopLevel().stream()
                .map(SessionsController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping
    public Mono<ResponseEntity<SessionSummaryDto>> createSession(
            @RequestBody(required = false) CreateSessionRequest request) {
        String title = request != null ? normalizeTitle(request.getTitle()) : null;
        Session session = sessionPort.create(title != null ? title : DEFAULT_SESSION_TITLE);
        log.info("[API] Created session {}", session.getId());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toSummary(session)));
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<SessionSummaryDto>> renameSession(@PathVariable String id,
            @RequestBody RenameSessionRequest request) {
        String title = request != null ? normalizeTitle(request.getTitle()) : null;
        if (title == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title is required");
        }
        requireSession(id);
        Session renamed = sessionPort.rename(id, title);
        return Mono.just(ResponseEntity.ok(toSummary(renamed)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        requireSession(id);
        if (coordinator.isRunning(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Turn in progress for session " + id);
        }
        sessionPort.delete(id);
        log.info("[API] Deleted session {}", id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}/messages")
    public Mono<ResponseEntity<SessionMessagesDto>> getMessages(@PathVariable String id) {
        requireSession(id);
        List<SessionMessagesDto.MessageDto> messages = sessionPort.getMessages(id).stream()
                .map(SessionsController::toMessageDto)
                .toList();
        return Mono.just(ResponseEntity.ok(SessionMessagesDto.builder()
                .sessionId(id)
                .messages(messages)
                .build()));
    }

    private Session requireSession(String id) {
        return sessionPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id));
    }

    private static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String trimmed = title.trim();
        return trimmed.length() > TITLE_MAX_LEN ? trimmed.substring(0, TITLE_MAX_LEN) : trimmed;
    }

    static SessionSummaryDto toSummary(Session session) {
        return SessionSummaryDto.builder()
                .sessionId(session.getId())
                .title(session.getTitle())
                .status(session.getStatus() != null ? session.getStatus().wireName() : null)
                .messageCount(session.getMessages() != null ? session.getMessages().size() : 0)
                .totalInputTokens(session.getTotalInputTokens())
                .totalOutputTokens(session.getTotalOutputTokens())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .build();
    }

    private static SessionMessagesDto.MessageDto toMessageDto(Message message) {
        boolean cancelled = message.getMetadata() != null
                && Boolean.TRUE.equals(message.getMetadata().get(Message.META_CANCELLED));
        return SessionMessagesDto.MessageDto.builder()
                .id(message.getId())
                .role(message.getRole() != null ? message.getRole().getWireName() : null)
                .timestamp(format(message.getTimestamp()))
                .cancelled(cancelled ? Boolean.TRUE : null)
                .blocks(message.getBlocks() != null
                        ? message.getBlocks().stream().map(SessionsController::toBlockDto).toList()
                        : List.of())
                .build();
    }

    private static SessionMessagesDto.BlockDto toBlockDto(ContentBlock block) {
        return SessionMessagesDto.BlockDto.builder()
                .type(block.getType() != null ? block.getType().getWireName() : null)
                .text(block.getText())
                .toolCallId(block.getToolCallId())
                .toolName(block.getToolName())
                .arguments(block.getArguments())
                .result(block.getResult())
                .error(block.getError())
                .task(block.getTask())
                .childSessionId(block.getChildSessionId())
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
