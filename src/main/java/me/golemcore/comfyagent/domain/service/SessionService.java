package me.golemcore.comfyagent.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.exception.PersistenceException;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.model.SessionStatus;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import me.golemcore.comfyagent.port.outbound.StoragePort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store backed by one JSON document per session.
 *
 * <p>
 * Sessions live in a process-wide registry and are loaded from storage at
 * startup. Every mutation happens under the session's monitor and writes the
 * whole document atomically before returning, so a message that was appended is
 * durable and its content blocks reload in the order they were emitted. A
 * failed write rolls the in-memory change back and surfaces as
 * {@link PersistenceException}.
 */
@Service
@Slf4j
public class SessionService implements SessionPort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final String sessionsDir;

    private final Map<String, Session> sessionCache = new ConcurrentHashMap<>();

    /**
     * Published once per removed session, children included.
     */
    public record SessionDeletedEvent(String sessionId) {
    }

    public SessionService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            ApplicationEventPublisher eventPublisher, AgentProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.sessionsDir = properties.getStorage().getSessionsDirectory();
    }

    @PostConstruct
    public void loadAll() {
        List<String> files;
        try {
            files = storagePort.listObjects(sessionsDir, "").join();
        } catch (CompletionException e) {
            log.warn("[Sessions] Failed to list stored sessions: {}", e.getMessage());
            return;
        }
        int loaded = 0;
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            Optional<Session> session = load(file);
            if (session.isPresent()) {
                sessionCache.put(session.get().getId(), session.get());
                loaded++;
            }
        }
        log.info("[Sessions] Loaded {} sessions", loaded);
    }

    @Override
    public Session create(String title) {
        return register(newSession(title, null));
    }

    @Override
    public Session createChild(String parentSessionId, String title) {
        return register(newSession(title, parentSessionId));
    }

    @Override
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionCache.get(sessionId));
    }

    @Override
    public List<Session> listTopLevel() {
        return sessionCache.values().stream()
                .filter(session -> !session.isChild())
                .sorted(Comparator.comparing(Session::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Session rename(String sessionId, String title) {
        Session session = require(sessionId);
        synchronized (session) {
            String previous = session.getTitle();
            session.setTitle(title);
            try {
                save(session);
            } catch (PersistenceException e) {
                session.setTitle(previous);
                throw e;
            }
        }
        return session;
    }

    @Override
    public boolean delete(String sessionId) {
        Session session = sessionCache.remove(sessionId);
        if (session == null) {
            return false;
        }
        List<String> children = sessionCache.values().stream()
                .filter(candidate -> sessionId.equals(candidate.getParentSessionId()))
                .map(Session::getId)
                .toList();
        children.forEach(this::delete);
        try {
            storagePort.deleteObject(sessionsDir, fileName(sessionId)).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to delete session " + sessionId, e.getCause());
        }
        eventPublisher.publishEvent(new SessionDeletedEvent(sessionId));
        log.info("[Sessions] Deleted session {} ({} child sessions)", sessionId, children.size());
        return true;
    }

    @Override
    public Message appendMessage(String sessionId, Message message) {
        Session session = require(sessionId);
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }
        synchronized (session) {
            session.getMessages().add(message);
            try {
                save(session);
            } catch (PersistenceException e) {
                session.getMessages().remove(session.getMessages().size() - 1);
                throw e;
            }
        }
        return message;
    }

    @Override
    public List<Message> getMessages(String sessionId) {
        Session session = require(sessionId);
        synchronized (session) {
            return new ArrayList<>(session.getMessages());
        }
    }

    @Override
    public void updateStatus(String sessionId, SessionStatus status) {
        Session session = require(sessionId);
        synchronized (session) {
            SessionStatus previous = session.getStatus();
            session.setStatus(status);
            try {
                save(session);
            } catch (PersistenceException e) {
                session.setStatus(previous);
                throw e;
            }
        }
    }

    @Override
    public void addUsage(String sessionId, ModelUsage usage) {
        if (usage == null) {
            return;
        }
        Session session = require(sessionId);
        synchronized (session) {
            session.setTotalInputTokens(session.getTotalInputTokens() + usage.getInputTokens());
            session.setTotalOutputTokens(session.getTotalOutputTokens() + usage.getOutputTokens());
            save(session);
        }
    }

    private Session newSession(String title, String parentSessionId) {
        return Session.builder()
                .id(UUID.randomUUID().toString())
                .title(title != null ? title : "")
                .parentSessionId(parentSessionId)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private Session register(Session session) {
        synchronized (session) {
            save(session);
        }
        sessionCache.put(session.getId(), session);
        log.info("[Sessions] Created session {}{}", session.getId(),
                session.isChild() ? " (child of " + session.getParentSessionId() + ")" : "");
        return session;
    }

    private Session require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }

    // Caller holds the session monitor.
    private void save(Session session) {
        session.setUpdatedAt(clock.instant());
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize session " + session.getId(), e);
        }
        try {
            storagePort.putTextAtomic(sessionsDir, fileName(session.getId()), json, false).join();
            log.debug("[Sessions] Saved session {}", session.getId());
        } catch (CompletionException e) {
            log.error("[Sessions] Failed to save session {}", session.getId(), e.getCause());
            throw new PersistenceException("Failed to save session " + session.getId(), e.getCause());
        }
    }

    private Optional<Session> load(String file) {
        try {
            String json = storagePort.getText(sessionsDir, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Sessions] Skipping unreadable session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String fileName(String sessionId) {
        return sessionId + JSON_EXTENSION;
    }
}
