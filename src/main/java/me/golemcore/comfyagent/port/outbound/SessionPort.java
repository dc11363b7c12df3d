package me.golemcore.comfyagent.port.outbound;

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

import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.model.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Port for session lifecycle and the append-only message history.
 *
 * <p>
 * Every mutating call is durable when it returns and throws
 * {@link me.golemcore.comfyagent.domain.exception.PersistenceException} when the
 * underlying store fails.
 */
public interface SessionPort {

    Session create(String title);

    Session createChild(String parentSessionId, String title);

    Optional<Session> get(String sessionId);

    /**
     * Top-level sessions, newest first. Child sessions of sub-agents are hidden.
     */
    List<Session> listTopLevel();

    Session rename(String sessionId, String title);

    boolean delete(String sessionId);

    /**
     * Appends a message and persists the session before returning.
     */
    Message appendMessage(String sessionId, Message message);

    /**
     * Snapshot of the ordered history.
     */
    List<Message> getMessages(String sessionId);

    void updateStatus(String sessionId, SessionStatus status);

    void addUsage(String sessionId, ModelUsage usage);
}
