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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.events.AgentEventType;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.loop.AgentLoopFactory;
import me.golemcore.comfyagent.domain.model.CancellationToken;
import me.golemcore.comfyagent.domain.model.Session;
import me.golemcore.comfyagent.domain.model.SubagentResult;
import me.golemcore.comfyagent.domain.model.TurnOutcome;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a focused task in an isolated child session with a nested, read-only
 * agent loop.
 *
 * <p>
 * The child session starts empty apart from the task and is hidden from session
 * listing. Its own stream carries the nested loop's events; the parent stream
 * only sees {@code subagent.start} and {@code subagent.end}. The nested loop
 * observes the token it is given, which callers derive from the parent turn's
 * token.
 */
@Service
@Slf4j
public class SubagentDelegator {

    private static final int TITLE_TASK_CHARS = 50;

    private final SessionPort sessionPort;
    private final EventBus eventBus;
    private final ObjectProvider<AgentLoopFactory> agentLoopFactory;
    private final int previewChars;

    public SubagentDelegator(SessionPort sessionPort, EventBus eventBus,
            ObjectProvider<AgentLoopFactory> agentLoopFactory, AgentProperties properties) {
        this.sessionPort = sessionPort;
        this.eventBus = eventBus;
        this.agentLoopFactory = agentLoopFactory;
        this.previewChars = properties.getSubagent().getPreviewChars();
    }

    public SubagentResult delegate(String parentSessionId, String task, CancellationToken token) {
        Session child = sessionPort.createChild(parentSessionId, "Sub-agent: " + abbreviate(task, TITLE_TASK_CHARS));
        String childId = child.getId();

        Map<String, Object> start = new LinkedHashMap<>();
        start.put("task", task);
        start.put("child_session_id", childId);
        eventBus.emit(parentSessionId, AgentEventType.SUBAGENT_START, start);
        log.info("[Subagent] Started child session {} for parent {}", childId, parentSessionId);

        SubagentResult result;
        try {
            TurnOutcome outcome = agentLoopFactory.getObject().createSubagentLoop().run(childId, task, token);
            if (outcome.isCompleted()) {
                result = new SubagentResult(task, childId, outcome.content(), false);
            } else {
                String reason = outcome.error() != null ? outcome.error() : outcome.content();
                result = new SubagentResult(task, childId, reason, true);
            }
        } catch (RuntimeException e) { // NOSONAR - a failed sub-agent must not take the parent turn down
            log.error("[Subagent] Child session {} failed", childId, e);
            result = new SubagentResult(task, childId, e.getMessage(), true);
        }

        String preview = result.failed() ? "Error: " + result.content() : result.content();
        Map<String, Object> end = new LinkedHashMap<>();
        end.put("child_session_id", childId);
        end.put("result_preview", abbreviate(preview, previewChars));
        end.put("success", !result.failed());
        eventBus.emit(parentSessionId, AgentEventType.SUBAGENT_END, end);
        log.info("[Subagent] Child session {} finished (failed={})", childId, result.failed());
        return result;
    }

    private static String abbreviate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
