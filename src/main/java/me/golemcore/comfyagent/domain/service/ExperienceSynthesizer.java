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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.events.AgentEvent;
import me.golemcore.comfyagent.domain.events.AgentEventType;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.events.EventSubscription;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import me.golemcore.comfyagent.port.outbound.StoragePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns notable turns into reusable experiences.
 *
 * <p>
 * Listens to every session's events and keeps per-turn statistics: tool calls,
 * tool failures and the node classes of submitted workflows. When a turn with
 * enough tool calls ends, and the cooldown since the last saved experience has
 * passed, the model is asked to reflect on the turn and answer with a Gherkin
 * {@code Feature} (or {@code NONE}). Accepted features are stored as
 * {@code experiences/<slug>.feature} and announced with
 * {@code experience.synthesized}.
 *
 * <p>
 * Reflection runs on the agent executor and never affects the turn that
 * triggered it.
 */
@Service
@Slf4j
public class ExperienceSynthesizer {

    static final String NONE = "NONE";
    private static final String FEATURE_PREFIX = "Feature:";
    private static final int REFLECTION_MAX_TOKENS = 2000;
    private static final int MAX_SLUG_CHARS = 60;
    private static final int ERROR_EXCERPT_CHARS = 200;
    private static final int MAX_KEY_EVENTS = 15;

    private static final String SYSTEM_PROMPT = "You are a concise experience recorder for a ComfyUI workflow "
            + "agent. Output only valid Gherkin Feature text, or exactly NONE.";

    private static final String REFLECTION_PROMPT = """
            Review this completed ComfyUI agent conversation and extract learnings.

            Write your reflection as a Gherkin Feature file:

            Feature: <Experience title: what was learned>
              Scenario: <Specific lesson or pattern discovered>
                Given <the situation or context>
                When <what happened or what action was taken>
                Then <what was learned or what the outcome was>

            Rules:
            - The Feature name is a clear, reusable lesson title
            - Each Scenario captures ONE concrete learning
            - Given/When/Then are specific: include node names, connection types or parameter values
            - Focus on workflow patterns, node combinations, user preferences or error recovery

            Conversation context:
            - Tool calls: %d
            - Tools used: %s
            - Duration: %.1fs
            - Errors: %d
            %s
            If the conversation was trivial (simple greeting, no real work), respond with exactly "NONE".""";

    private final EventBus eventBus;
    private final ModelPort modelPort;
    private final StoragePort storagePort;
    private final Clock clock;
    private final Executor executor;
    private final AgentProperties.ExperienceProperties settings;
    private final String experiencesDir;

    private final Map<String, TurnStats> stats = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastSaved = new AtomicReference<>(Instant.EPOCH);
    private EventSubscription subscription;

    @Autowired
    public ExperienceSynthesizer(EventBus eventBus, ModelPort modelPort, StoragePort storagePort, Clock clock,
            @Qualifier("agentExecutor") Executor executor, AgentProperties properties) {
        this.eventBus = eventBus;
        this.modelPort = modelPort;
        this.storagePort = storagePort;
        this.clock = clock;
        this.executor = executor;
        this.settings = properties.getExperience();
        this.experiencesDir = properties.getStorage().getExperiencesDirectory();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Experience] Experience synthesis disabled");
            return;
        }
        subscription = eventBus.subscribeAll(this::onEvent);
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.close();
        }
    }

    void onEvent(AgentEvent event) {
        String sessionId = event.sessionId();
        switch (event.type()) {
        case TOOL_COMPLETED -> statsFor(sessionId).toolCompleted(String.valueOf(event.get("tool_name")));
        case TOOL_FAILED -> statsFor(sessionId).toolFailed(String.valueOf(event.get("tool_name")),
                String.valueOf(event.get("error")));
        case WORKFLOW_SUBMITTED -> statsFor(sessionId).workflowSubmitted(event.get("workflow"));
        case TURN_END -> onTurnEnd(sessionId, event);
        default -> {
            // not tracked
        }
        }
    }

    private void onTurnEnd(String sessionId, AgentEvent event) {
        TurnStats turn = stats.remove(sessionId);
        if (turn == null || turn.toolCalls() < settings.getMinToolCalls()) {
            return;
        }
        if (isCoolingDown()) {
            log.debug("[Experience] Skipping reflection for session {}: cooldown", sessionId);
            return;
        }
        double duration = event.get("duration") instanceof Number n ? n.doubleValue() : 0.0;
        executor.execute(() -> {
            try {
                reflect(sessionId, turn, duration);
            } catch (RuntimeException e) { // NOSONAR - reflection must never surface to the turn
                log.warn("[Experience] Reflection failed for session {}: {}", sessionId, e.getMessage());
            }
        });
    }

    /**
     * Asks the model for an experience and stores it.
     *
     * @return the stored experience name, or {@code null} when nothing was saved
     */
    String reflect(String sessionId, TurnStats turn, double durationSeconds) {
        ModelRequest request = ModelRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .messages(List.of(Message.userText(turn.describe(durationSeconds), clock.instant())))
                .tools(List.of())
                .maxTokens(REFLECTION_MAX_TOKENS)
                .build();
        ModelResponse response = modelPort.chat(request).join();

        String gherkin = stripFences(response.getText());
        if (gherkin.equalsIgnoreCase(NONE) || !gherkin.startsWith(FEATURE_PREFIX)) {
            log.debug("[Experience] No notable experience in session {}", sessionId);
            return null;
        }
        if (isCoolingDown()) {
            return null;
        }

        String title = titleOf(gherkin);
        String name = slugify(title) + "-" + clock.instant().getEpochSecond();
        storagePort.putText(experiencesDir, name + ".feature", gherkin + "\n").join();
        lastSaved.set(clock.instant());
        log.info("[Experience] Saved experience '{}' from session {}", name, sessionId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("title", title);
        eventBus.emit(sessionId, AgentEventType.EXPERIENCE_SYNTHESIZED, data);
        return name;
    }

    private boolean isCoolingDown() {
        Duration cooldown = Duration.ofSeconds(settings.getCooldownSeconds());
        return lastSaved.get().plus(cooldown).isAfter(clock.instant());
    }

    private TurnStats statsFor(String sessionId) {
        return stats.computeIfAbsent(sessionId, id -> new TurnStats());
    }

    static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        return trimmed.lines()
                .filter(line -> !line.strip().startsWith("```"))
                .reduce((a, b) -> a + "\n" + b)
                .orElse("")
                .strip();
    }

    static String titleOf(String gherkin) {
        String firstLine = gherkin.lines().findFirst().orElse(FEATURE_PREFIX);
        String title = firstLine.substring(FEATURE_PREFIX.length()).strip();
        return title.isEmpty() ? "experience" : title;
    }

    static String slugify(String title) {
        String slug = title.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.length() > MAX_SLUG_CHARS) {
            slug = slug.substring(0, MAX_SLUG_CHARS).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "experience" : slug;
    }

    /**
     * What happened in one turn, as far as the events tell.
     */
    static final class TurnStats {

        private int toolCalls;
        private int errors;
        private final TreeSet<String> toolsUsed = new TreeSet<>();
        private final TreeSet<String> workflowNodes = new TreeSet<>();
        private final List<String> keyEvents = new ArrayList<>();

        synchronized void toolCompleted(String toolName) {
            toolCalls++;
            toolsUsed.add(toolName);
            addKeyEvent("ok " + toolName);
        }

        synchronized void toolFailed(String toolName, String error) {
            toolCalls++;
            errors++;
            toolsUsed.add(toolName);
            String excerpt = error.length() > ERROR_EXCERPT_CHARS ? error.substring(0, ERROR_EXCERPT_CHARS) : error;
            addKeyEvent("failed " + toolName + ": " + excerpt);
        }

        synchronized void workflowSubmitted(Object workflow) {
            if (workflow instanceof Map<?, ?> nodes) {
                for (Object node : nodes.values()) {
                    if (node instanceof Map<?, ?> config && config.get("class_type") != null) {
                        workflowNodes.add(String.valueOf(config.get("class_type")));
                    }
                }
            }
        }

        synchronized int toolCalls() {
            return toolCalls;
        }

        synchronized String describe(double durationSeconds) {
            StringBuilder extra = new StringBuilder();
            if (!workflowNodes.isEmpty()) {
                extra.append("- Workflow nodes used: ").append(String.join(", ", workflowNodes)).append('\n');
            }
            if (!keyEvents.isEmpty()) {
                extra.append("- Key events:\n");
                keyEvents.forEach(e -> extra.append("  - ").append(e).append('\n'));
            }
            return String.format(Locale.ROOT, REFLECTION_PROMPT, toolCalls,
                    toolsUsed.isEmpty() ? "none" : String.join(", ", toolsUsed),
                    durationSeconds, errors, extra);
        }

        private void addKeyEvent(String summary) {
            if (keyEvents.size() < MAX_KEY_EVENTS) {
                keyEvents.add(summary);
            }
        }
    }
}
