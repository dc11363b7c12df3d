package me.golemcore.comfyagent.domain.loop;

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
import me.golemcore.comfyagent.domain.context.ContextCompressor;
import me.golemcore.comfyagent.domain.events.AgentEventType;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.exception.ModelCallException;
import me.golemcore.comfyagent.domain.exception.PersistenceException;
import me.golemcore.comfyagent.domain.model.CancellationToken;
import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.ErrorKind;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.SessionStatus;
import me.golemcore.comfyagent.domain.model.SubagentResult;
import me.golemcore.comfyagent.domain.model.ToolCall;
import me.golemcore.comfyagent.domain.model.ToolCallStatus;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.model.TurnOutcome;
import me.golemcore.comfyagent.domain.model.TurnStatus;
import me.golemcore.comfyagent.domain.service.ModelClient;
import me.golemcore.comfyagent.domain.tools.ToolExecutor;
import me.golemcore.comfyagent.domain.tools.ToolInvocationContext;
import me.golemcore.comfyagent.port.outbound.SessionPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one conversational turn: model reasoning interleaved with tool calls
 * until the model answers, the iteration budget runs out, the turn is
 * cancelled, or a fatal error occurs.
 *
 * <p>
 * Every turn emits {@code state.conversation_start} first, then exactly one of
 * {@code turn.response}, {@code turn.error} or {@code turn.cancelled}, followed
 * by {@code turn.end} with duration, iteration count and token usage.
 *
 * <p>
 * Each model response is persisted before its tool calls run, and the results
 * of a batch are persisted as one message when the batch ends. A batch cut
 * short by cancellation or a fatal tool failure still records a result for
 * every call, so the history never holds a tool call without its result.
 * Cancellation is cooperative: the token is checked before each iteration and
 * before each tool call; a model or tool call already in flight completes.
 */
@Slf4j
public class AgentLoop {

    public static final String MAX_ITERATIONS_MESSAGE = "I've reached the maximum number of steps. "
            + "Here's what I've done so far.";
    public static final String CANCELLED_MESSAGE = "Request cancelled.";
    public static final String TOOL_LOOP_CANCELLED = "Tool loop stopped: cancelled";
    public static final String TOOL_LOOP_FATAL = "Tool loop stopped: fatal tool failure";

    private final AgentLoopSettings settings;
    private final SessionPort sessionPort;
    private final ModelClient modelClient;
    private final ToolExecutor toolExecutor;
    private final EventBus eventBus;
    private final ContextCompressor contextCompressor;
    private final Clock clock;

    public AgentLoop(AgentLoopSettings settings, SessionPort sessionPort, ModelClient modelClient,
            ToolExecutor toolExecutor, EventBus eventBus, ContextCompressor contextCompressor, Clock clock) {
        this.settings = settings;
        this.sessionPort = sessionPort;
        this.modelClient = modelClient;
        this.toolExecutor = toolExecutor;
        this.eventBus = eventBus;
        this.contextCompressor = contextCompressor;
        this.clock = clock;
    }

    public AgentLoopSettings getSettings() {
        return settings;
    }

    /**
     * Runs a turn for {@code userText} and returns its outcome. Failures end the
     * turn with a {@code turn.error} event instead of propagating.
     */
    public TurnOutcome run(String sessionId, String userText, CancellationToken token) {
        return run(sessionId, userText, token, () -> {
        });
    }

    /**
     * Same as {@link #run(String, String, CancellationToken)}, calling
     * {@code beforeTerminal} once the turn's last session write is done and
     * right before the terminal event goes out.
     */
    public TurnOutcome run(String sessionId, String userText, CancellationToken token, Runnable beforeTerminal) {
        Turn turn = new Turn(sessionId, token, clock.instant(), settings.repeatedToolThreshold(), beforeTerminal);
        emit(turn, AgentEventType.CONVERSATION_START, Map.of());
        log.info("[AgentLoop] {} turn started for session {}", settings.name(), sessionId);

        try {
            sessionPort.updateStatus(sessionId, SessionStatus.ACTIVE);
            sessionPort.appendMessage(sessionId, Message.userText(userText, clock.instant()));

            while (true) {
                if (token.isCancelled()) {
                    return cancel(turn);
                }
                if (turn.iterations >= settings.maxIterations()) {
                    return exhaustBudget(turn);
                }
                turn.iterations++;
                turn.stateMachine.transition(AgentState.THINKING);
                emit(turn, AgentEventType.THINKING, Map.of("iteration", turn.iterations));
                log.debug("[AgentLoop] Iteration {}/{} for session {}", turn.iterations, settings.maxIterations(),
                        sessionId);

                ModelResponse response = think(turn);
                if (!response.hasToolCalls()) {
                    return complete(turn, response.getText());
                }

                turn.stateMachine.transition(AgentState.TOOL_EXECUTING);
                BatchOutcome batch = executeTools(turn, response);
                if (batch == BatchOutcome.CANCELLED) {
                    return cancel(turn);
                }
                if (batch == BatchOutcome.FATAL) {
                    return fail(turn, ErrorKind.TOOL_FAILURE, turn.fatalToolError, true);
                }
            }
        } catch (ModelCallException e) {
            log.error("[AgentLoop] Model call failed for session {}: {}", sessionId, e.getMessage());
            return fail(turn, ErrorKind.FATAL_UPSTREAM, e.getMessage(), true);
        } catch (PersistenceException e) {
            log.error("[AgentLoop] Persistence failed for session {}", sessionId, e);
            return fail(turn, ErrorKind.PERSISTENCE_FAILURE, e.getMessage(), false);
        } catch (RuntimeException e) { // NOSONAR - every turn must end with a terminal event
            log.error("[AgentLoop] Unexpected failure for session {}", sessionId, e);
            return fail(turn, ErrorKind.FATAL_UPSTREAM, "Internal error: " + e.getMessage(), false);
        }
    }

    private ModelResponse think(Turn turn) {
        List<Message> history = sessionPort.getMessages(turn.sessionId);
        List<Message> view = contextCompressor.compress(turn.sessionId, history);

        String systemPrompt = settings.systemPrompt();
        Optional<String> loopWarning = turn.repeatedTools.warning();
        if (loopWarning.isPresent()) {
            systemPrompt = systemPrompt + "\n\n" + loopWarning.get();
        }

        ModelRequest request = ModelRequest.builder()
                .systemPrompt(systemPrompt)
                .messages(view)
                .tools(settings.tools().getDefinitions())
                .maxTokens(settings.maxTokens())
                .build();

        AssistantMessageBuilder builder = new AssistantMessageBuilder();
        ModelResponse response = modelClient.send(turn.sessionId, request, new ModelClient.StreamListener() {
            @Override
            public void onDelta(String text) {
                builder.append(text);
                emit(turn, AgentEventType.STREAM_TEXT_DELTA, Map.of("text", text));
            }

            @Override
            public void onRetry() {
                builder.reset();
            }
        });

        turn.usage = turn.usage.plus(response.getUsage());
        if ((response.getText() == null || response.getText().isEmpty()) && !builder.isEmpty()) {
            response.setText(builder.getText());
        }
        return response;
    }

    private BatchOutcome executeTools(Turn turn, ModelResponse response) {
        List<ToolCall> toolCalls = response.getToolCalls();
        for (ToolCall call : toolCalls) {
            if (call.getId() == null || call.getId().isBlank()) {
                call.setId("call_" + UUID.randomUUID().toString().replace("-", ""));
            }
            if (call.getArguments() == null) {
                call.setArguments(Map.of());
            }
        }
        sessionPort.appendMessage(turn.sessionId, Message.assistant(response.getText(), toolCalls, clock.instant()));

        List<ContentBlock> resultBlocks = new ArrayList<>();
        BatchOutcome outcome = BatchOutcome.CONTINUE;
        for (ToolCall call : toolCalls) {
            if (outcome != BatchOutcome.CONTINUE) {
                String reason = outcome == BatchOutcome.CANCELLED ? TOOL_LOOP_CANCELLED : TOOL_LOOP_FATAL;
                resultBlocks.add(ContentBlock.toolResult(call.getId(), call.getName(), reason, true));
                continue;
            }
            if (turn.token.isCancelled()) {
                outcome = BatchOutcome.CANCELLED;
                resultBlocks.add(ContentBlock.toolResult(call.getId(), call.getName(), TOOL_LOOP_CANCELLED, true));
                continue;
            }
            ToolResult result = executeTool(turn, call);
            String text = result.toConversationText();
            resultBlocks.add(ContentBlock.toolResult(call.getId(), call.getName(), text, !result.isSuccess()));
            if (result.getData() != null
                    && result.getData().get(SubagentResult.DATA_KEY) instanceof SubagentResult subagent) {
                resultBlocks.add(subagent.toContentBlock());
            }
            if (result.isFatal()) {
                turn.fatalToolError = text;
                outcome = BatchOutcome.FATAL;
            }
        }

        sessionPort.appendMessage(turn.sessionId, Message.toolResults(resultBlocks, clock.instant()));
        return outcome;
    }

    private ToolResult executeTool(Turn turn, ToolCall call) {
        call.setStatus(ToolCallStatus.EXECUTING);
        turn.repeatedTools.record(call.getName());
        Map<String, Object> executing = new LinkedHashMap<>();
        executing.put("tool_name", call.getName());
        executing.put("tool_id", call.getId());
        emit(turn, AgentEventType.TOOL_EXECUTING, executing);

        ToolResult result = toolExecutor.execute(settings.tools(), call,
                new ToolInvocationContext(turn.sessionId, call.getId(), turn.token));
        String text = result.toConversationText();

        if (result.isSuccess()) {
            call.setStatus(ToolCallStatus.COMPLETED);
            emit(turn, AgentEventType.TOOL_COMPLETED, Map.of("tool_name", call.getName()));
            Object workflow = result.getData() != null ? result.getData().get("workflow") : null;
            if (workflow != null) {
                Map<String, Object> submitted = new LinkedHashMap<>();
                submitted.put("workflow", workflow);
                submitted.put("prompt_id", result.getData().getOrDefault("prompt_id", ""));
                emit(turn, AgentEventType.WORKFLOW_SUBMITTED, submitted);
            }
        } else {
            call.setStatus(ToolCallStatus.FAILED);
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("tool_name", call.getName());
            failed.put("error", text);
            emit(turn, AgentEventType.TOOL_FAILED, failed);
            log.info("[AgentLoop] Tool '{}' failed ({}): {}", call.getName(), result.getFailureKind(), text);
        }

        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("tool_name", call.getName());
        preview.put("tool_id", call.getId());
        preview.put("result", preview(text));
        preview.put("is_error", !result.isSuccess());
        emit(turn, AgentEventType.TOOL_RESULT, preview);
        return result;
    }

    private TurnOutcome complete(Turn turn, String text) {
        String content = text != null ? text : "";
        sessionPort.appendMessage(turn.sessionId, Message.assistant(content, List.of(), clock.instant()));
        sessionPort.updateStatus(turn.sessionId, SessionStatus.COMPLETED);
        turn.stateMachine.transition(AgentState.DONE);
        return finish(turn, TurnStatus.COMPLETED, content, null, null, AgentEventType.TURN_RESPONSE,
                Map.of("content", content));
    }

    private TurnOutcome cancel(Turn turn) {
        log.info("[AgentLoop] Turn cancelled for session {}", turn.sessionId);
        Message message = Message.assistant(CANCELLED_MESSAGE, List.of(), clock.instant());
        message.getMetadata().put(Message.META_CANCELLED, true);
        sessionPort.appendMessage(turn.sessionId, message);
        sessionPort.updateStatus(turn.sessionId, SessionStatus.CANCELLED);
        turn.stateMachine.transition(AgentState.CANCELLED);
        return finish(turn, TurnStatus.CANCELLED, CANCELLED_MESSAGE, ErrorKind.CANCELLED, null,
                AgentEventType.TURN_CANCELLED, Map.of("content", CANCELLED_MESSAGE));
    }

    private TurnOutcome exhaustBudget(Turn turn) {
        log.warn("[AgentLoop] Max iterations ({}) reached for session {}", settings.maxIterations(),
                turn.sessionId);
        sessionPort.appendMessage(turn.sessionId,
                Message.assistant(MAX_ITERATIONS_MESSAGE, List.of(), clock.instant()));
        turn.stateMachine.transition(AgentState.FAILED);
        return finish(turn, TurnStatus.FAILED, MAX_ITERATIONS_MESSAGE, ErrorKind.BUDGET_EXCEEDED,
                MAX_ITERATIONS_MESSAGE, AgentEventType.TURN_ERROR,
                errorData(ErrorKind.BUDGET_EXCEEDED, MAX_ITERATIONS_MESSAGE));
    }

    private TurnOutcome fail(Turn turn, ErrorKind kind, String error, boolean recordInHistory) {
        if (recordInHistory) {
            try {
                Message message = Message.assistant("Error: " + error, List.of(), clock.instant());
                message.getMetadata().put("error_kind", kind.wireName());
                sessionPort.appendMessage(turn.sessionId, message);
            } catch (PersistenceException e) {
                log.error("[AgentLoop] Could not record failure for session {}: {}", turn.sessionId,
                        e.getMessage());
                kind = ErrorKind.PERSISTENCE_FAILURE;
            }
        }
        if (turn.stateMachine.canTransition(AgentState.FAILED)) {
            turn.stateMachine.transition(AgentState.FAILED);
        }
        return finish(turn, TurnStatus.FAILED, error, kind, error, AgentEventType.TURN_ERROR, errorData(kind, error));
    }

    /**
     * Records usage, releases the turn and emits the terminal event followed by
     * {@code turn.end}. No session write happens after {@code beforeTerminal}.
     */
    private TurnOutcome finish(Turn turn, TurnStatus status, String content, ErrorKind kind, String error,
            AgentEventType terminalType, Map<String, Object> terminalData) {
        try {
            sessionPort.addUsage(turn.sessionId, turn.usage);
        } catch (PersistenceException e) {
            log.warn("[AgentLoop] Failed to record usage for session {}: {}", turn.sessionId, e.getMessage());
        }

        Duration duration = Duration.between(turn.startedAt, clock.instant());
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("duration", duration.toMillis() / 1000.0);
        stats.put("iterations", turn.iterations);
        stats.put("usage", turn.usage.toPayload());
        stats.put("status", status.name().toLowerCase(Locale.ROOT));

        turn.beforeTerminal.run();
        emit(turn, terminalType, terminalData);
        emit(turn, AgentEventType.TURN_END, stats);
        log.info("[AgentLoop] {} turn {} for session {} after {} iterations", settings.name(),
                status.name().toLowerCase(Locale.ROOT), turn.sessionId, turn.iterations);

        return TurnOutcome.builder()
                .sessionId(turn.sessionId)
                .status(status)
                .content(content)
                .errorKind(kind)
                .error(error)
                .iterations(turn.iterations)
                .usage(turn.usage)
                .duration(duration)
                .build();
    }

    private static Map<String, Object> errorData(ErrorKind kind, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put("kind", kind.wireName());
        return data;
    }

    private void emit(Turn turn, AgentEventType type, Map<String, Object> data) {
        eventBus.emit(turn.sessionId, type, data);
    }

    private String preview(String text) {
        int limit = settings.eventPreviewChars();
        if (text == null || limit <= 0 || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit);
    }

    private enum BatchOutcome {
        CONTINUE, CANCELLED, FATAL
    }

    /**
     * Mutable state of the running turn. Confined to the loop thread.
     */
    private static final class Turn {

        private final String sessionId;
        private final CancellationToken token;
        private final Instant startedAt;
        private final AgentStateMachine stateMachine = new AgentStateMachine();
        private final RepeatedToolDetector repeatedTools;
        private final Runnable beforeTerminal;
        private int iterations;
        private ModelUsage usage = ModelUsage.empty();
        private String fatalToolError;

        private Turn(String sessionId, CancellationToken token, Instant startedAt, int repeatedToolThreshold,
                Runnable beforeTerminal) {
            this.sessionId = sessionId;
            this.token = token;
            this.startedAt = startedAt;
            this.repeatedTools = new RepeatedToolDetector(repeatedToolThreshold);
            this.beforeTerminal = beforeTerminal;
        }
    }
}
