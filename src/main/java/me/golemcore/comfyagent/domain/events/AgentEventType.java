package me.golemcore.comfyagent.domain.events;

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

/**
 * Event types of the per-session stream, keyed by their wire names.
 *
 * <p>
 * The three {@code turn.*} terminal types close a turn; the gateway maps them to
 * the {@code response}, {@code error} and {@code cancelled} wire messages
 * instead of relaying them as plain events.
 */
public enum AgentEventType {

    STREAM_TEXT_DELTA("stream.text_delta"),
    CONVERSATION_START("state.conversation_start"),
    THINKING("state.thinking"),
    TOOL_EXECUTING("state.tool_executing"),
    TOOL_COMPLETED("state.tool_completed"),
    TOOL_FAILED("state.tool_failed"),
    TOOL_RESULT("message.tool_result"),
    SUBAGENT_START("subagent.start"),
    SUBAGENT_END("subagent.end"),
    LLM_RETRY("llm.retry"),
    TURN_END("turn.end"),
    WORKFLOW_SUBMITTED("workflow.submitted"),
    EXPERIENCE_SYNTHESIZED("experience.synthesized"),
    TURN_RESPONSE("turn.response", true),
    TURN_ERROR("turn.error", true),
    TURN_CANCELLED("turn.cancelled", true);

    private final String wireName;
    private final boolean terminal;

    AgentEventType(String wireName) {
        this(wireName, false);
    }

    AgentEventType(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
