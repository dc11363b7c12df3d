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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guards the legal transitions of a single turn. One instance per turn; a
 * terminal state accepts no further transition.
 */
public class AgentStateMachine {

    private static final Map<AgentState, Set<AgentState>> TRANSITIONS = new EnumMap<>(AgentState.class);

    static {
        TRANSITIONS.put(AgentState.IDLE,
                EnumSet.of(AgentState.THINKING, AgentState.CANCELLED, AgentState.FAILED));
        TRANSITIONS.put(AgentState.THINKING,
                EnumSet.of(AgentState.TOOL_EXECUTING, AgentState.DONE, AgentState.CANCELLED, AgentState.FAILED));
        TRANSITIONS.put(AgentState.TOOL_EXECUTING,
                EnumSet.of(AgentState.THINKING, AgentState.CANCELLED, AgentState.FAILED));
        TRANSITIONS.put(AgentState.DONE, EnumSet.noneOf(AgentState.class));
        TRANSITIONS.put(AgentState.CANCELLED, EnumSet.noneOf(AgentState.class));
        TRANSITIONS.put(AgentState.FAILED, EnumSet.noneOf(AgentState.class));
    }

    private AgentState state = AgentState.IDLE;

    public AgentState getState() {
        return state;
    }

    public boolean canTransition(AgentState target) {
        return TRANSITIONS.get(state).contains(target);
    }

    public void transition(AgentState target) {
        if (!canTransition(target)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + target);
        }
        state = target;
    }
}
