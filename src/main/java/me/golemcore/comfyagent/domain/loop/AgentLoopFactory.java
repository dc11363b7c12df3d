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
import me.golemcore.comfyagent.domain.context.ModelSummaryCompressor;
import me.golemcore.comfyagent.domain.context.TurnWindowCompressor;
import me.golemcore.comfyagent.domain.events.EventBus;
import me.golemcore.comfyagent.domain.service.ModelClient;
import me.golemcore.comfyagent.domain.service.PromptProvider;
import me.golemcore.comfyagent.domain.service.SessionService;
import me.golemcore.comfyagent.domain.tools.ToolExecutor;
import me.golemcore.comfyagent.domain.tools.ToolRegistry;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import me.golemcore.comfyagent.port.outbound.SessionPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the top-level agent loop and the narrower loops used by sub-agents.
 */
@Component
@Slf4j
public class AgentLoopFactory {

    private final SessionPort sessionPort;
    private final ModelClient modelClient;
    private final ToolExecutor toolExecutor;
    private final EventBus eventBus;
    private final ToolRegistry toolRegistry;
    private final PromptProvider promptProvider;
    private final AgentProperties properties;
    private final Clock clock;
    private final ContextCompressor contextCompressor;

    public AgentLoopFactory(SessionPort sessionPort, ModelClient modelClient, ToolExecutor toolExecutor,
            EventBus eventBus, ToolRegistry toolRegistry, PromptProvider promptProvider, ModelPort modelPort,
            AgentProperties properties, Clock clock) {
        this.sessionPort = sessionPort;
        this.modelClient = modelClient;
        this.toolExecutor = toolExecutor;
        this.eventBus = eventBus;
        this.toolRegistry = toolRegistry;
        this.promptProvider = promptProvider;
        this.properties = properties;
        this.clock = clock;
        this.contextCompressor = createCompressor(properties.getContext(), modelPort);
    }

    public AgentLoop createMainLoop() {
        return build(AgentLoopSettings.builder()
                .name("main")
                .systemPrompt(promptProvider.getSystemPrompt())
                .tools(toolRegistry)
                .maxIterations(properties.getLoop().getMaxIterations())
                .repeatedToolThreshold(properties.getLoop().getRepeatedToolThreshold())
                .maxTokens(properties.getLlm().getMaxTokens())
                .eventPreviewChars(properties.getTools().getEventPreviewChars())
                .build());
    }

    /**
     * Loop restricted to the configured read-only tools, so a sub-agent can never
     * delegate further or submit work.
     */
    public AgentLoop createSubagentLoop() {
        return build(AgentLoopSettings.builder()
                .name("subagent")
                .systemPrompt(promptProvider.getSubagentPrompt())
                .tools(toolRegistry.subset(properties.getSubagent().getTools()))
                .maxIterations(properties.getSubagent().getMaxIterations())
                .repeatedToolThreshold(properties.getLoop().getRepeatedToolThreshold())
                .maxTokens(properties.getLlm().getMaxTokens())
                .eventPreviewChars(properties.getTools().getEventPreviewChars())
                .build());
    }

    public AgentLoop build(AgentLoopSettings settings) {
        return new AgentLoop(settings, sessionPort, modelClient, toolExecutor, eventBus, contextCompressor, clock);
    }

    ContextCompressor getContextCompressor() {
        return contextCompressor;
    }

    @EventListener
    public void onSessionDeleted(SessionService.SessionDeletedEvent event) {
        contextCompressor.forget(event.sessionId());
    }

    static ContextCompressor createCompressor(AgentProperties.ContextProperties context, ModelPort modelPort) {
        if ("summarize".equalsIgnoreCase(context.getStrategy())) {
            log.info("[Context] Using model summaries above {} tokens", context.getSummarizeThresholdTokens());
            return new ModelSummaryCompressor(modelPort, context.getSummarizeThresholdTokens(),
                    context.getKeepRecentTurns(), context.getSummaryMaxChars());
        }
        return new TurnWindowCompressor(context.getMaxTokens(), context.getKeepRecentTurns(),
                context.getSummaryMaxChars());
    }
}
