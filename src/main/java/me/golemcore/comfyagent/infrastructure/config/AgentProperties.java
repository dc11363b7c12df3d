package me.golemcore.comfyagent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the agent, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider and retry policy</li>
 * <li>{@link LoopProperties} - iteration budget and loop detection</li>
 * <li>{@link ToolsProperties} - execution timeout, result limits, web
 * search</li>
 * <li>{@link SubagentProperties} - nested loop budget</li>
 * <li>{@link ContextProperties} - history compression</li>
 * <li>{@link EventsProperties} - per-subscriber buffering</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link ComfyUiProperties} - workflow backend endpoint</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private SubagentProperties subagent = new SubagentProperties();
    private ContextProperties context = new ContextProperties();
    private EventsProperties events = new EventsProperties();
    private StorageProperties storage = new StorageProperties();
    private ComfyUiProperties comfyui = new ComfyUiProperties();
    private HttpProperties http = new HttpProperties();
    private ExperienceProperties experience = new ExperienceProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** {@code anthropic} or {@code openai} (any OpenAI-compatible endpoint). */
        private String provider = "anthropic";
        private String model = "claude-sonnet-4-20250514";
        private String apiKey;
        private String baseUrl;
        private int maxTokens = 8192;
        private Double temperature;
        private boolean streaming = true;
        private long requestTimeoutMs = 300000;
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 5;
        private long baseDelayMs = 2000;
        private long maxDelayMs = 60000;
        private double jitter = 0.2;
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxIterations = 50;
        /** Identical consecutive tool calls that trigger the loop warning. */
        private int repeatedToolThreshold = 3;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int timeoutSeconds = 60;
        private int maxResultChars = 15000;
        /** Length of {@code message.tool_result} payload previews. */
        private int eventPreviewChars = 500;
        private WebSearchProperties webSearch = new WebSearchProperties();
        private WebFetchProperties webFetch = new WebFetchProperties();
    }

    @Data
    public static class WebSearchProperties {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com";
        private int defaultCount = 5;
    }

    @Data
    public static class WebFetchProperties {
        private boolean enabled = true;
        private long maxBytes = 5L * 1024 * 1024;
        private int defaultTimeoutSeconds = 30;
        private int maxTimeoutSeconds = 120;
    }

    // ==================== SUBAGENT ====================

    @Data
    public static class SubagentProperties {
        private boolean enabled = true;
        private int maxIterations = 10;
        private int previewChars = 200;
        private int timeoutSeconds = 600;
        private List<String> tools = new ArrayList<>(List.of(
                "list_nodes", "get_node_info", "list_models", "get_queue", "get_history", "web_search", "web_fetch",
                "validate_workflow"));
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        /** {@code window} or {@code summarize}. */
        private String strategy = "window";
        private int maxTokens = 150000;
        private int summarizeThresholdTokens = 80000;
        private int keepRecentTurns = 4;
        private int summaryMaxChars = 4000;
    }

    // ==================== EVENTS ====================

    @Data
    public static class EventsProperties {
        private int subscriberBuffer = 512;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.comfy-agent/workspace";
        private String sessionsDirectory = "sessions";
        private String experiencesDirectory = "experiences";
    }

    // ==================== COMFYUI ====================

    @Data
    public static class ComfyUiProperties {
        private String baseUrl = "http://127.0.0.1:8188";
        private String clientId = "comfy-agent";
        private int historyMaxItems = 200;
        private long catalogTtlSeconds = 300;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== EXPERIENCE ====================

    @Data
    public static class ExperienceProperties {
        private boolean enabled = true;
        private long cooldownSeconds = 120;
        private int minToolCalls = 1;
    }
}
