package me.golemcore.comfyagent.tools;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Web search through the Brave Search API.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.tools.web-search.enabled} - Enable/disable
 * <li>{@code agent.tools.web-search.api-key} - Brave API key (required)
 * <li>{@code agent.tools.web-search.default-count} - Number of results (default
 * 5)
 * </ul>
 *
 * <p>
 * The tool disables itself when no API key is configured, so it never reaches
 * the tool registry.
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";
    private static final int MAX_COUNT = 10;

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final AgentProperties properties;

    private BraveSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getWebSearch();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.defaultCount = config.getDefaultCount();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("[Tools] web_search is enabled but no Brave API key is configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl());
            log.info("[Tools] web_search initialized (default results: {})", defaultCount);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web for ComfyUI ecosystem information: workflow templates, model "
                        + "download pages, custom node packages and troubleshooting. Add 'comfyui' to the "
                        + "query for ecosystem-specific results. Returns titles, URLs and snippets.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "The search query"),
                                PARAM_COUNT, Map.of(
                                        "type", "integer",
                                        "description", "Number of results (1-" + MAX_COUNT + ", default: "
                                                + defaultCount + ")")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String query = parameters.get(PARAM_QUERY) instanceof String text ? text.trim() : "";
            if (query.isEmpty()) {
                return ToolResult.failure("Search query is required");
            }

            int count = defaultCount;
            if (parameters.get(PARAM_COUNT) instanceof Number n) {
                count = Math.max(1, Math.min(MAX_COUNT, n.intValue()));
            }
            return executeWithRetry(query, count);
        });
    }

    private ToolResult executeWithRetry(String query, int count) {
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("[Tools] web_search: query='{}', count={}, attempt={}", query, count, attempt);
                return buildSuccessResult(query, searchApi.search(apiKey, query, count));
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Tools] Brave rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleep(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[Tools] Brave rate limit exceeded after {} retries for query: {}", MAX_RETRIES, query);
                    return ToolResult.failure("Search failed: rate limit exceeded, try again later");
                } else {
                    log.error("[Tools] Brave API error (status {}) for query: {}", e.status(), query, e);
                    return ToolResult.failure("Search failed: HTTP " + e.status());
                }
            }
        }
        return ToolResult.failure("Search failed: rate limit exceeded, try again later");
    }

    private ToolResult buildSuccessResult(String query, BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolResult.success("No results found for: " + query);
        }

        List<WebResult> results = response.getWeb().getResults();
        List<String> lines = new ArrayList<>();
        lines.add("Search results for: " + query);
        lines.add("");
        for (int i = 0; i < results.size(); i++) {
            WebResult r = results.get(i);
            lines.add((i + 1) + ". " + nullToEmpty(r.getTitle()));
            lines.add("   URL: " + nullToEmpty(r.getUrl()));
            if (r.getDescription() != null && !r.getDescription().isBlank()) {
                lines.add("   " + r.getDescription());
            }
            lines.add("");
        }

        return ToolResult.success(String.join("\n", lines), Map.of(
                PARAM_QUERY, query,
                PARAM_COUNT, results.size(),
                "results", results.stream()
                        .map(r -> Map.of(
                                "title", nullToEmpty(r.getTitle()),
                                "url", nullToEmpty(r.getUrl()),
                                "description", nullToEmpty(r.getDescription())))
                        .toList()));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("web_search retry sleep interrupted", e);
        }
    }

    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebWrapper web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebWrapper {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
