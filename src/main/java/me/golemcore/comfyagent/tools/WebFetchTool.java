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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fetches a URL and returns its readable content.
 *
 * <p>
 * HTML is reduced to headings, paragraphs, list items and code blocks of the
 * main content area. JSON, XML and plain text are returned as they are. Bodies
 * larger than {@code agent.tools.web-fetch.max-bytes} are cut at that size.
 */
@Component
@Slf4j
public class WebFetchTool implements ToolComponent {

    private static final String PARAM_URL = "url";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final String USER_AGENT = "comfy-agent/0.1 (web_fetch)";
    private static final String NOISE = "script, style, noscript, template, nav, header, footer, aside, form, "
            + "iframe, svg, button";
    private static final String BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, pre, blockquote, td, th, dt, dd";

    private final OkHttpClient httpClient;
    private final AgentProperties.WebFetchProperties settings;

    public WebFetchTool(OkHttpClient okHttpClient, AgentProperties properties) {
        this.httpClient = okHttpClient;
        this.settings = properties.getTools().getWebFetch();
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public Duration getTimeout() {
        // the call timeout below fires first
        return Duration.ofSeconds(settings.getMaxTimeoutSeconds() + 5L);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_fetch")
                .description("Fetch a URL and return its readable content. Use it after web_search to read "
                        + "workflow JSON on GitHub (raw.githubusercontent.com), documentation, tutorials or "
                        + "model cards on HuggingFace and Civitai. HTML is reduced to its main text; JSON and "
                        + "plain text are returned as is. HTTP and HTTPS only.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        "type", "string",
                                        "description", "The URL to fetch"),
                                PARAM_TIMEOUT, Map.of(
                                        "type", "integer",
                                        "description", "Timeout in seconds (default: "
                                                + settings.getDefaultTimeoutSeconds() + ", max: "
                                                + settings.getMaxTimeoutSeconds() + ")")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String url = parameters.get(PARAM_URL) instanceof String text ? text.trim() : "";
            if (url.isEmpty()) {
                return ToolResult.failure("url is required");
            }
            HttpUrl parsed = HttpUrl.parse(url);
            if (parsed == null) {
                return ToolResult.failure("URL must start with http:// or https://");
            }

            int timeoutSeconds = settings.getDefaultTimeoutSeconds();
            if (parameters.get(PARAM_TIMEOUT) instanceof Number n) {
                timeoutSeconds = Math.max(1, Math.min(settings.getMaxTimeoutSeconds(), n.intValue()));
            }
            return fetch(parsed, timeoutSeconds);
        });
    }

    private ToolResult fetch(HttpUrl url, int timeoutSeconds) {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html,application/json,text/plain;q=0.9,*/*;q=0.8")
                .get()
                .build();

        log.debug("[Tools] web_fetch: {} (timeout {}s)", url, timeoutSeconds);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return ToolResult.failure("HTTP " + response.code() + " for " + url);
            }
            ResponseBody body = response.body();
            MediaType mediaType = body != null ? body.contentType() : null;
            String contentType = mediaType != null ? mediaType.type() + "/" + mediaType.subtype() : "unknown";
            String raw = response.peekBody(settings.getMaxBytes()).string();
            boolean cut = body != null && body.contentLength() > settings.getMaxBytes();

            String title = null;
            String content = raw;
            if (isHtml(contentType, raw)) {
                Document document = Jsoup.parse(raw, url.toString());
                title = document.title();
                content = extractText(document);
            }

            StringBuilder sb = new StringBuilder();
            sb.append("URL: ").append(url).append('\n');
            sb.append("Content-Type: ").append(contentType).append('\n');
            if (title != null && !title.isBlank()) {
                sb.append("Title: ").append(title).append('\n');
            }
            if (cut) {
                sb.append("(response cut at ").append(settings.getMaxBytes()).append(" bytes)\n");
            }
            sb.append('\n').append(content);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put(PARAM_URL, url.toString());
            data.put("status", response.code());
            data.put("content_type", contentType);
            return ToolResult.success(sb.toString(), data);
        } catch (IOException e) {
            log.warn("[Tools] web_fetch failed for {}: {}", url, e.getMessage());
            return ToolResult.failure("Failed to fetch URL: " + e.getMessage());
        }
    }

    private static boolean isHtml(String contentType, String body) {
        if (contentType.contains("html")) {
            return true;
        }
        if (!"unknown".equals(contentType)) {
            return false;
        }
        String head = body.stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    /**
     * Main-content text of an HTML page, one block per line. Headings are
     * prefixed with {@code #} and list items with {@code -}.
     */
    static String extractText(Document document) {
        document.select(NOISE).remove();
        Element root = document.selectFirst("article, main, [role=main]");
        if (root == null) {
            root = document.body();
        }

        List<String> lines = new ArrayList<>();
        for (Element element : root.select(BLOCKS)) {
            if (hasBlockAncestor(element, root)) {
                continue;
            }
            String text = "pre".equals(element.tagName()) ? element.wholeText().strip() : element.text();
            if (text.isBlank()) {
                continue;
            }
            lines.add(switch (element.tagName()) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> "# " + text;
            case "li" -> "- " + text;
            default -> text;
            });
        }
        return lines.isEmpty() ? root.text() : String.join("\n", lines);
    }

    private static boolean hasBlockAncestor(Element element, Element root) {
        for (Element parent = element.parent(); parent != null && parent != root; parent = parent.parent()) {
            if (parent.is(BLOCKS)) {
                return true;
            }
        }
        return false;
    }
}
