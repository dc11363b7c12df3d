package me.golemcore.comfyagent.tools;

import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.testsupport.http.CannedHttpInterceptor;
import okhttp3.Request;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebFetchToolTest {

    private static final String URL = "url";
    private static final String PAGE_URL = "https://example.com/guide";
    private static final String HTML = "text/html; charset=utf-8";

    private CannedHttpInterceptor http;
    private AgentProperties properties;
    private WebFetchTool tool;

    @BeforeEach
    void setUp() {
        http = new CannedHttpInterceptor();
        properties = new AgentProperties();
        tool = new WebFetchTool(CannedHttpInterceptor.clientWith(http), properties);
    }

    private ToolResult fetch(Map<String, Object> parameters) {
        return tool.execute(parameters).join();
    }

    // ==================== Content ====================

    @Test
    void shouldExtractMainContentFromHtml() {
        http.reply(200, """
                <html><head><title>Flux guide</title><script>var x = 1;</script></head>
                <body>
                  <nav><a href="/">Home</a></nav>
                  <main>
                    <h1>Flux in ComfyUI</h1>
                    <p>Load the <b>flux1-dev</b> checkpoint.</p>
                    <ul><li>Use 20 steps</li><li>CFG 1.0</li></ul>
                  </main>
                  <footer>Copyright</footer>
                </body></html>
                """, HTML);

        ToolResult result = fetch(Map.of(URL, PAGE_URL));

        assertTrue(result.isSuccess());
        assertEquals("URL: " + PAGE_URL + "\nContent-Type: text/html\nTitle: Flux guide\n\n"
                + "# Flux in ComfyUI\nLoad the flux1-dev checkpoint.\n- Use 20 steps\n- CFG 1.0",
                result.getOutput());
        assertEquals(200, result.getData().get("status"));
        assertEquals("text/html", result.getData().get("content_type"));
    }

    @Test
    void shouldReturnJsonUnchanged() {
        String json = "{\"3\": {\"class_type\": \"KSampler\", \"inputs\": {}}}";
        http.reply(200, json, "application/json");

        ToolResult result = fetch(Map.of(URL, "https://raw.githubusercontent.com/a/b/main/flux.json"));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().endsWith("\n\n" + json));
        assertFalse(result.getOutput().contains("Title:"));
    }

    @Test
    void shouldCutBodyAtConfiguredSize() {
        properties.getTools().getWebFetch().setMaxBytes(10);
        http.reply(200, "0123456789abcdefghij", "text/plain");

        ToolResult result = fetch(Map.of(URL, PAGE_URL));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("(response cut at 10 bytes)"));
        assertTrue(result.getOutput().endsWith("\n\n0123456789"));
    }

    @Test
    void shouldFallBackToPlainTextWhenPageHasNoBlocks() {
        String text = WebFetchTool.extractText(Jsoup.parse("<body><div>just <span>inline</span> text</div></body>"));

        assertEquals("just inline text", text);
    }

    @Test
    void shouldNotRepeatNestedBlocks() {
        String text = WebFetchTool.extractText(Jsoup.parse(
                "<article><blockquote><p>quoted</p></blockquote><p>after</p></article>"));

        assertEquals("quoted\nafter", text);
    }

    // ==================== Request ====================

    @Test
    void shouldSendGetWithUserAgent() {
        http.reply(200, "ok", "text/plain");

        fetch(Map.of(URL, PAGE_URL));

        List<Request> requests = http.requests();
        assertEquals(1, requests.size());
        assertEquals("GET", requests.get(0).method());
        assertEquals(PAGE_URL, requests.get(0).url().toString());
        assertTrue(requests.get(0).header("User-Agent").startsWith("comfy-agent/"));
    }

    // ==================== Failures ====================

    @Test
    void shouldReportHttpErrorStatus() {
        http.reply(404, "not found", "text/plain");

        ToolResult result = fetch(Map.of(URL, PAGE_URL));

        assertFalse(result.isSuccess());
        assertEquals("HTTP 404 for " + PAGE_URL, result.getError());
    }

    @Test
    void shouldReportTransportFailure() {
        http.fail(new SocketTimeoutException("timeout"));

        ToolResult result = fetch(Map.of(URL, PAGE_URL));

        assertFalse(result.isSuccess());
        assertEquals("Failed to fetch URL: timeout", result.getError());
    }

    @Test
    void shouldRejectNonHttpUrl() {
        ToolResult result = fetch(Map.of(URL, "file:///etc/passwd"));

        assertFalse(result.isSuccess());
        assertEquals("URL must start with http:// or https://", result.getError());
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void shouldRequireUrl() {
        ToolResult result = fetch(Map.of());

        assertFalse(result.isSuccess());
        assertEquals("url is required", result.getError());
    }

    // ==================== Configuration ====================

    @Test
    void shouldFollowEnabledFlag() {
        assertTrue(tool.isEnabled());

        properties.getTools().getWebFetch().setEnabled(false);

        assertFalse(tool.isEnabled());
    }

    @Test
    void shouldAllowLongerToolTimeoutThanCallTimeout() {
        assertEquals(125, tool.getTimeout().toSeconds());
    }

    @Test
    void shouldNameTool() {
        assertEquals("web_fetch", tool.getDefinition().getName());
    }
}
