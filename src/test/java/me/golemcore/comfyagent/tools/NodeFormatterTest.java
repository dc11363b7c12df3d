package me.golemcore.comfyagent.tools;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeFormatterTest {

    @Test
    void shouldFormatNumericConstraints() {
        Object spec = List.of("INT", Map.of("default", 20, "min", 1, "max", 10000));

        assertEquals("INT default=20 min=1 max=10000", NodeFormatter.formatParam(spec));
    }

    @Test
    void shouldAbbreviateLongEnums() {
        Object spec = List.of(List.of("euler", "euler_a", "heun", "dpm_2", "lms", "ddim"));

        assertEquals("enum[euler, euler_a, heun, ... (6 options)]", NodeFormatter.formatParam(spec));
        assertEquals("enum[a, b]", NodeFormatter.formatParam(List.of(List.of("a", "b"))));
    }

    @Test
    void shouldSummarizeTypedConnectionsOnly() {
        Map<String, Object> required = new LinkedHashMap<>();
        required.put("model", List.of("MODEL"));
        required.put("seed", List.of("INT", Map.of("default", 0)));
        required.put("sampler_name", List.of(List.of("euler")));
        required.put("latent_image", List.of("LATENT"));
        Map<String, Object> info = Map.of("input", Map.of("required", required), "output", List.of("LATENT"));

        assertEquals("IN: model(MODEL), seed(INT), latent_image(LATENT) -> OUT: LATENT",
                NodeFormatter.ioSummary(info));
    }

    @Test
    void shouldSummarizeNodeWithoutInputs() {
        assertEquals("OUT: none", NodeFormatter.ioSummary(Map.of()));
    }

    @Test
    void shouldNameUnnamedOutputsByIndex() {
        String detail = NodeFormatter.detail("VAEDecode", Map.of("output", List.of("IMAGE")));

        assertTrue(detail.contains("    [0] output_0: IMAGE"));
        assertTrue(detail.contains("  Category: unknown"));
    }
}
