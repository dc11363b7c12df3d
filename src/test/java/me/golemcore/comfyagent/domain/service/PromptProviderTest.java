package me.golemcore.comfyagent.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptProviderTest {

    @Test
    void shouldLoadBundledPrompts() {
        PromptProvider provider = new PromptProvider();

        assertTrue(provider.getSystemPrompt().startsWith("You are a ComfyUI assistant."));
        assertTrue(provider.getSubagentPrompt().startsWith("You are a ComfyUI research assistant."));
        assertNotEquals(provider.getSystemPrompt(), provider.getSubagentPrompt());
    }
}
