package me.golemcore.comfyagent.domain.service;

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
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * System prompts bundled as classpath resources under {@code prompts/}.
 */
@Component
@Slf4j
public class PromptProvider {

    static final String SYSTEM_PROMPT = "prompts/system.md";
    static final String SUBAGENT_PROMPT = "prompts/subagent.md";

    private final String systemPrompt;
    private final String subagentPrompt;

    public PromptProvider() {
        this.systemPrompt = load(SYSTEM_PROMPT);
        this.subagentPrompt = load(SUBAGENT_PROMPT);
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public String getSubagentPrompt() {
        return subagentPrompt;
    }

    private static String load(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            String prompt = StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
            log.debug("[Prompts] Loaded {} ({} chars)", location, prompt.length());
            return prompt;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load prompt " + location, e);
        }
    }
}
