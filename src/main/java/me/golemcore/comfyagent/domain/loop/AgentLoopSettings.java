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

import lombok.Builder;
import me.golemcore.comfyagent.domain.tools.ToolRegistry;

/**
 * Per-loop configuration. The top-level loop and sub-agent loops differ only in
 * these values.
 */
@Builder
public record AgentLoopSettings(String name, String systemPrompt, ToolRegistry tools, int maxIterations,
        int repeatedToolThreshold, Integer maxTokens, int eventPreviewChars) {
}
