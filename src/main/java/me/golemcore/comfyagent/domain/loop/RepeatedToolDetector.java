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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Notices the model calling the same tool over and over within a turn and
 * produces a warning for the next system prompt.
 */
@Slf4j
public class RepeatedToolDetector {

    private final int threshold;
    private final List<String> recent = new ArrayList<>();

    public RepeatedToolDetector(int threshold) {
        this.threshold = threshold;
    }

    public void record(String toolName) {
        recent.add(toolName);
    }

    public Optional<String> warning() {
        if (threshold <= 1 || recent.size() < threshold) {
            return Optional.empty();
        }
        List<String> tail = recent.subList(recent.size() - threshold, recent.size());
        String toolName = tail.get(0);
        if (tail.stream().allMatch(toolName::equals)) {
            log.warn("[AgentLoop] Loop detected: {} called {} times in a row", toolName, threshold);
            return Optional.of("LOOP DETECTED: You have called '" + toolName + "' " + threshold
                    + " times in a row. STOP repeating this tool call. Either try a completely different approach,"
                    + " or explain the problem to the user and ask for guidance.");
        }
        return Optional.empty();
    }
}
