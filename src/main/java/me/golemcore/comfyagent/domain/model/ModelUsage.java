package me.golemcore.comfyagent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token counts reported by the model provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelUsage {

    private long inputTokens;
    private long outputTokens;

    public static ModelUsage empty() {
        return new ModelUsage(0, 0);
    }

    public ModelUsage plus(ModelUsage other) {
        if (other == null) {
            return new ModelUsage(inputTokens, outputTokens);
        }
        return new ModelUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input_tokens", inputTokens);
        payload.put("output_tokens", outputTokens);
        return payload;
    }
}
