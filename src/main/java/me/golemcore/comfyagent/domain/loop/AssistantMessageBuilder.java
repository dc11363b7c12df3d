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

/**
 * Accumulates streamed text of one model attempt. Owned by a single iteration
 * and cleared when the attempt is retried.
 */
public class AssistantMessageBuilder {

    private final StringBuilder text = new StringBuilder();

    public void append(String delta) {
        if (delta != null) {
            text.append(delta);
        }
    }

    public void reset() {
        text.setLength(0);
    }

    public boolean isEmpty() {
        return text.length() == 0;
    }

    public String getText() {
        return text.toString();
    }
}
