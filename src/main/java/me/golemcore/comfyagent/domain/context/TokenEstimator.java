package me.golemcore.comfyagent.domain.context;

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

import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.Message;

import java.util.List;

/**
 * Local token estimate of roughly four characters per token. Good enough to
 * decide when to compress, no provider call involved.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;
    private static final int MESSAGE_OVERHEAD = 4;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }

    public static int estimate(Message message) {
        int total = MESSAGE_OVERHEAD;
        if (message.getBlocks() == null) {
            return total;
        }
        for (ContentBlock block : message.getBlocks()) {
            total += estimate(block.getText());
            total += estimate(block.getResult());
            total += estimate(block.getTask());
            if (block.getArguments() != null) {
                total += estimate(block.getArguments().toString());
            }
        }
        return total;
    }

    public static int estimate(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }
}
