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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.port.outbound.ModelPort;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turn window whose older part is summarized by the model instead of condensed
 * locally.
 *
 * <p>
 * Summaries are cached per session and reused while the summarized prefix does
 * not change, so consecutive iterations of one turn cost a single extra call.
 * The cache keeps the most recently used sessions only and drops a session as
 * soon as it is deleted. Any model failure falls back to the local digest.
 */
@Slf4j
public class ModelSummaryCompressor extends TurnWindowCompressor {

    static final String SUMMARIZE_PROMPT = """
            You are a conversation summarizer. Summarize the following conversation \
            between a user and a ComfyUI assistant. Focus on:

            1. What the user wanted to accomplish
            2. Key decisions made (node types chosen, model names, parameters)
            3. Workflows that were built or submitted (include prompt_ids)
            4. Any errors encountered and how they were resolved
            5. Current state of the conversation

            Be concise but preserve all technical details that would be needed to \
            continue the conversation. Output a single summary paragraph.
            """;

    static final int MAX_CACHED_SESSIONS = 256;

    private final ModelPort modelPort;
    private final Map<String, CachedSummary> cache;

    private record CachedSummary(String lastMessageId, String summary) {
    }

    public ModelSummaryCompressor(ModelPort modelPort, int thresholdTokens, int keepRecentTurns,
            int summaryMaxChars) {
        this(modelPort, thresholdTokens, keepRecentTurns, summaryMaxChars, MAX_CACHED_SESSIONS);
    }

    ModelSummaryCompressor(ModelPort modelPort, int thresholdTokens, int keepRecentTurns, int summaryMaxChars,
            int maxCachedSessions) {
        super(thresholdTokens, keepRecentTurns, summaryMaxChars);
        this.modelPort = modelPort;
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedSummary> eldest) {
                return size() > maxCachedSessions;
            }
        });
    }

    @Override
    public void forget(String sessionId) {
        cache.remove(sessionId);
    }

    @Override
    protected String summarize(String sessionId, List<Message> older, String digest) {
        String lastId = older.get(older.size() - 1).getId();
        CachedSummary cached = cache.get(sessionId);
        if (cached != null && cached.lastMessageId() != null && cached.lastMessageId().equals(lastId)) {
            return cached.summary();
        }
        try {
            ModelResponse response = modelPort.chat(ModelRequest.builder()
                    .systemPrompt(SUMMARIZE_PROMPT)
                    .messages(List.of(Message.userText(digest, older.get(older.size() - 1).getTimestamp())))
                    .tools(List.of())
                    .build()).get();
            String summary = response.getText();
            if (summary == null || summary.isBlank()) {
                return digest;
            }
            cache.put(sessionId, new CachedSummary(lastId, summary.trim()));
            log.info("[Context] Summarized {} messages for session {}", older.size(), sessionId);
            return summary.trim();
        } catch (ExecutionException | CompletionException e) {
            log.warn("[Context] Summary failed for session {}, using local digest: {}", sessionId,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return digest;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return digest;
        }
    }
}
