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
import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.ContentBlockType;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.MessageRole;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the most recent turns verbatim and folds everything older into a
 * condensed text summary.
 *
 * <p>
 * Cuts only happen at turn boundaries, which keeps every tool call next to its
 * result. The window shrinks one turn at a time until the estimate fits. If a
 * single turn is still too large, large tool results outside the newest message
 * are shortened.
 */
@Slf4j
public class TurnWindowCompressor implements ContextCompressor {

    public static final String SUMMARY_PREFIX = "[Previous conversation summary]\n";

    private static final int OLD_RESULT_LIMIT = 500;
    private static final int OLD_RESULT_KEEP = 200;
    private static final int LINE_LIMIT = 300;

    private final int maxTokens;
    private final int keepRecentTurns;
    private final int summaryMaxChars;

    public TurnWindowCompressor(int maxTokens, int keepRecentTurns, int summaryMaxChars) {
        this.maxTokens = maxTokens;
        this.keepRecentTurns = Math.max(1, keepRecentTurns);
        this.summaryMaxChars = summaryMaxChars;
    }

    @Override
    public List<Message> compress(String sessionId, List<Message> history) {
        int tokens = TokenEstimator.estimate(history);
        if (tokens <= maxTokens) {
            return history;
        }
        log.info("[Context] Session {}: {} tokens over budget {}, compressing", sessionId, tokens, maxTokens);

        List<Integer> turnStarts = turnStarts(history);
        int cut = -1;
        String digest = null;
        boolean fits = false;
        for (int keep = Math.min(keepRecentTurns, turnStarts.size()); keep >= 1 && !fits; keep--) {
            int start = turnStarts.get(turnStarts.size() - keep);
            if (start == 0) {
                continue;
            }
            cut = start;
            digest = condense(sessionId, history.subList(0, cut));
            fits = TokenEstimator.estimate(withSummary(history.subList(cut, history.size()), digest)) <= maxTokens;
            if (fits) {
                log.info("[Context] Kept last {} turns, {} messages summarized", keep, cut);
            }
        }
        if (cut < 0) {
            return shortenToolResults(history);
        }

        // the window is sized with the local digest, summarize() runs once for the chosen cut
        List<Message> recent = history.subList(cut, history.size());
        List<Message> candidate = withSummary(recent, summarize(sessionId, history.subList(0, cut), digest));
        if (fits && TokenEstimator.estimate(candidate) > maxTokens) {
            candidate = withSummary(recent, digest);
        }
        if (fits) {
            return candidate;
        }

        List<Message> trimmed = shortenToolResults(candidate);
        log.warn("[Context] Session {}: still {} tokens after windowing", sessionId,
                TokenEstimator.estimate(trimmed));
        return trimmed;
    }

    /**
     * Indices of messages that open a turn.
     */
    static List<Integer> turnStarts(List<Message> history) {
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            if (history.get(i).isTurnStart()) {
                starts.add(i);
            }
        }
        return starts;
    }

    /**
     * Prepends the summary to the first kept message so roles keep alternating.
     */
    private static List<Message> withSummary(List<Message> recent, String summary) {
        List<Message> result = new ArrayList<>(recent.size());
        Message first = recent.get(0);
        List<ContentBlock> blocks = new ArrayList<>();
        blocks.add(ContentBlock.text(SUMMARY_PREFIX + summary));
        blocks.addAll(first.getBlocks());
        result.add(Message.builder()
                .id(first.getId())
                .role(first.getRole())
                .blocks(blocks)
                .timestamp(first.getTimestamp())
                .metadata(first.getMetadata())
                .build());
        result.addAll(recent.subList(1, recent.size()));
        return result;
    }

    /**
     * Summary placed in front of the kept window. Called at most once per
     * {@link #compress} pass; returns the local digest by default.
     */
    protected String summarize(String sessionId, List<Message> older, String digest) {
        return digest;
    }

    /**
     * Plain-text digest of older messages, capped at the configured size.
     */
    protected String condense(String sessionId, List<Message> older) {
        StringBuilder sb = new StringBuilder();
        for (Message message : older) {
            String line = describe(message);
            if (line.isEmpty()) {
                continue;
            }
            sb.append(line).append('\n');
        }
        String digest = sb.toString().trim();
        if (digest.length() > summaryMaxChars) {
            digest = "..." + digest.substring(digest.length() - summaryMaxChars);
        }
        return digest;
    }

    private String describe(Message message) {
        if (message.getRole() == MessageRole.TOOL_RESULT) {
            return message.getBlocks().stream()
                    .filter(block -> block.isType(ContentBlockType.TOOL_RESULT))
                    .map(block -> "tool " + block.getToolName() + (block.hasError() ? " failed: " : " returned: ")
                            + clip(block.getResult()))
                    .collect(Collectors.joining("\n"));
        }
        String text = clip(message.getTextContent());
        List<String> tools = message.getBlocksOfType(ContentBlockType.TOOL_CALL).stream()
                .map(ContentBlock::getToolName)
                .toList();
        String prefix = message.getRole() == MessageRole.USER ? "user: " : "assistant: ";
        if (tools.isEmpty()) {
            return text.isEmpty() ? "" : prefix + text;
        }
        return prefix + text + (text.isEmpty() ? "" : " ") + "[called " + String.join(", ", tools) + "]";
    }

    private static String clip(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ').trim();
        return flat.length() > LINE_LIMIT ? flat.substring(0, LINE_LIMIT) + "..." : flat;
    }

    private static List<Message> shortenToolResults(List<Message> messages) {
        List<Message> result = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (i == messages.size() - 1 || message.getRole() != MessageRole.TOOL_RESULT) {
                result.add(message);
                continue;
            }
            List<ContentBlock> blocks = new ArrayList<>();
            for (ContentBlock block : message.getBlocks()) {
                String content = block.getResult();
                if (block.isType(ContentBlockType.TOOL_RESULT) && content != null
                        && content.length() > OLD_RESULT_LIMIT) {
                    blocks.add(ContentBlock.toolResult(block.getToolCallId(), block.getToolName(),
                            content.substring(0, OLD_RESULT_KEEP) + "\n\n... [truncated, was " + content.length()
                                    + " chars]",
                            block.hasError()));
                } else {
                    blocks.add(block);
                }
            }
            result.add(Message.builder()
                    .id(message.getId())
                    .role(message.getRole())
                    .blocks(blocks)
                    .timestamp(message.getTimestamp())
                    .metadata(message.getMetadata())
                    .build());
        }
        return result;
    }
}
