package me.golemcore.comfyagent.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.exception.ModelCallException;
import me.golemcore.comfyagent.domain.model.ContentBlock;
import me.golemcore.comfyagent.domain.model.ContentBlockType;
import me.golemcore.comfyagent.domain.model.Message;
import me.golemcore.comfyagent.domain.model.ModelRequest;
import me.golemcore.comfyagent.domain.model.ModelResponse;
import me.golemcore.comfyagent.domain.model.ModelUsage;
import me.golemcore.comfyagent.domain.model.ToolCall;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Model provider adapter using the langchain4j library.
 *
 * <p>
 * Talks to Anthropic when {@code agent.llm.provider=anthropic} and to any
 * OpenAI-compatible endpoint otherwise. Each call is a single attempt: the
 * provider clients are built with retries disabled and every failure is
 * classified into a {@link ModelCallException} so that
 * {@link me.golemcore.comfyagent.domain.service.ModelClient} can decide whether
 * to back off and try again.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements ModelPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AgentProperties.LlmProperties llm;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private StreamingChatModel streamingChatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(AgentProperties properties, ObjectMapper objectMapper) {
        this.llm = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(llm.getProvider())) {
            chatModel = createAnthropicModel();
            streamingChatModel = createAnthropicStreamingModel();
        } else {
            chatModel = createOpenAiModel();
            streamingChatModel = createOpenAiStreamingModel();
        }
        initialized = true;
        log.info("[LLM] Langchain4j adapter initialized: provider={}, model={}", llm.getProvider(), llm.getModel());
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0) // Retry handled by ModelClient
                .maxTokens(llm.getMaxTokens())
                .timeout(Duration.ofMillis(llm.getRequestTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private StreamingChatModel createAnthropicStreamingModel() {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxTokens(llm.getMaxTokens())
                .timeout(Duration.ofMillis(llm.getRequestTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel() {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0) // Retry handled by ModelClient
                .maxTokens(llm.getMaxTokens())
                .timeout(Duration.ofMillis(llm.getRequestTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiStreamingModel() {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxTokens(llm.getMaxTokens())
                .timeout(Duration.ofMillis(llm.getRequestTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    @Override
    public CompletableFuture<ModelResponse> chat(ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureAvailable();
            try {
                ChatResponse response = chatModel.chat(toChatRequest(request));
                return convertResponse(response);
            } catch (RuntimeException e) { // NOSONAR - classified for the retry policy
                throw Langchain4jErrorClassifier.classify(e);
            }
        });
    }

    @Override
    public CompletableFuture<ModelResponse> chatStream(ModelRequest request, Consumer<String> onDelta) {
        CompletableFuture<ModelResponse> future = new CompletableFuture<>();
        try {
            ensureAvailable();
            streamingChatModel.chat(toChatRequest(request), new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (partialResponse != null && !partialResponse.isEmpty()) {
                        onDelta.accept(partialResponse);
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    future.complete(convertResponse(completeResponse));
                }

                @Override
                public void onError(Throwable error) {
                    future.completeExceptionally(Langchain4jErrorClassifier.classify(error));
                }
            });
        } catch (RuntimeException e) { // NOSONAR - classified for the retry policy
            future.completeExceptionally(Langchain4jErrorClassifier.classify(e));
        }
        return future;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getModelName() {
        return llm.getModel();
    }

    @Override
    public boolean isAvailable() {
        return llm.getApiKey() != null && !llm.getApiKey().isBlank();
    }

    private void ensureAvailable() {
        if (!isAvailable()) {
            throw new ModelCallException(ModelCallException.Kind.FATAL,
                    "LLM provider '" + llm.getProvider() + "' is not configured: set agent.llm.api-key");
        }
        if (!initialized) {
            initialize();
        }
    }

    ChatRequest toChatRequest(ModelRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request));
        List<ToolSpecification> tools = convertTools(request.getTools());
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(ModelRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case USER -> {
                String text = msg.getTextContent();
                if (!text.isBlank()) {
                    messages.add(UserMessage.from(text));
                }
            }
            case ASSISTANT -> {
                String text = msg.getTextContent();
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getBlocksOfType(ContentBlockType.TOOL_CALL)
                            .stream()
                            .map(block -> ToolExecutionRequest.builder()
                                    .id(block.getToolCallId())
                                    .name(block.getToolName())
                                    .arguments(convertArgsToJson(block.getArguments()))
                                    .build())
                            .toList();
                    messages.add(text.isBlank() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests));
                } else if (!text.isBlank()) {
                    messages.add(AiMessage.from(text));
                }
            }
            case TOOL_RESULT -> {
                for (ContentBlock block : msg.getBlocksOfType(ContentBlockType.TOOL_RESULT)) {
                    String result = block.getResult() != null && !block.getResult().isEmpty() ? block.getResult()
                            : "(empty)";
                    messages.add(ToolExecutionResultMessage.from(block.getToolCallId(), block.getToolName(),
                            block.hasError() ? "Error: " + result : result));
                }
            }
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            if (properties != null) {
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private ModelResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<ToolCall> toolCalls = List.of();
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(request -> ToolCall.builder()
                            .id(request.id())
                            .name(request.name())
                            .arguments(parseJsonArgs(request.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        ModelUsage usage = ModelUsage.empty();
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = new ModelUsage(
                    tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0,
                    tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0);
        }

        return ModelResponse.builder()
                .text(aiMessage.text())
                .toolCalls(new ArrayList<>(toolCalls))
                .usage(usage)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
