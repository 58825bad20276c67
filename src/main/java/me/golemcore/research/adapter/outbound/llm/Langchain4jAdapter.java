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

package me.golemcore.research.adapter.outbound.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
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
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.LlmUsage;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolExecutionOutcome;
import me.golemcore.research.domain.model.ToolRequest;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supported providers ({@code research.llm.provider}):
 * <ul>
 * <li>{@code openai} - OpenAI or any OpenAI-compatible endpoint (LM Studio,
 * vLLM, Ollama); local endpoints without a key get a placeholder
 * credential</li>
 * <li>{@code azure} - Azure OpenAI v1 endpoint, addressed by deployment
 * name</li>
 * <li>{@code anthropic} - Claude models</li>
 * </ul>
 *
 * <p>
 * Rate-limited calls are retried with exponential backoff. Conversation
 * messages map onto langchain4j messages: tool invocations become AI messages
 * with tool execution requests, tool outcomes become one result message per
 * request id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    static final String PLACEHOLDER_API_KEY = "not-needed";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_AZURE = "azure";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ResearchProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService researchExecutor;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        ResearchProperties.LlmProperties llm = properties.getLlm();
        String provider = llm.getProvider().toLowerCase(Locale.ROOT);
        this.currentModel = PROVIDER_AZURE.equals(provider) ? llm.getAzure().getDeployment() : llm.getModel();
        this.chatModel = createModel(provider, llm);
        initialized = true;
        log.info("[LLM] Langchain4j adapter initialized: provider={}, model={}", provider, currentModel);
    }

    private ChatModel createModel(String provider, ResearchProperties.LlmProperties llm) {
        Duration timeout = Duration.ofSeconds(llm.getRequestTimeoutSeconds());
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(llm.getModel())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(llm.getMaxTokens() != null ? llm.getMaxTokens() : 4096)
                    .timeout(timeout);
            if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank() && !isLocal(llm.getBaseUrl())) {
                builder.baseUrl(llm.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(timeout);
        if (PROVIDER_AZURE.equals(provider)) {
            builder.baseUrl(azureBaseUrl(llm.getAzure().getEndpoint()))
                    .apiKey(llm.getApiKey())
                    .customHeaders(Map.of("api-key", llm.getApiKey()))
                    .modelName(llm.getAzure().getDeployment());
        } else {
            boolean hasKey = llm.getApiKey() != null && !llm.getApiKey().isBlank();
            builder.apiKey(hasKey ? llm.getApiKey() : PLACEHOLDER_API_KEY)
                    .modelName(llm.getModel());
            if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
                builder.baseUrl(llm.getBaseUrl());
            }
        }
        return builder.build();
    }

    static String azureBaseUrl(String endpoint) {
        String trimmed = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return trimmed.endsWith("/openai/v1") ? trimmed : trimmed + "/openai/v1";
    }

    private static boolean isLocal(String baseUrl) {
        return baseUrl.contains("localhost") || baseUrl.contains("127.0.0.1");
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request.getTools());

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                chatRequest.toolSpecifications(tools);
            }
            if (request.getTemperature() != null) {
                chatRequest.temperature(request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                chatRequest.maxOutputTokens(request.getMaxTokens());
            }
            ChatRequest built = chatRequest.build();

            int maxRetries = properties.getLlm().getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    log.trace("[LLM] Calling model with {} messages and {} tools", messages.size(), tools.size());
                    return convertResponse(chatModel.chat(built));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (properties.getLlm().getRetryInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1, maxRetries,
                                backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        }, researchExecutor);
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String getCurrentModel() {
        ensureInitialized();
        return currentModel;
    }

    @Override
    public boolean isAvailable() {
        ResearchProperties.LlmProperties llm = properties.getLlm();
        boolean hasKey = llm.getApiKey() != null && !llm.getApiKey().isBlank();
        return hasKey || llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getType()) {
            case USER_TEXT -> messages.add(UserMessage.from(msg.getContent()));
            case ASSISTANT_TEXT -> messages.add(AiMessage.from(msg.getContent()));
            case TOOL_INVOCATION -> {
                List<ToolExecutionRequest> toolRequests = msg.getToolRequests().stream()
                        .map(tr -> ToolExecutionRequest.builder()
                                .id(tr.id())
                                .name(tr.toolName())
                                .arguments(convertArgsToJson(tr.arguments()))
                                .build())
                        .toList();
                messages.add(msg.hasText()
                        ? AiMessage.from(msg.getContent(), toolRequests)
                        : AiMessage.from(toolRequests));
            }
            case TOOL_OUTCOME -> {
                for (ToolExecutionOutcome outcome : msg.getToolOutcomes()) {
                    String content = outcome.messageContent();
                    messages.add(ToolExecutionResultMessage.from(outcome.requestId(), outcome.toolName(),
                            content == null || content.isBlank() ? "(no output)" : content));
                }
            }
            default -> log.warn("[LLM] Unknown message type: {}", msg.getType());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return Collections.emptyList();
        }
        return definitions.stream().map(this::convertToolDefinition).toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> toolProperties = tool.getProperties();
        if (!toolProperties.isEmpty()) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<String, Object> entry : toolProperties.entrySet()) {
                schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (!tool.getRequired().isEmpty()) {
                schemaBuilder.required(tool.getRequired());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get(SCHEMA_KEY_DESCRIPTION);
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
                    builder.addProperty((String) entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<ToolRequest> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> new ToolRequest(ter.id(), ter.name(), parseJsonArgs(ter.arguments())))
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(response.tokenUsage().inputTokenCount())
                    .outputTokens(response.tokenUsage().outputTokenCount())
                    .totalTokens(response.tokenUsage().totalTokenCount())
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) { // NOSONAR
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
        } catch (Exception e) { // NOSONAR
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
