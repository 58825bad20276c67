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

package me.golemcore.research.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.domain.service.ResearchPrompts;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Query-rewrite step of the math path ({@code rewrite_for_wolfram}): a single
 * model call that turns a natural-language question into Wolfram Alpha syntax
 * (equation solve, definite integral, derivative, limit).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WolframQueryRewriteTool implements ToolComponent {

    static final String NAME = "rewrite_for_wolfram";
    private static final String PARAM_QUESTION = "natural_language_question";

    private final LlmPort llmPort;
    private final ResearchProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getWolfram().isEnabled();
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(properties.getLlm().getRequestTimeoutSeconds());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Convert a natural language math question into proper Wolfram Alpha syntax. "
                        + "Always use this BEFORE calling wolfram_query.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUESTION, Map.of(
                                        "type", "string",
                                        "description", "The math question as the user asked it")),
                        "required", List.of(PARAM_QUESTION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolInvocationContext context) {
        context.metrics().recordModelCall();
        return execute(parameters);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String question = ((String) parameters.get(PARAM_QUESTION)).trim();
        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .messages(List.of(Message.userText(ResearchPrompts.WOLFRAM_REWRITE_TEMPLATE.formatted(question))))
                .temperature(0.0)
                .build();

        return llmPort.chat(request)
                .thenApply(response -> toResult(question, response))
                .exceptionally(error -> {
                    log.warn("[Wolfram] Rewrite failed for '{}': {}", question, error.getMessage());
                    return ToolResult.failure(ToolFailureKind.PROVIDER_ERROR, "Query rewrite failed: "
                            + error.getMessage());
                });
    }

    private ToolResult toResult(String question, LlmResponse response) {
        String rewritten = clean(response != null ? response.getContent() : null);
        if (rewritten.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.PROVIDER_ERROR, "Query rewrite returned no text");
        }
        log.info("[Wolfram] Rewrote '{}' -> '{}'", question, rewritten);
        return ToolResult.success(rewritten, Map.of("question", question, "formatted_query", rewritten));
    }

    /**
     * Takes the first non-blank line and strips wrapping quotes and backticks.
     */
    static String clean(String content) {
        if (content == null) {
            return "";
        }
        String line = content.strip().lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty() && !l.startsWith("```"))
                .findFirst()
                .orElse("");
        return line.replaceAll("^[`\"']+|[`\"']+$", "").strip();
    }
}
