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

package me.golemcore.research.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.TextTruncator;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolExecutionOutcome;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.ToolRequest;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps tool names to adapters and dispatches model tool-call batches.
 *
 * <p>
 * Every request of a batch gets exactly one outcome: unknown names, schema
 * violations, timeouts and cancellations all become failure outcomes instead of
 * aborting the batch. Calls of one batch run concurrently; the batch completes
 * once every call has completed or timed out, and outcomes are re-associated to
 * requests by id.
 *
 * <p>
 * Does NOT mutate conversation history.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final ResearchProperties properties;

    public ToolRegistry(List<ToolComponent> toolComponents, ResearchProperties properties) {
        this.properties = properties;
        if (toolComponents != null) {
            toolComponents.forEach(this::registerTool);
        }
        log.info("[Tools] Registered tools: {}", new TreeSet<>(tools.keySet()));
    }

    public void registerTool(ToolComponent tool) {
        tools.put(tool.getToolName(), tool);
    }

    /**
     * Definitions of the named tools that are registered and enabled, in the
     * given order.
     */
    public List<ToolDefinition> getDefinitions(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : names) {
            ToolComponent tool = tools.get(name);
            if (tool != null && tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    /**
     * Executes one model turn's batch and blocks until every request has an
     * outcome.
     *
     * @param requests
     *            tool requests with unique ids
     * @param allowedTools
     *            tools offered to the conversation issuing the batch
     * @param context
     *            run context (cancellation, metrics)
     * @return one outcome per request, in request order
     */
    public List<ToolExecutionOutcome> dispatchBatch(List<ToolRequest> requests, Set<String> allowedTools,
            ToolInvocationContext context) {
        Map<String, CompletableFuture<ToolExecutionOutcome>> pending = new LinkedHashMap<>();
        for (ToolRequest request : requests) {
            pending.put(request.id(), dispatch(request, allowedTools, context));
        }
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

        List<ToolExecutionOutcome> outcomes = new ArrayList<>(requests.size());
        for (ToolRequest request : requests) {
            outcomes.add(pending.get(request.id()).join());
        }
        return outcomes;
    }

    /**
     * Executes one request. The returned future never completes exceptionally.
     */
    public CompletableFuture<ToolExecutionOutcome> dispatch(ToolRequest request, Set<String> allowedTools,
            ToolInvocationContext context) {
        if (context.cancellation().isCancelled()) {
            return CompletableFuture.completedFuture(
                    ToolExecutionOutcome.synthetic(request, ToolFailureKind.CANCELLED, "Research run was cancelled"));
        }

        String toolName = sanitizeToolName(request.toolName());
        ToolComponent tool = toolName == null ? null : tools.get(toolName);
        if (tool == null || !allowedTools.contains(toolName)) {
            String available = String.join(", ", new TreeSet<>(allowedTools));
            log.warn("[Tools] Unknown tool requested: {}", request.toolName());
            return CompletableFuture.completedFuture(ToolExecutionOutcome.synthetic(request,
                    ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName + ". Available tools: " + available));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(ToolExecutionOutcome.synthetic(request,
                    ToolFailureKind.UNKNOWN_TOOL, "Tool is disabled: " + toolName));
        }

        Optional<String> violation = validateArguments(tool.getDefinition(), request.arguments());
        if (violation.isPresent()) {
            log.warn("[Tools] Invalid arguments for '{}': {}", toolName, violation.get());
            return CompletableFuture.completedFuture(
                    ToolExecutionOutcome.synthetic(request, ToolFailureKind.INVALID_ARGUMENTS, violation.get()));
        }

        context.metrics().recordToolCall(toolName);
        log.info("[Tools] Executing {} (id={})", toolName, request.id());

        CompletableFuture<ToolResult> raw;
        try {
            raw = tool.execute(request.arguments(), context);
        } catch (RuntimeException e) {
            raw = CompletableFuture.failedFuture(e);
        }
        if (raw == null) {
            raw = CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result"));
        }

        CompletableFuture<ToolResult> call = raw;
        Runnable deregister = context.cancellation().onCancel(() -> call.cancel(true));
        long timeoutMs = tool.getTimeout().toMillis();
        String resolvedName = toolName;
        return call.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> toOutcome(request, resolvedName, result, error, timeoutMs))
                .whenComplete((outcome, error) -> deregister.run());
    }

    private ToolExecutionOutcome toOutcome(ToolRequest request, String toolName, ToolResult result, Throwable error,
            long timeoutMs) {
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                log.warn("[Tools] {} timed out after {} ms", toolName, timeoutMs);
                return ToolExecutionOutcome.synthetic(request, ToolFailureKind.TIMEOUT,
                        "Tool call timed out after " + timeoutMs + " ms");
            }
            if (cause instanceof CancellationException) {
                return ToolExecutionOutcome.synthetic(request, ToolFailureKind.CANCELLED,
                        "Research run was cancelled");
            }
            log.error("[Tools] Tool execution failed: {}", toolName, cause);
            return ToolExecutionOutcome.synthetic(request, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(cause));
        }
        if (result == null) {
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }
        String content = truncateToolResult(buildToolMessageContent(result), toolName);
        return new ToolExecutionOutcome(request.id(), toolName, result, content, false);
    }

    /**
     * Checks required fields and declared primitive types.
     *
     * @return description of the first violation, if any
     */
    Optional<String> validateArguments(ToolDefinition definition, Map<String, Object> arguments) {
        for (String required : definition.getRequired()) {
            Object value = arguments.get(required);
            if (value == null || value instanceof String s && s.isBlank()) {
                return Optional.of("Missing required argument: " + required);
            }
        }
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            if (entry.getValue() == null || !(definition.getProperties().get(entry.getKey()) instanceof Map<?, ?> p)) {
                continue;
            }
            Object type = p.get("type");
            if (type instanceof String expected && !matchesType(expected, entry.getValue())) {
                return Optional.of("Argument '" + entry.getKey() + "' must be of type " + expected);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue());
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    /**
     * Strip special tokens and garbage from tool names. Some local models leak
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private String buildToolMessageContent(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput();
        }
        return "Error [" + result.getFailureKind() + "]: " + result.getError();
    }

    private String truncateToolResult(String content, String toolName) {
        int maxChars = properties.getEngine().getMaxToolResultChars();
        if (maxChars <= 0 || !TextTruncator.needsTruncation(content, maxChars)) {
            return content;
        }
        log.warn("[Tools] Truncating '{}' result: {} chars -> {} chars", toolName, content.length(), maxChars);
        return TextTruncator.truncate(content, maxChars);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
