package me.golemcore.research.domain.engine;

import me.golemcore.research.domain.model.Conversation;
import me.golemcore.research.domain.model.ConversationRequest;
import me.golemcore.research.domain.model.ConversationRunResult;
import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.StopReason;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolExecutionOutcome;
import me.golemcore.research.domain.model.ToolRequest;
import me.golemcore.research.domain.service.ToolRegistry;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turn-synchronous conversation engine.
 *
 * <p>
 * States: AWAITING_MODEL -> AWAITING_TOOLS -> AWAITING_MODEL -> ... ->
 * TERMINAL. One step is one model call. A model message carrying any tool call
 * is non-terminal; plain assistant text ends the run. The step budget and the
 * wall-clock deadline are enforced here regardless of model behavior, and the
 * batch of the last step is always executed so no request stays unanswered.
 */
public class DefaultConversationEngine implements ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultConversationEngine.class);

    static final String EMPTY_RESPONSE_NUDGE = "Your previous reply was empty. Continue the task: "
            + "call a tool if you need more information, otherwise write the final answer.";

    private enum EngineState {
        AWAITING_MODEL, AWAITING_TOOLS, TERMINAL
    }

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ResearchProperties.EngineProperties settings;
    private final ResearchProperties.LlmProperties llmSettings;
    private final Clock clock;

    public DefaultConversationEngine(LlmPort llmPort, ToolRegistry toolRegistry, ResearchProperties properties) {
        this(llmPort, toolRegistry, properties, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultConversationEngine(LlmPort llmPort, ToolRegistry toolRegistry, ResearchProperties properties,
            Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.settings = properties.getEngine();
        this.llmSettings = properties.getLlm();
        this.clock = clock;
    }

    @Override
    public ConversationRunResult run(ConversationRequest request) {
        Conversation conversation = Conversation.start(request.getUserPrompt());
        List<ToolDefinition> tools = toolRegistry.getDefinitions(request.getToolNames());
        Set<String> offeredTools = new LinkedHashSet<>();
        tools.forEach(tool -> offeredTools.add(tool.getName()));

        int maxSteps = request.getMaxSteps() != null ? request.getMaxSteps() : settings.getMaxSteps();
        Duration timeout = request.getTimeout() != null ? request.getTimeout()
                : Duration.ofSeconds(settings.getDeadlineSeconds());
        Instant deadline = clock.instant().plus(timeout);

        EngineState state = EngineState.AWAITING_MODEL;
        StopReason stopReason = null;
        List<ToolRequest> pending = List.of();
        int steps = 0;
        int toolExecutions = 0;
        int emptyResponses = 0;

        log.debug("[Engine] Run started (depth={}, tools={}, maxSteps={})", request.getDepth(), offeredTools,
                maxSteps);

        while (state != EngineState.TERMINAL) {
            switch (state) {
            case AWAITING_MODEL -> {
                stopReason = checkBudgets(request, steps, maxSteps, deadline);
                if (stopReason != null) {
                    state = EngineState.TERMINAL;
                    break;
                }

                LlmResponse response;
                try {
                    response = callModel(request, conversation, tools, deadline);
                } catch (CancellationException e) {
                    stopReason = StopReason.CANCELLED;
                    state = EngineState.TERMINAL;
                    break;
                } catch (TimeoutException e) {
                    log.warn("[Engine] Model call exceeded the run deadline");
                    stopReason = StopReason.DEADLINE_EXCEEDED;
                    state = EngineState.TERMINAL;
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopReason = StopReason.CANCELLED;
                    state = EngineState.TERMINAL;
                    break;
                } catch (ExecutionException | RuntimeException e) {
                    Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                    log.error("[Engine] Model call failed: {}", cause.getMessage(), cause);
                    stopReason = StopReason.MODEL_ERROR;
                    state = EngineState.TERMINAL;
                    break;
                } finally {
                    steps++;
                    request.getMetrics().recordModelCall();
                    request.getMetrics().recordStep();
                }

                if (response != null && response.hasToolCalls()) {
                    pending = normalizeIds(response.getToolCalls(), conversation);
                    conversation.append(Message.toolInvocation(response.getContent(), pending));
                    state = EngineState.AWAITING_TOOLS;
                } else if (response == null || response.getContent() == null || response.getContent().isBlank()) {
                    if (emptyResponses < settings.getMaxEmptyResponseRetries()) {
                        emptyResponses++;
                        log.warn("[Engine] Empty model response, re-prompting ({}/{})", emptyResponses,
                                settings.getMaxEmptyResponseRetries());
                        conversation.append(Message.userText(EMPTY_RESPONSE_NUDGE));
                    } else {
                        stopReason = StopReason.EMPTY_RESPONSES;
                        state = EngineState.TERMINAL;
                    }
                } else {
                    conversation.append(Message.assistantText(response.getContent()));
                    stopReason = StopReason.FINAL_ANSWER;
                    state = EngineState.TERMINAL;
                }
            }
            case AWAITING_TOOLS -> {
                List<ToolExecutionOutcome> outcomes = toolRegistry.dispatchBatch(pending, offeredTools,
                        request.toolContext());
                toolExecutions += outcomes.size();
                conversation.append(Message.toolOutcome(outcomes));
                pending = List.of();
                state = EngineState.AWAITING_MODEL;
            }
            default -> throw new IllegalStateException("Unexpected engine state: " + state);
            }
        }

        log.info("[Engine] Run finished: {} after {} step(s), {} tool call(s) (depth={})", stopReason, steps,
                toolExecutions, request.getDepth());
        return new ConversationRunResult(conversation, stopReason, steps, toolExecutions);
    }

    private StopReason checkBudgets(ConversationRequest request, int steps, int maxSteps, Instant deadline) {
        if (request.getCancellation().isCancelled()) {
            return StopReason.CANCELLED;
        }
        if (steps >= maxSteps) {
            log.warn("[Engine] Step budget exhausted ({} steps)", maxSteps);
            return StopReason.STEP_BUDGET_EXHAUSTED;
        }
        if (!clock.instant().isBefore(deadline)) {
            log.warn("[Engine] Deadline exceeded");
            return StopReason.DEADLINE_EXCEEDED;
        }
        return null;
    }

    private LlmResponse callModel(ConversationRequest request, Conversation conversation, List<ToolDefinition> tools,
            Instant deadline) throws ExecutionException, TimeoutException, InterruptedException {
        LlmRequest llmRequest = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .systemPrompt(request.getSystemPrompt())
                .messages(new ArrayList<>(conversation.getMessages()))
                .tools(tools)
                .temperature(request.getTemperature() != null ? request.getTemperature() : llmSettings.getTemperature())
                .maxTokens(llmSettings.getMaxTokens())
                .build();

        CompletableFuture<LlmResponse> future = llmPort.chat(llmRequest);
        Runnable deregister = request.getCancellation().onCancel(() -> future.cancel(true));
        try {
            long remainingMs = Math.max(1, Duration.between(clock.instant(), deadline).toMillis());
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } finally {
            deregister.run();
        }
    }

    /**
     * Replaces missing or reused tool-call ids so every request of the
     * conversation is uniquely addressable.
     */
    private List<ToolRequest> normalizeIds(List<ToolRequest> calls, Conversation conversation) {
        List<ToolRequest> normalized = new ArrayList<>(calls.size());
        Set<String> batchIds = new HashSet<>();
        for (ToolRequest call : calls) {
            String id = call.id();
            if (id == null || id.isBlank() || conversation.isKnownRequestId(id) || !batchIds.add(id)) {
                String generated = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
                log.debug("[Engine] Replacing tool call id '{}' with '{}'", id, generated);
                batchIds.add(generated);
                normalized.add(call.withId(generated));
            } else {
                normalized.add(call);
            }
        }
        return normalized;
    }
}
