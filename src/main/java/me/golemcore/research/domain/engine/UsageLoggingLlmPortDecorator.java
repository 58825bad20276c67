package me.golemcore.research.domain.engine;

import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.LlmUsage;
import me.golemcore.research.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator around {@link LlmPort} that stamps latency and model onto the
 * response usage and logs it after each chat completion call.
 */
class UsageLoggingLlmPortDecorator implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(UsageLoggingLlmPortDecorator.class);

    private final LlmPort delegate;

    UsageLoggingLlmPortDecorator(LlmPort delegate) {
        this.delegate = delegate;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        Instant start = Instant.now();
        return delegate.chat(request).thenApply(response -> {
            recordUsage(request, response, start);
            return response;
        });
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    private void recordUsage(LlmRequest request, LlmResponse response, Instant start) {
        if (response == null) {
            return;
        }
        LlmUsage usage = response.getUsage() != null ? response.getUsage() : new LlmUsage();
        usage.setLatency(Duration.between(start, Instant.now()));
        usage.setModel(response.getModel() != null ? response.getModel() : request.getModel());
        response.setUsage(usage);
        log.debug("[LLM] {} call took {} ms (in={}, out={}, toolCalls={})", usage.getModel(),
                usage.getLatency().toMillis(), usage.getInputTokens(), usage.getOutputTokens(),
                response.hasToolCalls() ? response.getToolCalls().size() : 0);
    }
}
