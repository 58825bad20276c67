package me.golemcore.research.domain.engine;

import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.LlmUsage;
import me.golemcore.research.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UsageLoggingLlmPortDecoratorTest {

    private LlmPort delegate;
    private UsageLoggingLlmPortDecorator decorator;

    @BeforeEach
    void setUp() {
        delegate = mock(LlmPort.class);
        decorator = new UsageLoggingLlmPortDecorator(delegate);
    }

    @Test
    void shouldStampLatencyAndRequestModelWhenResponseHasNoUsage() {
        LlmResponse response = LlmResponse.builder().content("answer").build();
        when(delegate.chat(any())).thenReturn(CompletableFuture.completedFuture(response));

        LlmResponse result = decorator.chat(LlmRequest.builder().model("local-model").build()).join();

        assertSame(response, result);
        assertNotNull(result.getUsage());
        assertEquals("local-model", result.getUsage().getModel());
        assertNotNull(result.getUsage().getLatency());
        assertNull(result.getUsage().getInputTokens());
    }

    @Test
    void shouldKeepTokenCountsAndPreferResponseModel() {
        LlmResponse response = LlmResponse.builder()
                .content("answer")
                .model("gpt-4o-2024")
                .usage(LlmUsage.builder().inputTokens(120).outputTokens(30).build())
                .build();
        when(delegate.chat(any())).thenReturn(CompletableFuture.completedFuture(response));

        LlmResponse result = decorator.chat(LlmRequest.builder().model("gpt-4o").build()).join();

        assertEquals(120, result.getUsage().getInputTokens());
        assertEquals(30, result.getUsage().getOutputTokens());
        assertEquals("gpt-4o-2024", result.getUsage().getModel());
        assertTrue(result.getUsage().getLatency().toMillis() >= 0);
    }

    @Test
    void shouldDelegateMetadataCalls() {
        when(delegate.getProviderId()).thenReturn("openai");
        when(delegate.getCurrentModel()).thenReturn("qwen");
        when(delegate.isAvailable()).thenReturn(true);

        assertEquals("openai", decorator.getProviderId());
        assertEquals("qwen", decorator.getCurrentModel());
        assertTrue(decorator.isAvailable());
    }
}
