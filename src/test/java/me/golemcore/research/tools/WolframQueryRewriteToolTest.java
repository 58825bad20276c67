package me.golemcore.research.tools;

import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.ResearchMetrics;
import me.golemcore.research.domain.model.CancellationToken;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WolframQueryRewriteToolTest {

    private static final String QUESTION = "natural_language_question";

    private LlmPort llmPort;
    private ResearchProperties properties;
    private WolframQueryRewriteTool tool;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.getCurrentModel()).thenReturn("test-model");
        properties = new ResearchProperties();
        tool = new WolframQueryRewriteTool(llmPort, properties);
    }

    private void respond(String content) {
        when(llmPort.chat(any())).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content(content).build()));
    }

    @Test
    void isEnabled_followsWolframSwitch() {
        assertFalse(tool.isEnabled());

        properties.getTools().getWolfram().setEnabled(true);

        assertTrue(tool.isEnabled());
    }

    @Test
    void execute_returnsRewrittenQuery() throws Exception {
        respond("solve 2x + 10 = 300 for x");

        ToolResult result = tool.execute(Map.of(QUESTION, "If 2x plus 10 equals 300, what is x?")).get();

        assertTrue(result.isSuccess());
        assertEquals("solve 2x + 10 = 300 for x", result.getOutput());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals(0.0, captor.getValue().getTemperature());
        assertTrue(captor.getValue().getTools().isEmpty());
        assertTrue(captor.getValue().getMessages().get(0).getContent().contains("what is x?"));
    }

    @Test
    void execute_countsModelCallInRunMetrics() throws Exception {
        respond("integrate x^2 dx from 0 to 1");
        ResearchMetrics metrics = new ResearchMetrics();

        tool.execute(Map.of(QUESTION, "area under x squared"),
                new ToolInvocationContext(CancellationToken.create(), metrics, 0)).get();

        assertEquals(1, metrics.getModelCalls());
    }

    @Test
    void execute_failsOnEmptyRewrite() throws Exception {
        respond("   ");

        ToolResult result = tool.execute(Map.of(QUESTION, "what?")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.PROVIDER_ERROR, result.getFailureKind());
    }

    @Test
    void execute_failsWhenModelFails() throws Exception {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        ToolResult result = tool.execute(Map.of(QUESTION, "what?")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Query rewrite failed"));
    }

    @Test
    void clean_stripsFencesAndQuotes() {
        assertEquals("d/dx sin(x)", WolframQueryRewriteTool.clean("```\n`d/dx sin(x)`\n```"));
        assertEquals("limit (1+1/n)^n as n->infinity",
                WolframQueryRewriteTool.clean("\"limit (1+1/n)^n as n->infinity\"\nExplanation follows"));
        assertEquals("", WolframQueryRewriteTool.clean(null));
    }
}
