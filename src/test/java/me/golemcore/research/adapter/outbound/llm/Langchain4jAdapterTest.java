package me.golemcore.research.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.research.domain.model.LlmRequest;
import me.golemcore.research.domain.model.LlmResponse;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolExecutionOutcome;
import me.golemcore.research.domain.model.ToolRequest;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String MODEL = "test-model";
    private static final String IS_RATE_LIMIT_ERROR = "isRateLimitError";

    private ResearchProperties properties;
    private ExecutorService executor;
    private ChatModel chatModel;
    private List<Long> sleeps;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        properties.getLlm().setMaxRetries(2);
        properties.getLlm().setRetryInitialBackoffMs(100);
        executor = Executors.newSingleThreadExecutor();
        chatModel = mock(ChatModel.class);
        sleeps = new ArrayList<>();
        adapter = new Langchain4jAdapter(properties, new ObjectMapper(), executor) {
            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                sleeps.add(backoffMs);
            }
        };
        ReflectionTestUtils.setField(adapter, "chatModel", chatModel);
        ReflectionTestUtils.setField(adapter, "currentModel", MODEL);
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ChatResponse textResponse(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .tokenUsage(new TokenUsage(12, 4))
                .finishReason(FinishReason.STOP)
                .build();
    }

    private static ToolDefinition searchDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of("type", "string", "description", "query"),
                                "max_results", Map.of("type", "integer")),
                        "required", List.of("query")))
                .build();
    }

    // ==================== Message conversion ====================

    @Test
    void shouldConvertConversationMessages() {
        ToolRequest call = new ToolRequest("call_1", "web_search", Map.of("query", "java"));
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("You are a researcher.")
                .messages(List.of(
                        Message.userText("What is Java?"),
                        Message.toolInvocation("Searching first.", List.of(call)),
                        Message.toolOutcome(List.of(new ToolExecutionOutcome("call_1", "web_search",
                                ToolResult.success(""), "", false))),
                        Message.assistantText("Java is a language.")))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("You are a researcher.", ((SystemMessage) messages.get(0)).text());
        assertEquals("What is Java?", ((UserMessage) messages.get(1)).singleText());
        AiMessage invocation = (AiMessage) messages.get(2);
        assertEquals("Searching first.", invocation.text());
        ToolExecutionRequest converted = invocation.toolExecutionRequests().get(0);
        assertEquals("call_1", converted.id());
        assertEquals("web_search", converted.name());
        assertEquals("{\"query\":\"java\"}", converted.arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call_1", result.id());
        assertEquals("(no output)", result.text());
        assertEquals("Java is a language.", ((AiMessage) messages.get(4)).text());
    }

    @Test
    void shouldEmitOneResultMessagePerOutcome() {
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.userText("q"),
                        Message.toolInvocation(null, List.of(
                                new ToolRequest("a", "web_search", Map.of()),
                                new ToolRequest("b", "web_search", Map.of()))),
                        Message.toolOutcome(List.of(
                                new ToolExecutionOutcome("a", "web_search", ToolResult.success("A"), "A", false),
                                new ToolExecutionOutcome("b", "web_search", ToolResult.success("B"), "B", false)))))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertNull(((AiMessage) messages.get(1)).text());
        assertEquals("b", ((ToolExecutionResultMessage) messages.get(3)).id());
    }

    // ==================== Chat ====================

    @Test
    void shouldReturnTextResponseWithUsage() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(textResponse("Java is a language."));

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("What is Java?")))
                .temperature(0.2)
                .build()).get();

        assertEquals("Java is a language.", response.getContent());
        assertFalse(response.hasToolCalls());
        assertEquals(16, response.getUsage().getTotalTokens());
        assertEquals(MODEL, response.getModel());
        assertEquals("STOP", response.getFinishReason());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(0.2, captor.getValue().temperature());
        assertTrue(captor.getValue().toolSpecifications() == null
                || captor.getValue().toolSpecifications().isEmpty());
    }

    @Test
    void shouldParseToolCallsAndSendToolSpecifications() throws Exception {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_9")
                .name("web_search")
                .arguments("{\"query\":\"java history\",\"max_results\":3}")
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(call)))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("History of Java?")))
                .tools(List.of(searchDefinition()))
                .build()).get();

        assertTrue(response.hasToolCalls());
        ToolRequest request = response.getToolCalls().get(0);
        assertEquals("call_9", request.id());
        assertEquals("java history", request.arguments().get("query"));
        assertEquals(3, request.arguments().get("max_results"));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().toolSpecifications().size());
        assertEquals("web_search", captor.getValue().toolSpecifications().get(0).name());
        assertEquals(List.of("query"), captor.getValue().toolSpecifications().get(0).parameters().required());
    }

    @Test
    void shouldTolerateMalformedToolArguments() throws Exception {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_1")
                .name("web_search")
                .arguments("{not json")
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(call)))
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("q")))
                .build()).get();

        assertTrue(response.getToolCalls().get(0).arguments().isEmpty());
    }

    @Test
    void shouldRetryRateLimitWithBackoff() throws Exception {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenThrow(new RuntimeException("rate_limit_exceeded"))
                .thenReturn(textResponse("done"));

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("q")))
                .build()).get();

        assertEquals("done", response.getContent());
        assertEquals(List.of(100L, 200L), sleeps);
        verify(chatModel, times(3)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldFailAfterRetriesExhausted() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("HTTP 429 Too Many Requests"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("q")))
                .build()).get());

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(2, sleeps.size());
        verify(chatModel, times(3)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldNotRetryOtherErrors() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("Connection refused"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.userText("q")))
                .build()).get());

        assertEquals("LLM chat failed: Connection refused", e.getCause().getMessage());
        assertTrue(sleeps.isEmpty());
    }

    // ==================== Configuration ====================

    @Test
    void isRateLimitError_detectsNestedCause() {
        RuntimeException ex = new RuntimeException("LLM failed", new RuntimeException("Too Many Requests"));

        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR, ex));
        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException((String) null)));
    }

    @Test
    void shouldBuildAzureV1BaseUrl() {
        assertEquals("https://res.openai.azure.com/openai/v1",
                Langchain4jAdapter.azureBaseUrl("https://res.openai.azure.com/"));
        assertEquals("https://res.openai.azure.com/openai/v1",
                Langchain4jAdapter.azureBaseUrl("https://res.openai.azure.com/openai/v1"));
    }

    @Test
    void isAvailable_requiresKeyOrBaseUrl() {
        assertTrue(adapter.isAvailable());

        properties.getLlm().setBaseUrl(null);
        assertFalse(adapter.isAvailable());

        properties.getLlm().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldUseDeploymentAsModelForAzure() {
        properties.getLlm().setProvider("azure");
        properties.getLlm().setApiKey("azure-key");
        properties.getLlm().getAzure().setEndpoint("https://res.openai.azure.com");
        properties.getLlm().getAzure().setDeployment("gpt-4o-research");
        Langchain4jAdapter azure = new Langchain4jAdapter(properties, new ObjectMapper(), executor);

        assertEquals("gpt-4o-research", azure.getCurrentModel());
    }
}
