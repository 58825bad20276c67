package me.golemcore.research.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTest {

    private static final String SEARCH = "web_search";

    private static ToolRequest request(String id) {
        return new ToolRequest(id, SEARCH, Map.of("query", "java"));
    }

    private static ToolExecutionOutcome outcome(String id) {
        return new ToolExecutionOutcome(id, SEARCH, ToolResult.success("ok"), "ok", false);
    }

    @Test
    void shouldStartWithSingleUserMessage() {
        Conversation conversation = Conversation.start("What is Java?");

        assertEquals(1, conversation.size());
        assertEquals(Message.Type.USER_TEXT, conversation.get(0).getType());
        assertEquals("What is Java?", conversation.get(0).getContent());
    }

    @Test
    void shouldAcceptOutcomeAnsweringPendingRequest() {
        Conversation conversation = Conversation.start("q");
        conversation.append(Message.toolInvocation(null, List.of(request("call_1"))));

        assertEquals(1, conversation.getPendingRequestIds().size());

        Message accepted = conversation.append(Message.toolOutcome(List.of(outcome("call_1"))));

        assertEquals(1, accepted.getToolOutcomes().size());
        assertTrue(conversation.getPendingRequestIds().isEmpty());
    }

    @Test
    void shouldDropOrphanedAndDuplicateOutcomes() {
        Conversation conversation = Conversation.start("q");
        conversation.append(Message.toolInvocation(null, List.of(request("call_1"))));

        Message accepted = conversation.append(Message.toolOutcome(
                List.of(outcome("call_1"), outcome("call_1"), outcome("call_unknown"))));

        assertEquals(1, accepted.getToolOutcomes().size());
        assertEquals("call_1", accepted.getToolOutcomes().get(0).requestId());
    }

    @Test
    void shouldRejectReusedRequestId() {
        Conversation conversation = Conversation.start("q");
        conversation.append(Message.toolInvocation(null, List.of(request("call_1"))));
        conversation.append(Message.toolOutcome(List.of(outcome("call_1"))));

        Message reused = Message.toolInvocation(null, List.of(request("call_1")));
        assertThrows(IllegalArgumentException.class, () -> conversation.append(reused));
    }

    @Test
    void shouldRejectMissingRequestId() {
        Conversation conversation = Conversation.start("q");

        Message missing = Message.toolInvocation(null, List.of(request(null)));
        assertThrows(IllegalArgumentException.class, () -> conversation.append(missing));
    }

    @Test
    void shouldReturnLastNonBlankAssistantText() {
        Conversation conversation = Conversation.start("q");
        conversation.append(Message.assistantText("first"));
        conversation.append(Message.assistantText("  "));

        assertEquals("first", conversation.lastAssistantText().orElseThrow());
    }

    @Test
    void shouldReturnEmptyWhenNoAssistantText() {
        Conversation conversation = Conversation.start("q");

        assertFalse(conversation.lastAssistantText().isPresent());
    }

    @Test
    void shouldConcatenateToolOutcomeText() {
        Message message = Message.toolOutcome(List.of(
                new ToolExecutionOutcome("a", SEARCH, ToolResult.success("one"), "one", false),
                new ToolExecutionOutcome("b", SEARCH, ToolResult.success(""), "", false),
                new ToolExecutionOutcome("c", SEARCH, ToolResult.success("two"), "two", false)));

        assertEquals("one\n\ntwo", message.text());
    }
}
