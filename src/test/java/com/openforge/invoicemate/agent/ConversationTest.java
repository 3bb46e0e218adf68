package com.openforge.invoicemate.agent;

import com.openforge.invoicemate.llm.model.Message;
import com.openforge.invoicemate.llm.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    private static Message callsTo(String... ids) {
        List<ToolCall> calls = java.util.Arrays.stream(ids)
                .map(id -> ToolCall.of(id, "execute_sql_query_tool", "{\"sql_query\":\"SELECT 1\"}"))
                .toList();
        return Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(calls).build();
    }

    @Test
    void shouldAcceptWellFormedToolExchange() {
        Conversation conversation = Conversation.of("c1", List.of(
                Message.system("prompt"),
                Message.user("How many invoices?"),
                callsTo("call-1", "call-2"),
                Message.toolResult("call-2", "execute_sql_query_tool", "{}"),
                Message.toolResult("call-1", "execute_sql_query_tool", "{}"),
                Message.assistantText("Three.")));

        assertEquals(6, conversation.messages().size());
        assertTrue(conversation.hasSystemPrompt());
        assertEquals(5, conversation.transcript().size());
        assertEquals(Message.ROLE_USER, conversation.transcript().get(0).role());
    }

    @Test
    void shouldRejectToolTurnWithoutOpenCall() {
        Conversation conversation = Conversation.of("c1", List.of(Message.user("hi")));

        assertThrows(IllegalStateException.class,
                () -> conversation.append(Message.toolResult("call-9", "execute_sql_query_tool", "{}")));
    }

    @Test
    void shouldRejectSecondAnswerToSameCall() {
        Conversation conversation = Conversation.of("c1", List.of(Message.user("hi"), callsTo("call-1"),
                Message.toolResult("call-1", "execute_sql_query_tool", "{}")));

        assertThrows(IllegalStateException.class,
                () -> conversation.append(Message.toolResult("call-1", "execute_sql_query_tool", "{}")));
    }

    @Test
    void shouldRejectNewTurnWhileCallsAreUnanswered() {
        Conversation conversation = Conversation.of("c1", List.of(Message.user("hi"), callsTo("call-1", "call-2"),
                Message.toolResult("call-1", "execute_sql_query_tool", "{}")));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> conversation.append(Message.user("anything?")));
        assertTrue(ex.getMessage().contains("call-2"));
    }

    @Test
    void shouldRejectDuplicateCallIdsAndUnknownRoles() {
        assertThrows(IllegalStateException.class, () -> Conversation.of("c1", List.of(callsTo("x", "x"))));
        assertThrows(IllegalStateException.class,
                () -> Conversation.of("c1", List.of(Message.builder().role("narrator").content("...").build())));
        assertThrows(IllegalStateException.class,
                () -> Conversation.of("c1", List.of(Message.builder().content("no role").build())));
    }

    @Test
    void shouldPutSystemPromptInFrontOfRestoredTurns() {
        Conversation conversation = Conversation.of("c1",
                List.of(Message.user("hi"), Message.assistantText("Hello.")));

        conversation.ensureSystemPrompt("prompt");
        conversation.ensureSystemPrompt("other prompt");

        assertTrue(conversation.hasSystemPrompt());
        assertEquals(List.of(Message.ROLE_SYSTEM, Message.ROLE_USER, Message.ROLE_ASSISTANT),
                conversation.messages().stream().map(Message::role).toList());
        assertEquals("prompt", conversation.messages().get(0).content());
        assertEquals(2, conversation.transcript().size());
    }

    @Test
    void shouldExposeReadOnlyMessages() {
        Conversation conversation = Conversation.of("c1", null);

        assertTrue(conversation.messages().isEmpty());
        assertFalse(conversation.hasSystemPrompt());
        assertThrows(UnsupportedOperationException.class, () -> conversation.messages().add(Message.user("x")));
    }
}
