package com.openforge.invoicemate.agent;

import com.openforge.invoicemate.llm.model.Message;
import com.openforge.invoicemate.llm.model.ToolCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, append-only list of turns for one exchange.
 *
 * A tool turn is accepted only while the latest assistant turn has an
 * unanswered call with the same id; an assistant or user turn is refused
 * while calls are still unanswered. Not thread-safe: one exchange owns it.
 */
public final class Conversation {

    private final String        id;
    private final List<Message> turns = new ArrayList<>();
    private final Set<String>   openCallIds = new LinkedHashSet<>();

    public Conversation(String id) {
        this.id = id;
    }

    /**
     * Rebuilds a conversation from client-held history, checking every turn.
     *
     * @throws IllegalStateException if the history breaks the tool-turn ordering
     */
    public static Conversation of(String id, List<Message> history) {
        Conversation conversation = new Conversation(id);
        if (history != null) {
            history.forEach(conversation::append);
        }
        return conversation;
    }

    public String id() {
        return id;
    }

    public void append(Message turn) {
        if (turn == null || turn.role() == null) {
            throw new IllegalStateException("A turn needs a role");
        }
        switch (turn.role()) {
            case Message.ROLE_TOOL -> {
                if (!openCallIds.remove(turn.toolCallId())) {
                    throw new IllegalStateException(
                            "Tool turn for call id '%s' does not answer an open tool call".formatted(turn.toolCallId()));
                }
            }
            case Message.ROLE_ASSISTANT, Message.ROLE_USER, Message.ROLE_SYSTEM -> {
                if (!openCallIds.isEmpty()) {
                    throw new IllegalStateException("Tool calls " + openCallIds + " are still unanswered");
                }
                if (turn.hasToolCalls()) {
                    for (ToolCall call : turn.toolCalls()) {
                        if (!openCallIds.add(call.id())) {
                            throw new IllegalStateException("Duplicate tool call id '%s'".formatted(call.id()));
                        }
                    }
                }
            }
            default -> throw new IllegalStateException("Unknown role '%s'".formatted(turn.role()));
        }
        turns.add(turn);
    }

    /** Puts {@code prompt} in front of the turns unless a system prompt already leads them. */
    public void ensureSystemPrompt(String prompt) {
        if (!hasSystemPrompt()) {
            turns.add(0, Message.system(prompt));
        }
    }

    public boolean hasSystemPrompt() {
        return !turns.isEmpty() && Message.ROLE_SYSTEM.equals(turns.get(0).role());
    }

    /** Every turn, system prompt included, as sent to the model. */
    public List<Message> messages() {
        return Collections.unmodifiableList(turns);
    }

    /** Turns without system prompts, as handed back to the client. */
    public List<Message> transcript() {
        return turns.stream().filter(t -> !Message.ROLE_SYSTEM.equals(t.role())).toList();
    }
}
