package com.openforge.invoicemate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.agent.event.AgentEvent;
import com.openforge.invoicemate.error.ErrorKind;
import com.openforge.invoicemate.error.InvoiceMateException;
import com.openforge.invoicemate.error.SerializationException;
import com.openforge.invoicemate.error.UpstreamUnavailableException;
import com.openforge.invoicemate.llm.LlmRouter;
import com.openforge.invoicemate.llm.model.ChatRequest;
import com.openforge.invoicemate.llm.model.ChatResponse;
import com.openforge.invoicemate.llm.model.Message;
import com.openforge.invoicemate.llm.model.Tool;
import com.openforge.invoicemate.llm.model.ToolCall;
import com.openforge.invoicemate.tool.ToolRegistry;
import com.openforge.invoicemate.tool.ToolResult;
import com.openforge.invoicemate.tool.ToolSpec;
import com.openforge.invoicemate.websocket.AgentEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The tool-calling loop of one chat exchange.
 *
 * Loop shape:
 *   for round in 1..maxRounds:
 *     1. THINK   send the conversation and the tool specs to the model
 *     2. DECIDE  plain text → ANSWER
 *     3. ACT     run each tool call in listed order and record its result
 *     4. GATE    a result that needs consent ends the exchange at once
 *   → ROUND_LIMIT_EXCEEDED
 *
 * Calls in a round run strictly one after another. The assistant turn and its
 * results are appended together once the round's calls have run, so an
 * assistant turn never lists a call that has no result turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties(AgentProperties.class)
public class AgentOrchestrator {

    public static final String ROUND_LIMIT_MESSAGE =
            "The agent could not complete your request within the allowed steps. Please try rephrasing your request.";

    static final String SYSTEM_PROMPT =
            """
            You are InvoiceMate, an expert assistant for querying the company's invoice, purchase order \
            and contract database and taking action on the results. Work in clear, logical steps.

            SQL workflow:
            1. Identify the tables and columns you need (Invoices, InvoiceLineItems, MasterPOData, Contracts).
            2. Write a single read-only SELECT. Try exact matches first; when nothing matches, use \
            SIMILARITY(column, 'term') >= 60 for fuzzy matching and order by the score.
            3. If you cannot find a value, list the distinct values of the column and pick the ones the \
            user most likely meant. Ask when in doubt; only report "no results" when you are sure.
            4. Answer from the query results. For large results show a preview (use LIMIT) and offer the \
            full file through export_sql_query_to_csv_tool. Link files as [filename](url).
            5. Do not hand out a file unless the user asks for it; show a sample first.

            Invoice verification:
            - Fetch the invoice by InvoiceID or SourceJsonFileName and check for duplicates.
            - Pull the related purchase order from MasterPOData via PurchaseOrder and compare line items \
            (quantity, unit price, amounts).
            - Locate the contract in Contracts, assess delivery penalties and check tax clauses.
            - Present your findings in chat first, tables as Markdown. Offer a PDF report; if the user \
            agrees, call generate_verification_report_pdf_tool with the findings re-written as sections of \
            plain text and '- ' bullet lines (the PDF cannot render tables).

            Email workflow:
            - Confirm the recipients; ask for them if they were not given.
            - Write a clear subject and a plain-text body (no HTML; newlines for paragraphs, dashes for lists).
            - Attach files only when the user asked for one or you have just generated one; otherwise \
            attachments_json must be '[]'.
            - Call request_user_email_consent once. The email is sent only after the user approves it.

            Principles:
            - SELECT statements only; never attempt writes.
            - Show money amounts with their currency code where available.
            - Be accurate and transparent.
            """;

    private final LlmRouter           llmRouter;
    private final ToolRegistry        toolRegistry;
    private final AgentEventPublisher publisher;
    private final ObjectMapper        objectMapper;
    private final AgentProperties     properties;

    // ── Entry point ──────────────────────────────────────────────────────────

    /**
     * Runs one exchange on {@code conversation}, appending every turn it
     * produces. The system prompt is put in front when the conversation has none,
     * which is always the case for history restored from a client transcript.
     *
     * @throws InvoiceMateException when the model is unreachable; tool failures
     *         never surface here, they go back to the model as results
     */
    public ExchangeOutcome run(Conversation conversation, String userMessage, int maxRounds) {
        String id = conversation.id();
        conversation.ensureSystemPrompt(SYSTEM_PROMPT);
        conversation.append(Message.user(userMessage));
        log.info("[Agent:{}] Exchange started ({} prior turn(s))", id, conversation.messages().size() - 1);

        List<Tool> tools = toolRegistry.describeAll().stream().map(ToolSpec::toTool).toList();
        int round = 0;
        try {
            while (round < maxRounds) {
                round++;
                publisher.publish(AgentEvent.roundStart(id, round));
                log.debug("[Agent:{}] Round {}", id, round);

                // ── THINK ────────────────────────────────────────────────────
                ChatResponse response = llmRouter.chat(
                        ChatRequest.withTools(conversation.messages(), tools, properties.temperature()));
                if (response == null) {
                    throw new UpstreamUnavailableException("The model returned no response.");
                }
                Message assistant = response.assistantMessage()
                        .orElseThrow(() -> new UpstreamUnavailableException("The model returned no message."));
                if ("length".equals(response.finishReason())) {
                    log.warn("[Agent:{}] Model output truncated at round {}", id, round);
                }

                // ── DECIDE ───────────────────────────────────────────────────
                if (!assistant.hasToolCalls()) {
                    String answer = assistant.content() == null ? "" : assistant.content();
                    conversation.append(Message.assistantText(answer));
                    publisher.publish(AgentEvent.finalAnswer(id, answer, round));
                    log.info("[Agent:{}] Answered in {} round(s)", id, round);
                    return ExchangeOutcome.answer(answer, round);
                }

                // ── ACT ──────────────────────────────────────────────────────
                List<ToolCall> ran     = new ArrayList<>();
                List<Message>  results = new ArrayList<>();
                Set<String>    callIds = new HashSet<>();
                for (ToolCall requested : assistant.toolCalls()) {
                    ToolCall call = requested;
                    ToolResult result;
                    if (requested.id() == null || requested.id().isBlank() || !callIds.add(requested.id())) {
                        // tool turns are keyed by call id: give it a fresh one and skip it
                        call = new ToolCall("call_" + UUID.randomUUID().toString().replace("-", ""),
                                requested.type(), requested.function());
                        callIds.add(call.id());
                        log.warn("[Agent:{}] Tool {} came with a missing or repeated call id '{}'",
                                id, requested.name(), requested.id());
                        publisher.publish(AgentEvent.toolCall(id, call, round));
                        result = ToolResult.failure(call.id(), ErrorKind.VALIDATION_ERROR,
                                "Tool call id '%s' is missing or repeated in this turn; the call was not run. "
                                        .formatted(requested.id()) + "Issue it again with a unique id.");
                    } else {
                        publisher.publish(AgentEvent.toolCall(id, call, round));
                        log.info("[Agent:{}] Tool {} args={}", id, call.name(), call.arguments());
                        result = toolRegistry.dispatch(call, id);
                    }
                    String content = toJson(result);
                    ran.add(call);
                    results.add(Message.toolResult(call.id(), call.name(), content));
                    publisher.publish(AgentEvent.toolResult(id, call.name(), result.success(), content, round));

                    // ── GATE ─────────────────────────────────────────────────
                    if (result.requiresConsent()) {
                        appendRound(conversation, assistant, ran, results);
                        int skipped = assistant.toolCalls().size() - ran.size();
                        if (skipped > 0) {
                            log.info("[Agent:{}] {} later call(s) dropped behind the consent request", id, skipped);
                        }
                        publisher.publish(AgentEvent.consentRequired(id, result.payload(), round));
                        log.info("[Agent:{}] Waiting for consent on {}", id, call.name());
                        return ExchangeOutcome.consentRequired(result.payload(), call.name(), round);
                    }
                }
                appendRound(conversation, assistant, ran, results);
            }
        } catch (InvoiceMateException e) {
            log.warn("[Agent:{}] Exchange failed in round {}: {}", id, round, e.getMessage());
            publisher.publish(AgentEvent.error(id, e.getMessage(), round));
            throw e;
        }

        log.warn("[Agent:{}] Max rounds ({}) reached", id, maxRounds);
        conversation.append(Message.assistantText(ROUND_LIMIT_MESSAGE));
        publisher.publish(AgentEvent.error(id, ROUND_LIMIT_MESSAGE, round));
        return ExchangeOutcome.roundLimitExceeded(ROUND_LIMIT_MESSAGE, round);
    }

    public ExchangeOutcome run(Conversation conversation, String userMessage) {
        return run(conversation, userMessage, properties.maxRounds());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void appendRound(Conversation conversation, Message assistant, List<ToolCall> ran, List<Message> results) {
        Message turn = ran.equals(assistant.toolCalls())
                ? assistant
                : assistant.toBuilder().toolCalls(List.copyOf(ran)).build();
        conversation.append(turn);
        results.forEach(conversation::append);
    }

    private String toJson(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException e) {
            throw new SerializationException("Tool result could not be serialized.", e);
        }
    }
}
