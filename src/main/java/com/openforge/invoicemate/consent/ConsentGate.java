package com.openforge.invoicemate.consent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.domain.PendingAction;
import com.openforge.invoicemate.domain.PendingAction.ActionStatus;
import com.openforge.invoicemate.domain.PendingAction.ActionType;
import com.openforge.invoicemate.error.ActionAlreadyExecutedException;
import com.openforge.invoicemate.error.InvoiceMateException;
import com.openforge.invoicemate.error.NoPendingActionException;
import com.openforge.invoicemate.error.PendingActionConflictException;
import com.openforge.invoicemate.error.SerializationException;
import com.openforge.invoicemate.repository.PendingActionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds side-effecting actions until the user explicitly approves them.
 *
 * Tools never perform a sensitive action themselves: they open a draft here
 * and the exchange ends. A later, separate request approves or rejects the
 * draft by token. Approval moves the row to APPROVED under optimistic locking
 * before the executor runs, so two concurrent approvals cannot both execute.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ConsentProperties.class)
public class ConsentGate {

    private enum Claim { CLAIMED, EXPIRED }

    private final PendingActionRepository             repository;
    private final Map<ActionType, SensitiveActionExecutor> executors;
    private final TransactionTemplate                 tx;
    private final ObjectMapper                        objectMapper;
    private final ConsentProperties                   properties;
    private final Clock                               clock;

    @Autowired
    public ConsentGate(PendingActionRepository repository,
                       List<SensitiveActionExecutor> executors,
                       PlatformTransactionManager transactionManager,
                       ObjectMapper objectMapper,
                       ConsentProperties properties) {
        this(repository, executors, transactionManager, objectMapper, properties, Clock.systemUTC());
    }

    ConsentGate(PendingActionRepository repository,
                List<SensitiveActionExecutor> executors,
                PlatformTransactionManager transactionManager,
                ObjectMapper objectMapper,
                ConsentProperties properties,
                Clock clock) {
        this.repository   = repository;
        this.executors    = new EnumMap<>(ActionType.class);
        executors.forEach(e -> this.executors.put(e.actionType(), e));
        this.tx           = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.properties   = properties;
        this.clock        = clock;
    }

    // ── Drafts ───────────────────────────────────────────────────────────────

    /**
     * Freezes {@code draft} as a new DRAFT action for the conversation.
     *
     * @throws PendingActionConflictException if a non-expired draft is already open
     */
    public PendingAction openDraft(String conversationId, ActionType actionType, Object draft, String originTool) {
        String draftJson = toJson(draft);
        return tx.execute(status -> {
            Instant now = clock.instant();
            expireStaleDrafts(conversationId, now).ifPresent(open -> {
                throw new PendingActionConflictException(
                        "A %s draft is already awaiting approval in this conversation (token %s). Approve or reject it first."
                                .formatted(open.getActionType(), open.getToken()));
            });
            PendingAction action = PendingAction.builder()
                    .token(UUID.randomUUID().toString())
                    .conversationId(conversationId)
                    .actionType(actionType)
                    .originTool(originTool)
                    .draftJson(draftJson)
                    .status(ActionStatus.DRAFT)
                    .expiresAt(now.plus(properties.draftTtl()))
                    .build();
            PendingAction saved = repository.save(action);
            log.info("[Consent] Opened {} draft {} for conversation {} (expires {})",
                    actionType, saved.getToken(), conversationId, saved.getExpiresAt());
            return saved;
        });
    }

    /** The non-expired DRAFT of a conversation, if any. Expired drafts are rejected on the way. */
    public Optional<PendingAction> findOpenDraft(String conversationId) {
        return tx.execute(status -> expireStaleDrafts(conversationId, clock.instant()));
    }

    /**
     * @throws PendingActionConflictException if the conversation has an open draft
     */
    public void assertNoOpenDraft(String conversationId) {
        findOpenDraft(conversationId).ifPresent(open -> {
            throw new PendingActionConflictException(
                    "An action (token %s) is awaiting your approval. Approve or reject it before continuing."
                            .formatted(open.getToken()));
        });
    }

    /**
     * @throws NoPendingActionException if the token is unknown
     */
    public PendingAction find(String token) {
        return repository.findByToken(token)
                .orElseThrow(() -> new NoPendingActionException("No pending action found for token " + token + "."));
    }

    public <T> T readDraft(PendingAction action, Class<T> type) {
        try {
            return objectMapper.readValue(action.getDraftJson(), type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Stored draft " + action.getToken() + " could not be read.", e);
        }
    }

    // ── Decisions ────────────────────────────────────────────────────────────

    /**
     * Approves and executes the action exactly once.
     *
     * @throws NoPendingActionException       unknown token, other conversation, rejected or expired
     * @throws ActionAlreadyExecutedException executed already, or another approval is in flight
     */
    public PendingAction approve(String conversationId, String token) {
        Claim claim;
        try {
            claim = tx.execute(status -> claim(conversationId, token));
        } catch (OptimisticLockingFailureException e) {
            log.warn("[Consent] Concurrent approval of {} lost the race", token);
            throw new ActionAlreadyExecutedException("This action is already being executed.", e);
        }
        if (claim == Claim.EXPIRED) {
            throw new NoPendingActionException("The pending action " + token + " has expired.");
        }

        PendingAction action = find(token);
        SensitiveActionExecutor executor = executors.get(action.getActionType());
        String summary;
        try {
            if (executor == null) {
                throw new IllegalStateException("No executor registered for " + action.getActionType());
            }
            summary = executor.execute(action);
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            revertToDraft(token, error);
            if (e instanceof InvoiceMateException) {
                log.warn("[Consent] {} {} failed, back to DRAFT: {}", action.getActionType(), token, error);
            } else {
                log.error("[Consent] {} {} crashed, back to DRAFT", action.getActionType(), token, e);
            }
            throw e;
        }

        PendingAction executed = tx.execute(status -> {
            PendingAction fresh = find(token);
            fresh.setStatus(ActionStatus.EXECUTED);
            fresh.setExecutedAt(clock.instant());
            fresh.setResultSummary(summary);
            fresh.setLastError(null);
            return repository.save(fresh);
        });
        log.info("[Consent] Executed {} {}: {}", action.getActionType(), token, summary);
        return executed;
    }

    /**
     * Cancels a draft; no side effect. Rejecting twice is harmless.
     *
     * @throws NoPendingActionException       unknown token or other conversation
     * @throws ActionAlreadyExecutedException the action has already run
     */
    public PendingAction reject(String conversationId, String token) {
        PendingAction rejected = tx.execute(status -> {
            PendingAction action = ownedBy(conversationId, token);
            switch (action.getStatus()) {
                case EXECUTED, APPROVED -> throw new ActionAlreadyExecutedException(
                        "The action " + token + " has already been executed and cannot be rejected.");
                case REJECTED -> {
                    return action;
                }
                default -> {
                    action.setStatus(ActionStatus.REJECTED);
                    return repository.save(action);
                }
            }
        });
        log.info("[Consent] Rejected {} {}", rejected.getActionType(), token);
        return rejected;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private Claim claim(String conversationId, String token) {
        PendingAction action = ownedBy(conversationId, token);
        switch (action.getStatus()) {
            case EXECUTED -> throw new ActionAlreadyExecutedException("The action " + token + " has already been executed.");
            case APPROVED -> throw new ActionAlreadyExecutedException("The action " + token + " is already being executed.");
            case REJECTED -> throw new NoPendingActionException("The action " + token + " was rejected or has expired.");
            default -> { }
        }
        if (action.isExpired(clock.instant())) {
            action.setStatus(ActionStatus.REJECTED);
            repository.save(action);
            return Claim.EXPIRED;
        }
        action.setStatus(ActionStatus.APPROVED);
        repository.saveAndFlush(action);
        return Claim.CLAIMED;
    }

    private void revertToDraft(String token, String error) {
        tx.executeWithoutResult(status -> {
            PendingAction fresh = find(token);
            fresh.setStatus(ActionStatus.DRAFT);
            fresh.setLastError(error);
            repository.save(fresh);
        });
    }

    private PendingAction ownedBy(String conversationId, String token) {
        PendingAction action = repository.findByToken(token).orElse(null);
        if (action == null || !action.getConversationId().equals(conversationId)) {
            throw new NoPendingActionException("No pending action found for token " + token + " in this conversation.");
        }
        return action;
    }

    /** Rejects expired drafts of the conversation and returns the remaining open one, if any. */
    private Optional<PendingAction> expireStaleDrafts(String conversationId, Instant now) {
        PendingAction open = null;
        for (PendingAction draft : repository.findByConversationIdAndStatus(conversationId, ActionStatus.DRAFT)) {
            if (draft.isExpired(now)) {
                draft.setStatus(ActionStatus.REJECTED);
                repository.save(draft);
                log.info("[Consent] Draft {} expired", draft.getToken());
            } else if (open == null) {
                open = draft;
            }
        }
        return Optional.ofNullable(open);
    }

    private String toJson(Object draft) {
        try {
            return objectMapper.writeValueAsString(draft);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Draft could not be serialized.", e);
        }
    }
}
