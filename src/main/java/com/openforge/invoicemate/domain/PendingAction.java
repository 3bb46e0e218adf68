package com.openforge.invoicemate.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A consent-gated action waiting for, or past, the user's decision.
 *
 * The draft is frozen at creation as JSON; approval executes exactly that
 * content. The status column is the single source of truth for whether the
 * side effect has happened.
 *
 *  Lifecycle: DRAFT → APPROVED → EXECUTED
 *             DRAFT → REJECTED            (user cancelled, or draft expired)
 *             APPROVED → DRAFT            (execution failed; user may approve again)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "pending_actions",
    uniqueConstraints = @UniqueConstraint(name = "uq_pending_action_token", columnNames = "token"),
    indexes = @Index(name = "idx_pending_action_conversation", columnList = "conversation_id, status")
)
public class PendingAction extends BaseEntity {

    public enum ActionType {
        SEND_EMAIL
    }

    public enum ActionStatus {
        DRAFT,
        APPROVED,
        EXECUTED,
        REJECTED
    }

    /** Opaque UUID handed to the client as the action token. */
    @Column(name = "token", nullable = false, length = 36)
    private String token;

    @Column(name = "conversation_id", nullable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32)
    private ActionType actionType;

    /** Tool whose call produced this draft. */
    @Column(name = "origin_tool", length = 100)
    private String originTool;

    /** JSON-serialized draft, e.g. an EmailDraft. Never contains credentials. */
    @Column(name = "draft_json", nullable = false, columnDefinition = "TEXT")
    private String draftJson;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ActionStatus status = ActionStatus.DRAFT;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    /** Populated when status = EXECUTED. */
    @Column(name = "result_summary", columnDefinition = "TEXT")
    private String resultSummary;

    /** Last execution failure, kept after the action returns to DRAFT. */
    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
