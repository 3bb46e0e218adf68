package com.openforge.invoicemate.repository;

import com.openforge.invoicemate.domain.PendingAction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PendingActionRepository extends JpaRepository<PendingAction, Long> {

    Optional<PendingAction> findByToken(String token);

    List<PendingAction> findByConversationIdAndStatus(String conversationId, PendingAction.ActionStatus status);
}
