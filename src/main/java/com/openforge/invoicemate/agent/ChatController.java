package com.openforge.invoicemate.agent;

import com.openforge.invoicemate.agent.dto.ActionStatusResponse;
import com.openforge.invoicemate.agent.dto.ChatExchangeRequest;
import com.openforge.invoicemate.agent.dto.ChatExchangeResponse;
import com.openforge.invoicemate.consent.ConsentGate;
import com.openforge.invoicemate.sql.SchemaDescriptionProvider;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for chat exchanges.
 *
 * Endpoints:
 *   POST /api/chat                    send a message, or approve/reject a pending action
 *   GET  /api/chat/actions/{token}    current state of a pending action
 *   POST /api/admin/schema/refresh    reload the schema shown to the model
 *
 * Progress of a running exchange is pushed to /topic/agent/{conversationId}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController {

    private final ChatService               chatService;
    private final ConsentGate               consentGate;
    private final SchemaDescriptionProvider schemaDescriptionProvider;

    @PostMapping("/api/chat")
    public ResponseEntity<ChatExchangeResponse> chat(@Valid @RequestBody ChatExchangeRequest request) {
        ChatExchangeResponse response = chatService.exchange(request);
        log.info("[API] Conversation {} → {}", response.conversationId(), response.status());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/api/chat/actions/{token}")
    public ResponseEntity<ActionStatusResponse> actionStatus(@PathVariable String token) {
        return ResponseEntity.ok(ActionStatusResponse.from(consentGate.find(token)));
    }

    @PostMapping("/api/admin/schema/refresh")
    public ResponseEntity<Map<String, Object>> refreshSchema() {
        SchemaDescriptionProvider.SchemaSnapshot snapshot = schemaDescriptionProvider.refresh();
        log.info("[API] Schema refreshed, version {}", snapshot.version());
        return ResponseEntity.ok(Map.of(
                "version", snapshot.version(),
                "loadedAt", snapshot.loadedAt().toString()));
    }
}
