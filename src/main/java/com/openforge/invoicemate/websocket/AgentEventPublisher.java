package com.openforge.invoicemate.websocket;

import com.openforge.invoicemate.agent.event.AgentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes AgentEvents to the STOMP topic of their conversation.
 *
 * Topic layout:
 *   /topic/agent/{conversationId}  → all events for one conversation
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/agent/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Fire-and-forget. A delivery failure is logged and never reaches the
     * exchange that produced the event.
     */
    public void publish(AgentEvent event) {
        String destination = TOPIC_PREFIX + event.conversationId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (MessagingException e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
