package com.openforge.invoicemate.websocket;

import com.openforge.invoicemate.agent.event.AgentEvent;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentEventPublisherTest {

    private final SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
    private final AgentEventPublisher publisher = new AgentEventPublisher(template);

    @Test
    void shouldPublishToConversationTopic() {
        AgentEvent event = AgentEvent.roundStart("conv-1", 1);

        publisher.publish(event);

        verify(template).convertAndSend("/topic/agent/conv-1", event);
    }

    @Test
    void shouldSwallowDeliveryFailure() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(template).convertAndSend(eq("/topic/agent/conv-1"), any(Object.class));

        assertDoesNotThrow(() -> publisher.publish(AgentEvent.finalAnswer("conv-1", "Done.", 2)));
    }
}
