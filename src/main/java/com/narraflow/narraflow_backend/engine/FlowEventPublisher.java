package com.narraflow.narraflow_backend.engine;

import com.narraflow.narraflow_backend.model.collab.FlowEvent;
import com.narraflow.narraflow_backend.model.collab.FlowEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Delivers flow events to every client subscribed to the flow, through Redis when the
 * multi-instance bridge is enabled.
 */
@Slf4j
@Component
public class FlowEventPublisher {

    // Editors subscribe to /topic/flows/{flowId}
    private static final String TOPIC = "/topic/flows/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public FlowEventPublisher(SimpMessagingTemplate messagingTemplate,
                              ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public static String topicFor(UUID flowId) {
        return TOPIC + flowId;
    }

    public void publish(FlowEvent event) {
        String destination = topicFor(event.flowId());
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        if (event.type() == FlowEventType.CURSOR_MOVED) {
            log.trace("Publishing cursor #{} to {}", event.sequence(), destination);
        } else {
            log.debug("Publishing {} #{} to {} via {}", event.type().wireName(), event.sequence(), destination,
                    bridge != null ? "Redis" : "Direct");
        }
        if (bridge != null) {
            bridge.publish(destination, event);
        } else {
            messagingTemplate.convertAndSend(destination, event);
        }
    }
}
