package com.narraflow.narraflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Relays flow events through Redis Pub/Sub so every instance delivers them.
 * When an edit lands on instance A but a collaborator is connected to instance B,
 * publishing to Redis ensures instance B receives and delivers the event.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "narraflow:websocket:topic";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Object payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, objectMapper.valueToTree(payload)));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WebSocket message for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            log.trace("Forwarding Redis message to {}", stomp.destination());
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    private record StompMessage(String destination, JsonNode payload) {}
}
