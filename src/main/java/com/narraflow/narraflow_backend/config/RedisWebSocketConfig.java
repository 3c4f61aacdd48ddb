package com.narraflow.narraflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.narraflow.narraflow_backend.engine.RedisWebSocketBridge;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Multi-instance fan-out of flow events. Off by default: a single instance delivers directly.
 */
@Configuration
@ConditionalOnProperty(prefix = "narraflow.realtime.redis-bridge", name = "enabled", havingValue = "true")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(
            StringRedisTemplate redisTemplate,
            SimpMessagingTemplate messagingTemplate,
            ObjectMapper objectMapper) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer redisWebSocketListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(RedisWebSocketBridge.REDIS_CHANNEL));
        return container;
    }
}
