package com.narraflow.narraflow_backend.config;

import com.narraflow.narraflow_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs at startup how flow events reach collaborators: through the Redis bridge or directly.
 * If the bridge is enabled but no Redis URL is configured, Spring falls back to localhost.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    public RedisStartupLogger(Environment env, ObjectProvider<RedisWebSocketBridge> bridgeProvider) {
        this.env = env;
        this.bridgeProvider = bridgeProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (bridgeProvider.getIfAvailable() != null) {
            String redisUrl = env.getProperty("spring.data.redis.url", "");
            if (redisUrl.isEmpty()) {
                log.warn("Realtime: Redis bridge enabled but spring.data.redis.url is empty, using the default host");
            } else {
                log.info("Realtime: flow events are relayed through Redis channel {}", RedisWebSocketBridge.REDIS_CHANNEL);
            }
        } else {
            log.info("Realtime: Redis bridge disabled, flow events are delivered by this instance only");
        }
    }
}
