package com.williamcallahan.verified_media_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

/**
 * Matches when a Redis connection is configured through {@code REDIS_SERVER} or {@code spring.redis.host}
 */
public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);
    private static volatile boolean loggedDetection = false;

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();
        boolean configured = hasText(env.getProperty("REDIS_SERVER")) || hasText(env.getProperty("spring.redis.host"));
        if (configured && !loggedDetection) {
            logger.info("Redis connection settings detected, documents will be stored in Redis");
            loggedDetection = true;
        }
        return configured;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
