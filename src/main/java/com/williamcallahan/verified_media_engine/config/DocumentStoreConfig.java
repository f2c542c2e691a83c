package com.williamcallahan.verified_media_engine.config;

import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.FileSystemDocumentStore;
import com.williamcallahan.verified_media_engine.storage.InMemoryDocumentStore;
import com.williamcallahan.verified_media_engine.storage.RedisDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPooled;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Chooses the document store backend and provides the clock used for timestamps
 * - {@code app.storage.type=memory} keeps everything in-process
 * - Otherwise Redis when a pool is available, else files under {@code app.storage.dir}
 */
@Configuration
public class DocumentStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(DocumentStore.class)
    public DocumentStore documentStore(AppConfigurationProperties properties, ObjectProvider<JedisPooled> jedisProvider) {
        AppConfigurationProperties.Storage storage = properties.getStorage();
        if ("memory".equalsIgnoreCase(storage.getType())) {
            logger.info("Using in-memory document store");
            return new InMemoryDocumentStore();
        }
        JedisPooled jedis = jedisProvider.getIfAvailable();
        if (jedis != null && !"filesystem".equalsIgnoreCase(storage.getType())) {
            return new RedisDocumentStore(jedis, storage.getRedisKeyPrefix());
        }
        return new FileSystemDocumentStore(Path.of(storage.getDir()));
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
