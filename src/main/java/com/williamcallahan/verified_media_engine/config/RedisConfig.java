package com.williamcallahan.verified_media_engine.config;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Jedis connection pool for the Redis document store
 * - Accepts a {@code redis://} or {@code rediss://} URL in REDIS_SERVER, or discrete host settings
 * - Pings once at startup so a bad configuration fails fast
 */
@Configuration
@Profile("!test")
@Conditional(RedisEnvironmentCondition.class)
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);
    private static final int DEFAULT_PORT = 6379;

    @Value("${spring.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.redis.port:6379}")
    private int redisPort;

    @Value("${spring.redis.password:#{null}}")
    private String redisPassword;

    @Value("${REDIS_SERVER:#{null}}")
    private String redisUrl;

    @Value("${spring.redis.ssl:false}")
    private boolean useSsl;

    @Value("${spring.redis.timeout:5000}")
    private int timeoutMs;

    @Value("${spring.redis.jedis.pool.max-active:8}")
    private int maxActive;

    @Value("${spring.redis.jedis.pool.max-idle:4}")
    private int maxIdle;

    @Value("${spring.redis.jedis.pool.max-wait:3000}")
    private int maxWaitMs;

    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled() {
        URI uri = parseUrl();
        HostAndPort hostAndPort = uri == null
            ? new HostAndPort(redisHost, redisPort)
            : new HostAndPort(uri.getHost(), uri.getPort() != -1 ? uri.getPort() : DEFAULT_PORT);

        DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeoutMs)
            .socketTimeoutMillis(timeoutMs)
            .ssl(useSsl || (redisUrl != null && redisUrl.startsWith("rediss://")));
        String password = passwordFrom(uri);
        if (password != null && !password.isEmpty()) {
            clientConfig.password(password);
        }

        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(maxWaitMs));

        logger.info("Creating JedisPooled for document storage: host={}, port={}, maxTotal={}",
            hostAndPort.getHost(), hostAndPort.getPort(), maxActive);
        JedisPooled jedis = new JedisPooled(hostAndPort, clientConfig.build(), poolConfig);
        try {
            logger.info("Redis ping on startup: {}", jedis.ping());
        } catch (RuntimeException e) {
            jedis.close();
            throw new IllegalStateException("Failed to ping Redis during startup: " + e.getMessage(), e);
        }
        return jedis;
    }

    private URI parseUrl() {
        if (redisUrl == null || redisUrl.isBlank()) {
            return null;
        }
        try {
            return new URI(redisUrl);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid REDIS_SERVER URL", e);
        }
    }

    private String passwordFrom(URI uri) {
        if (uri != null && uri.getUserInfo() != null) {
            String[] userInfo = uri.getUserInfo().split(":", 2);
            if (userInfo.length > 1) {
                return userInfo[1];
            }
        }
        return redisPassword;
    }
}
