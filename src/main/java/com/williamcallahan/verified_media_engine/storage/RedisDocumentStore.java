package com.williamcallahan.verified_media_engine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores documents as Redis strings under a common key prefix
 * - Listing uses SCAN so large keyspaces are never blocked
 */
public class RedisDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisDocumentStore.class);
    private static final int SCAN_COUNT = 100;

    private final JedisPooled jedis;
    private final String keyPrefix;

    public RedisDocumentStore(JedisPooled jedis, String keyPrefix) {
        this.jedis = jedis;
        this.keyPrefix = keyPrefix;
        logger.info("Redis document store ready with key prefix '{}'", keyPrefix);
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(jedis.get(keyPrefix + key));
        } catch (RuntimeException e) {
            throw new DocumentStoreException("Redis GET failed for document " + key, e);
        }
    }

    @Override
    public void set(String key, String json) {
        try {
            jedis.set(keyPrefix + key, json);
        } catch (RuntimeException e) {
            throw new DocumentStoreException("Redis SET failed for document " + key, e);
        }
    }

    @Override
    public List<String> list() {
        List<String> keys = new ArrayList<>();
        ScanParams params = new ScanParams().match(keyPrefix + "*").count(SCAN_COUNT);
        String cursor = ScanParams.SCAN_POINTER_START;
        try {
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                for (String fullKey : page.getResult()) {
                    keys.add(fullKey.substring(keyPrefix.length()));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        } catch (RuntimeException e) {
            throw new DocumentStoreException("Redis SCAN failed for prefix " + keyPrefix, e);
        }
        return keys;
    }

    @Override
    public void delete(String key) {
        try {
            jedis.del(keyPrefix + key);
        } catch (RuntimeException e) {
            throw new DocumentStoreException("Redis DEL failed for document " + key, e);
        }
    }
}
