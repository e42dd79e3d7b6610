package com.sunorcnys.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Builds a Jedis pool for the token store, or nothing when Redis is not configured or not reachable.
 */
public final class RedisPools {

    private static final Logger log = LoggerFactory.getLogger(RedisPools.class);
    private static final int TIMEOUT_MS = 2000;
    private static final int MAX_POOL_SIZE = 4;

    private RedisPools() {}

    public static Optional<JedisPool> connect(String host, int port, String password) {
        if (host == null || host.isBlank()) {
            log.debug("Redis host not configured, token stores stay file based");
            return Optional.empty();
        }
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(MAX_POOL_SIZE);
        poolConfig.setMaxIdle(2);
        poolConfig.setMaxWait(Duration.ofMillis(TIMEOUT_MS));
        poolConfig.setTestOnBorrow(true);

        JedisPool pool = (password != null && !password.isBlank())
                ? new JedisPool(poolConfig, host, port, TIMEOUT_MS, password)
                : new JedisPool(poolConfig, host, port, TIMEOUT_MS);
        try (Jedis jedis = pool.getResource()) {
            jedis.ping();
            log.info("Redis token store connected: {}:{}", host, port);
            return Optional.of(pool);
        } catch (Exception e) {
            log.warn("Redis at {}:{} unavailable ({}), using file token stores", host, port, e.getMessage());
            pool.close();
            return Optional.empty();
        }
    }
}
