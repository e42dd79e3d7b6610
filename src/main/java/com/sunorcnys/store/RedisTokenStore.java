package com.sunorcnys.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.model.TokenRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hybrid token store: Redis when a pool is available, in-memory otherwise.
 * Redis failures degrade to the local copy instead of failing the caller.
 */
public class RedisTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenStore.class);
    static final String KEY_PREFIX = "syncronus:token:";

    private final JedisPool pool;
    private final String key;
    private final ObjectMapper mapper;
    private final AtomicReference<TokenRecord> local = new AtomicReference<>();

    /**
     * @param pool    connection pool, or null to run purely in memory
     * @param account account key, e.g. {@code spotify}
     */
    public RedisTokenStore(JedisPool pool, String account, ObjectMapper mapper) {
        this.pool = pool;
        this.key = KEY_PREFIX + account;
        this.mapper = mapper;
    }

    public String getKey() {
        return key;
    }

    @Override
    public Optional<TokenRecord> load() {
        if (pool != null) {
            try (Jedis jedis = pool.getResource()) {
                String json = jedis.get(key);
                if (json != null) {
                    TokenRecord record = mapper.readValue(json, TokenRecord.class);
                    local.set(record);
                    return Optional.of(record);
                }
            } catch (JsonProcessingException e) {
                log.warn("Unreadable token record under {}: {}", key, e.getMessage());
            } catch (Exception e) {
                log.warn("Redis error reading {}, falling back to memory: {}", key, e.getMessage());
            }
        }
        return Optional.ofNullable(local.get());
    }

    @Override
    public void save(TokenRecord record) {
        local.set(record);
        if (pool == null) {
            return;
        }
        try (Jedis jedis = pool.getResource()) {
            jedis.set(key, mapper.writeValueAsString(record));
        } catch (Exception e) {
            log.warn("Redis error storing {}, kept in memory only: {}", key, e.getMessage());
        }
    }

    @Override
    public void clear() {
        local.set(null);
        if (pool == null) {
            return;
        }
        try (Jedis jedis = pool.getResource()) {
            jedis.del(key);
        } catch (Exception e) {
            log.warn("Redis error removing {}: {}", key, e.getMessage());
        }
    }
}
