package com.resource.lock.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.params.SetParams;

import java.util.List;

/**
 * {@link RedisClient} backed by Jedis. Accepts any {@link UnifiedJedis}
 * ({@link JedisPooled}, cluster or sentinel clients).
 */
public class JedisRedisClient implements RedisClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JedisRedisClient.class);

    private static final String OK = "OK";

    private final UnifiedJedis jedis;

    public JedisRedisClient(UnifiedJedis jedis) {
        this.jedis = jedis;
    }

    public JedisRedisClient(String host, int port) {
        this(new JedisPooled(host, port));
        log.info("Redis lock client initialized for {}:{}", host, port);
    }

    @Override
    public boolean setIfAbsent(String key, String value, long ttlMs) {
        String reply = jedis.set(key, value, SetParams.setParams().nx().px(ttlMs));
        return OK.equals(reply);
    }

    @Override
    public Object eval(String script, List<String> keys, List<String> args) {
        return jedis.eval(script, keys, args);
    }

    @Override
    public void close() {
        try {
            jedis.close();
        } catch (Exception e) {
            log.warn("Error closing Redis client", e);
        }
        log.info("Redis lock client closed");
    }
}
