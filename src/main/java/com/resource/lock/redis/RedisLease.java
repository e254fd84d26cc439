package com.resource.lock.redis;

import com.resource.lock.Lease;
import com.resource.lock.validation.TimeValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Lease handed out by {@link RedisLock}. Ownership is proven by the token
 * stored as the key's value.
 */
final class RedisLease implements Lease {
    private static final Logger log = LoggerFactory.getLogger(RedisLease.class);

    static final String RELEASE_SCRIPT = """
            if redis.call("GET", KEYS[1]) == ARGV[1] then
              return redis.call("DEL", KEYS[1])
            end
            return 0
            """;

    static final String EXTEND_SCRIPT = """
            if redis.call("GET", KEYS[1]) == ARGV[1] then
              return redis.call("PEXPIRE", KEYS[1], ARGV[2])
            end
            return 0
            """;

    private final String key;
    private final String redisKey;
    private final String token;
    private final RedisClient client;
    private final Consumer<Lease> onReleased;
    private final AtomicBoolean released = new AtomicBoolean(false);

    RedisLease(String key, String redisKey, String token, RedisClient client, Consumer<Lease> onReleased) {
        this.key = key;
        this.redisKey = redisKey;
        this.token = token;
        this.client = client;
        this.onReleased = onReleased;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        Object reply = client.eval(RELEASE_SCRIPT, List.of(redisKey), List.of(token));
        if (!isOne(reply)) {
            log.debug("Lock {} was no longer owned at release (expired or reclaimed)", key);
        }
        onReleased.accept(this);
    }

    @Override
    public boolean extend(Duration ttl) {
        if (released.get()) {
            return false;
        }
        long ttlMs = TimeValidation.requirePositiveMillis(ttl, "ttl for lock " + key);

        Object reply = client.eval(EXTEND_SCRIPT, List.of(redisKey), List.of(token, String.valueOf(ttlMs)));
        return isOne(reply);
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    String token() {
        return token;
    }

    private static boolean isOne(Object reply) {
        return reply instanceof Number number && number.longValue() == 1L;
    }

    @Override
    public String toString() {
        return "RedisLease{key='" + key + "', released=" + released.get() + '}';
    }
}
