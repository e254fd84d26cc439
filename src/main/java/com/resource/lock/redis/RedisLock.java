package com.resource.lock.redis;

import com.resource.lock.AbstractPollingLock;
import com.resource.lock.Lease;
import com.resource.lock.LockDependencies;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed lock using {@code SET NX PX} with a random fencing token.
 *
 * <p>Redis enforces the TTL itself, so a crashed holder's lock is reclaimed by
 * the server once the key expires; no local watchdog is involved. Release and
 * extend run as Lua scripts that compare the token before acting.</p>
 */
public class RedisLock extends AbstractPollingLock {

    public static final String BACKEND = "redis";

    private final RedisClient client;
    private final String prefix;
    private final Supplier<String> tokenGenerator;

    public RedisLock(RedisClient client, RedisLockConfig config) {
        this(client, config, LockDependencies.defaults(), () -> UUID.randomUUID().toString());
    }

    public RedisLock(RedisClient client, RedisLockConfig config, LockDependencies dependencies,
                     Supplier<String> tokenGenerator) {
        super(BACKEND, config.lock(), dependencies);
        this.client = Objects.requireNonNull(client, "client");
        this.prefix = config.keyspacePrefix();
        this.tokenGenerator = Objects.requireNonNull(tokenGenerator, "tokenGenerator");
    }

    @Override
    protected Optional<Lease> claim(String key, long ttlMs) {
        String redisKey = formatKey(key);
        String token = tokenGenerator.get();

        if (!client.setIfAbsent(redisKey, token, ttlMs)) {
            return Optional.empty();
        }
        return Optional.of(new RedisLease(key, redisKey, token, client, this::onLeaseReleased));
    }

    /**
     * The Redis key used for {@code key}.
     */
    public String formatKey(String key) {
        return prefix + key;
    }
}
