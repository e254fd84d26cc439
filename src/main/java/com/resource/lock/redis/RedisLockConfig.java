package com.resource.lock.redis;

import com.resource.lock.LockConfig;

import java.util.Objects;

/**
 * Configuration for {@link RedisLock}.
 *
 * <p>The keyspace prefix scopes one lock instance to a partition of a shared
 * Redis deployment (for example {@code app:prod:locks:} next to
 * {@code app:prod:cache:}). It is prepended verbatim to every key and gets a
 * trailing {@code ':'} when it lacks one.</p>
 *
 * @param lock           polling configuration
 * @param keyspacePrefix non-blank key prefix
 */
public record RedisLockConfig(LockConfig lock, String keyspacePrefix) {

    public RedisLockConfig {
        Objects.requireNonNull(lock, "lock");
        if (keyspacePrefix == null || keyspacePrefix.isBlank()) {
            throw new IllegalArgumentException("keyspacePrefix must not be blank");
        }
        keyspacePrefix = keyspacePrefix.endsWith(":") ? keyspacePrefix : keyspacePrefix + ":";
    }

    public static RedisLockConfig withPrefix(String keyspacePrefix) {
        return new RedisLockConfig(LockConfig.defaults(), keyspacePrefix);
    }
}
