package com.resource.lock.redis;

import java.util.List;

/**
 * The Redis operations the lock needs. Implementations propagate transport
 * failures as unchecked exceptions.
 */
public interface RedisClient {

    /**
     * {@code SET key value NX PX ttlMs}.
     *
     * @return true if the key was set, false if it already existed
     */
    boolean setIfAbsent(String key, String value, long ttlMs);

    /**
     * Runs a Lua script atomically on the server.
     *
     * @return the script's reply as decoded by the driver
     */
    Object eval(String script, List<String> keys, List<String> args);
}
