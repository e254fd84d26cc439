package com.resource.lock.postgres;

/**
 * Maps a lock key to the signed 64-bit id used by Postgres advisory locks.
 * Collisions make two keys share one lock; that risk is accepted.
 */
@FunctionalInterface
public interface AdvisoryKeyHasher {

    long hash(String key);
}
