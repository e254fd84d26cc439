package com.resource.lock;

/**
 * Runtime exception for backend failures that are not lock contention,
 * such as SQL errors. Never used to report "lock not acquired".
 */
public class LockBackendException extends RuntimeException {

    public LockBackendException(String message) {
        super(message);
    }

    public LockBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
