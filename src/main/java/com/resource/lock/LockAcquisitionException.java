package com.resource.lock;

/**
 * Runtime exception thrown by {@link Locks#withLock} when the lock cannot be
 * acquired within the timeout or the wait was cancelled.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
