package io.proxygate.storage;

/**
 * The credential store could not be read or written. Always retryable: callers must not advance
 * credential state when this is thrown.
 */
public class StoreIoException extends RuntimeException {
    public StoreIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
