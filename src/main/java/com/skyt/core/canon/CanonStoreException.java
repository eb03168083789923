package com.skyt.core.canon;

/**
 * Base of the failures the Canon Store surfaces to its callers. Everything else
 * the engine encounters is absorbed as a value.
 */
public class CanonStoreException extends Exception {

    public CanonStoreException(String message) {
        super(message);
    }

    public CanonStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
