package com.designgrowth.backend.exception;

/**
 * The store could not be reached at all (no server selected, socket failure, timeout).
 */
public class StoreUnavailableException extends DocumentStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
