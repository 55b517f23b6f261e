package com.designgrowth.backend.exception;

/**
 * Raised when a read or write against the document store fails.
 * The message is the raw store error text and is returned to clients as is.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
