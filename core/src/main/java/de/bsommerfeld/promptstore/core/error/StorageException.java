package de.bsommerfeld.promptstore.core.error;

/**
 * Base of every condition that aborts a storage operation.
 * Expected no-op outcomes are returned as results, never thrown.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
