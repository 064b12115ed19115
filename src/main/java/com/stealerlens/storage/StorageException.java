package com.stealerlens.storage;

/**
 * Raised by a storage collaborator when a record cannot be persisted.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
