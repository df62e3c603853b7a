package com.healthtech.glucose.storage;

/**
 * Failure writing to or reading from the aggregate store.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
