package com.healthtech.glucose.source;

/**
 * Transient failure reaching the reading source. Safe to retry on a later run.
 */
public class ReadingSourceException extends RuntimeException {

    public ReadingSourceException(String message) {
        super(message);
    }

    public ReadingSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
