package com.whereq.newscaster.exception;

/**
 * Job record store could not read or write a record
 */
public class JobStoreException extends RuntimeException {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
