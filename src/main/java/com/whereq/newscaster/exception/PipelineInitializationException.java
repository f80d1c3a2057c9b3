package com.whereq.newscaster.exception;

/**
 * Infrastructure fault that prevents a whole batch from running
 */
public class PipelineInitializationException extends RuntimeException {
    public PipelineInitializationException(String message) {
        super(message);
    }

    public PipelineInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
