package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Malformed submission. Fatal, never retried.
 */
public class ValidationException extends RenderJobException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
