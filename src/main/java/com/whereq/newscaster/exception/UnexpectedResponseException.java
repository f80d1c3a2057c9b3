package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Successful HTTP status with a body that cannot be used, e.g. no job id
 */
public class UnexpectedResponseException extends RenderJobException {
    public UnexpectedResponseException(String message) {
        super(ErrorKind.UNEXPECTED_RESPONSE, message);
    }

    public UnexpectedResponseException(String message, Throwable cause) {
        super(ErrorKind.UNEXPECTED_RESPONSE, message, cause);
    }
}
