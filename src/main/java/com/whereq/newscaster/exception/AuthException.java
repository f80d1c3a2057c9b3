package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Credentials rejected by the remote service (401/403). Fatal, and most likely
 * affects every job, not just the current one.
 */
public class AuthException extends RenderJobException {
    public AuthException(String message) {
        super(ErrorKind.AUTH, message);
    }

    public AuthException(String message, Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }
}
