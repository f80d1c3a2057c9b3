package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Artifact exists remotely but could not be copied to our storage
 */
public class RehostException extends RenderJobException {
    public RehostException(String message) {
        super(ErrorKind.REHOST_FAILURE, message);
    }

    public RehostException(String message, Throwable cause) {
        super(ErrorKind.REHOST_FAILURE, message, cause);
    }
}
