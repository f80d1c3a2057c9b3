package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Timeout, connection failure, throttling or 5xx. Retryable by the caller.
 */
public class TransientNetworkException extends RenderJobException {
    public TransientNetworkException(String message) {
        super(ErrorKind.TRANSIENT_NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, message, cause);
    }
}
