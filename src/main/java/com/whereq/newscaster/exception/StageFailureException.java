package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Synchronous stage could not produce its output (collaborator error, missing input)
 */
public class StageFailureException extends RenderJobException {
    public StageFailureException(String stage, String message) {
        super(ErrorKind.STAGE_FAILURE, message);
        withStage(stage);
    }

    public StageFailureException(String stage, String message, Throwable cause) {
        super(ErrorKind.STAGE_FAILURE, message, cause);
        withStage(stage);
    }
}
