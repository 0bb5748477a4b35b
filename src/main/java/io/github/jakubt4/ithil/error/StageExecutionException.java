package io.github.jakubt4.ithil.error;

import lombok.Getter;

/**
 * Wraps whatever a stage processor threw, tagged with the stage name. Stages
 * that already completed in the same run are left as they are.
 */
@Getter
public class StageExecutionException extends ReductionException {

    private final String stageName;

    public StageExecutionException(final String stageName, final Throwable cause) {
        super("Stage [" + stageName + "] failed: " + cause.getMessage(), cause);
        this.stageName = stageName;
    }
}
