package io.github.jakubt4.ithil.stage;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by a stage processor that could not complete. When the stage isolated
 * failures per unit of work, {@link #getFailedUnits()} names them.
 */
@Getter
public class StageFailedException extends Exception {

    private final String stageName;
    private final List<String> failedUnits;

    public StageFailedException(final String stageName, final List<String> failedUnits) {
        super(failedUnits.size() + " unit(s) of stage [" + stageName + "] failed: " + failedUnits);
        this.stageName = stageName;
        this.failedUnits = List.copyOf(failedUnits);
    }

    public StageFailedException(final String stageName, final String message, final Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
        this.failedUnits = List.of();
    }
}
