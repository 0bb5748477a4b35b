package io.github.jakubt4.ithil.config;

import io.github.jakubt4.ithil.error.InvalidConfigurationException;
import io.github.jakubt4.ithil.error.InvalidEpochException;
import io.github.jakubt4.ithil.error.InvalidRangeException;
import io.github.jakubt4.ithil.error.StageExecutionException;
import io.github.jakubt4.ithil.error.StoreUnavailableException;
import io.github.jakubt4.ithil.error.UnknownStageException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Maps a failed run to the process exit status.
 *
 * <pre>
 *   2  invalid configuration, epoch or stage range
 *   3  metadata store unavailable
 *   4  a stage failed
 *   1  anything else
 * </pre>
 */
@Component
public class ReductionExitCodes implements ExitCodeExceptionMapper {

    static final int INVALID_INPUT = 2;
    static final int STORE_UNAVAILABLE = 3;
    static final int STAGE_FAILED = 4;
    static final int UNEXPECTED = 1;

    @Override
    public int getExitCode(final Throwable exception) {
        for (var cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof InvalidConfigurationException
                    || cause instanceof InvalidEpochException
                    || cause instanceof InvalidRangeException
                    || cause instanceof UnknownStageException) {
                return INVALID_INPUT;
            }
            if (cause instanceof StoreUnavailableException) {
                return STORE_UNAVAILABLE;
            }
            if (cause instanceof StageExecutionException) {
                return STAGE_FAILED;
            }
        }
        return UNEXPECTED;
    }
}
