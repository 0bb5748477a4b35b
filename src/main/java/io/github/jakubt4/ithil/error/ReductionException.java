package io.github.jakubt4.ithil.error;

/**
 * Base type for failures detected by the reduction orchestrator. None of them
 * are retried; a run stops at the first one.
 */
public class ReductionException extends RuntimeException {

    public ReductionException(final String message) {
        super(message);
    }

    public ReductionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
