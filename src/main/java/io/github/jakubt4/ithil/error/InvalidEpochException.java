package io.github.jakubt4.ithil.error;

import lombok.Getter;

/**
 * Raised when an epoch expression is malformed, names an impossible calendar
 * date, or describes an inverted range.
 */
@Getter
public class InvalidEpochException extends ReductionException {

    private final String expression;

    public InvalidEpochException(final String expression, final String reason) {
        super("Invalid epoch '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidEpochException(final String expression, final String reason, final Throwable cause) {
        super("Invalid epoch '" + expression + "': " + reason, cause);
        this.expression = expression;
    }
}
