package io.github.jakubt4.ithil.error;

import lombok.Getter;

/**
 * Raised for a stage range that is inverted or malformed, or that skips a
 * prerequisite stage while prerequisite enforcement is on.
 */
@Getter
public class InvalidRangeException extends ReductionException {

    private final String rangeSpec;

    public InvalidRangeException(final String rangeSpec, final String reason) {
        super("Invalid stage range '" + rangeSpec + "': " + reason);
        this.rangeSpec = rangeSpec;
    }
}
