package io.github.jakubt4.ithil.error;

/**
 * The metadata store could not be reached or rejected a query.
 */
public class StoreUnavailableException extends ReductionException {

    public StoreUnavailableException(final String operation, final Throwable cause) {
        super("Metadata store unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
