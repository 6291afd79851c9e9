package me.bechberger.plumbr;

/**
 * Base exception for all failures of a {@link Plumbr} instance at runtime.
 * <p>
 * Sealed so callers can handle every case. Problems with pattern sources are reported
 * separately as the checked {@link PatternLoadException}.
 */
public sealed class PlumbrException extends RuntimeException
    permits ConstructionException, RedactionException, UseAfterReleaseException {

    public PlumbrException(String message) {
        super(message);
    }

    public PlumbrException(String message, Throwable cause) {
        super(message, cause);
    }
}
