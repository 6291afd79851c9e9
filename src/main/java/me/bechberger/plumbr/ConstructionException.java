package me.bechberger.plumbr;

/**
 * Thrown when an instance cannot be set up for reasons other than its pattern sources,
 * e.g. an invalid thread count or a broken built-in pattern table.
 */
public final class ConstructionException extends PlumbrException {

    public ConstructionException(String message) {
        super("Cannot create redactor: " + message);
    }

    public ConstructionException(String message, Throwable cause) {
        super("Cannot create redactor: " + message, cause);
    }
}
