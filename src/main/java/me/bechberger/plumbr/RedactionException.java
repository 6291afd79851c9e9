package me.bechberger.plumbr;

/**
 * Thrown when a redaction call cannot complete. No partial output is returned.
 */
public final class RedactionException extends PlumbrException {

    public RedactionException(String message) {
        super("Redaction failed: " + message);
    }

    public RedactionException(String message, Throwable cause) {
        super("Redaction failed: " + message, cause);
    }
}
