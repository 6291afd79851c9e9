package me.bechberger.plumbr;

/**
 * Thrown when an instance is used after {@link Plumbr#close()}.
 */
public final class UseAfterReleaseException extends PlumbrException {

    public UseAfterReleaseException(String operation) {
        super("Cannot " + operation + ": redactor has been closed");
    }
}
