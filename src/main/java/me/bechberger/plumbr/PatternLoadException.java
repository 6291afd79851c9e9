package me.bechberger.plumbr;

/**
 * A pattern source named in the configuration is missing, unreadable or unparsable,
 * or the configuration selects an unknown compliance profile.
 */
public class PatternLoadException extends ConfigLoader.ConfigurationException {

    public PatternLoadException(String message) {
        super(message);
    }

    public PatternLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
