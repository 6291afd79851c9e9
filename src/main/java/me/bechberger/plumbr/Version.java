package me.bechberger.plumbr;

/**
 * Version information for plumbr.
 */
public class Version {
    /**
     * The current version of plumbr
     */
    public static final String VERSION = "1.0.0";

    /**
     * The application name
     */
    public static final String APP_NAME = "plumbr";

    /**
     * Full version string
     */
    public static final String FULL_VERSION = APP_NAME + " " + VERSION;

    private Version() {
        // Utility class
    }
}
