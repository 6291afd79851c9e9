package me.bechberger.plumbr;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the log levels selected by the --debug, --verbose and --quiet flags.
 */
class LoggingConfigTest {

    private Level previous;

    @BeforeEach
    void rememberLevel() {
        previous = LoggingConfig.getLevel();
    }

    @AfterEach
    void restoreLevel() {
        LoggingConfig.setLevel(previous);
    }

    static Stream<Arguments> flagCombinations() {
        return Stream.of(
            Arguments.of(true, false, false, Level.DEBUG),
            Arguments.of(false, true, false, Level.INFO),
            Arguments.of(false, false, true, Level.ERROR),
            Arguments.of(true, true, true, Level.DEBUG),
            Arguments.of(false, true, true, Level.INFO)
        );
    }

    @ParameterizedTest
    @MethodSource("flagCombinations")
    void testFlagsSelectLevel(boolean debug, boolean verbose, boolean quiet, Level expected) {
        LoggingConfig.configure(debug, verbose, quiet);

        assertEquals(expected, LoggingConfig.getLevel());
    }

    @Test
    void testNoFlagKeepsLevel() {
        LoggingConfig.setLevel(Level.WARN);
        LoggingConfig.configure(false, false, false);

        assertEquals(Level.WARN, LoggingConfig.getLevel());
    }

    @Test
    void testCommandLineFlagIsApplied() {
        int exitCode = Main.createCommandLine().execute("validate", "--debug");

        assertEquals(0, exitCode);
        assertEquals(Level.DEBUG, LoggingConfig.getLevel());
    }
}
