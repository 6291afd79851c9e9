package me.bechberger.plumbr;

import me.bechberger.plumbr.config.RedactorConfig;
import me.bechberger.plumbr.engine.BatchEngine;
import me.bechberger.plumbr.engine.PatternRegistry;
import me.bechberger.plumbr.engine.PatternSet;
import me.bechberger.plumbr.engine.RedactionStats;
import me.bechberger.plumbr.engine.StatsSnapshot;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A redactor instance: compiled patterns, a worker pool and cumulative statistics.
 * <p>
 * Typical use:
 * <pre>{@code
 * try (Plumbr plumbr = Plumbr.create()) {
 *     String safe = plumbr.redact("password=secret123");  // password=[REDACTED:password]
 * }
 * }</pre>
 * All redaction methods are thread-safe and may be called concurrently. Once
 * {@link #close()} has been called every method except {@code close} and
 * {@link #isReleased()} throws {@link UseAfterReleaseException}.
 */
public class Plumbr implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Plumbr.class);

    private final RedactorConfig config;
    private final PatternSet patterns;
    private final RedactionStats stats = new RedactionStats();
    private final BatchEngine engine;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Plumbr(RedactorConfig config, PatternSet patterns, BatchEngine engine) {
        this.config = config;
        this.patterns = patterns;
        this.engine = engine;
    }

    /**
     * Create an instance with the built-in patterns and default settings.
     */
    public static Plumbr create() throws PatternLoadException {
        return create(null);
    }

    /**
     * Create an instance. The configuration is copied, later changes to it have no effect.
     *
     * @param config configuration, {@code null} for the defaults
     * @throws PatternLoadException  if a pattern source is missing or unparsable, or a
     *                               compliance profile is unknown
     * @throws ConstructionException if the thread count is invalid or the workers cannot be started
     */
    public static Plumbr create(@Nullable RedactorConfig config) throws PatternLoadException {
        RedactorConfig own = config == null ? new RedactorConfig() : config.copy();
        // reject a bad thread count before any pattern file is read
        BatchEngine.resolveThreadCount(own.getNumThreads());
        PatternSet patterns = PatternRegistry.build(own);
        BatchEngine engine = new BatchEngine(patterns, own.getNumThreads());
        logger.debug("Created redactor with {} patterns and {} thread(s)", patterns.size(), engine.getThreadCount());
        return new Plumbr(own, patterns, engine);
    }

    /**
     * Redact a single piece of text. Embedded newlines are not treated specially, the whole
     * text counts as one line.
     *
     * @return the redacted text, the same instance if nothing was found
     */
    public String redact(String text) {
        Objects.requireNonNull(text, "text");
        checkNotReleased("redact");
        return engine.redactText(text, stats);
    }

    /**
     * Redact UTF-8 encoded text. Malformed input is decoded with replacement characters.
     */
    public byte[] redact(byte[] utf8) {
        Objects.requireNonNull(utf8, "utf8");
        checkNotReleased("redact");
        if (utf8.length == 0) {
            return utf8;
        }
        String text = new String(utf8, StandardCharsets.UTF_8);
        String redacted = engine.redactText(text, stats);
        return redacted == text ? utf8 : redacted.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Redact a newline separated buffer, lines are processed in parallel.
     * A trailing newline is preserved.
     */
    public String redactBulk(String text) {
        Objects.requireNonNull(text, "text");
        checkNotReleased("redactBulk");
        return engine.redactBulk(text, stats);
    }

    /**
     * Redact lines in parallel. The result has the same size and order as the input.
     */
    public List<String> redactLines(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        checkNotReleased("redactLines");
        return engine.redactLines(lines, stats);
    }

    /**
     * Number of active patterns, constant for the lifetime of the instance.
     */
    public int patternCount() {
        checkNotReleased("patternCount");
        return patterns.size();
    }

    public PatternSet getPatterns() {
        checkNotReleased("getPatterns");
        return patterns;
    }

    public StatsSnapshot getStats() {
        checkNotReleased("getStats");
        return stats.snapshot();
    }

    /**
     * A copy of the configuration the instance was created with.
     */
    public RedactorConfig getConfig() {
        return config.copy();
    }

    public int getThreadCount() {
        return engine.getThreadCount();
    }

    public static String version() {
        return Version.VERSION;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Stop the worker threads. Calling this more than once has no effect.
     */
    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        engine.close();
        if (!config.isQuiet()) {
            logger.info("Redactor closed: {}", stats);
        }
    }

    private void checkNotReleased(String operation) {
        if (released.get()) {
            throw new UseAfterReleaseException(operation);
        }
    }
}
