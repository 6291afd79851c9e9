package me.bechberger.plumbr.engine;

import me.bechberger.plumbr.ConstructionException;
import me.bechberger.plumbr.RedactionException;
import me.bechberger.plumbr.util.Utf8;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redacts many lines at once by spreading them over a fixed pool of worker threads.
 * <p>
 * Lines are split into contiguous groups of about equal UTF-8 size, one group per
 * worker. Every worker writes its output into the slot of the input line, so output
 * order always equals input order. Each worker counts into its own {@link StatsDelta};
 * the deltas are folded into the shared {@link RedactionStats} once all workers are done.
 */
public class BatchEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchEngine.class);

    /** Upper bound for the automatically chosen worker count */
    public static final int MAX_AUTO_THREADS = 12;

    private static final AtomicInteger WORKER_IDS = new AtomicInteger(0);

    private final LineRedactor redactor;
    private final int threadCount;
    @Nullable
    private final ExecutorService executor;

    /**
     * @param patterns   active pattern set
     * @param numThreads worker count, 0 = number of processors (at most {@link #MAX_AUTO_THREADS})
     * @throws ConstructionException if the thread count is negative or the pool cannot be started
     */
    public BatchEngine(PatternSet patterns, int numThreads) {
        this.redactor = new LineRedactor(patterns);
        this.threadCount = resolveThreadCount(numThreads);
        this.executor = threadCount > 1 ? startPool(threadCount) : null;
        logger.debug("Batch engine ready with {} worker thread(s)", threadCount);
    }

    public static int resolveThreadCount(int requested) {
        if (requested < 0) {
            throw new ConstructionException("num_threads must be >= 0, got " + requested);
        }
        if (requested == 0) {
            return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_AUTO_THREADS));
        }
        return requested;
    }

    private static ExecutorService startPool(int threads) {
        ThreadFactory factory = r -> {
            Thread thread = new Thread(r, "plumbr-worker-" + WORKER_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        try {
            return Executors.newFixedThreadPool(threads, factory);
        } catch (IllegalArgumentException | SecurityException e) {
            throw new ConstructionException("cannot start " + threads + " worker threads", e);
        }
    }

    public int getThreadCount() {
        return threadCount;
    }

    public LineRedactor getRedactor() {
        return redactor;
    }

    /**
     * Redact one unit of text on the calling thread. Embedded newlines do not split it,
     * it counts as a single line.
     */
    public String redactText(String text, RedactionStats stats) {
        if (text.isEmpty()) {
            return text;
        }
        long started = System.nanoTime();
        RedactionResult result = redactor.redact(text);
        StatsDelta delta = new StatsDelta();
        delta.record(result, Utf8.encodedLength(text), redactor.getPatterns());
        stats.record(delta);
        stats.recordElapsed(System.nanoTime() - started);
        return result.text();
    }

    /**
     * Redact each line independently, output line i belongs to input line i.
     */
    public List<String> redactLines(List<String> lines, RedactionStats stats) {
        if (lines.isEmpty()) {
            return List.of();
        }
        long started = System.nanoTime();
        String[] output = new String[lines.size()];
        StatsDelta total = run(lines, output);
        stats.record(total);
        stats.recordElapsed(System.nanoTime() - started);
        return List.of(output);
    }

    /**
     * Redact a newline separated buffer. Lines are split on {@code '\n'} only; a trailing
     * newline is kept and does not start another line.
     */
    public String redactBulk(String text, RedactionStats stats) {
        if (text.isEmpty()) {
            return text;
        }
        long started = System.nanoTime();
        boolean trailingNewline = text.charAt(text.length() - 1) == '\n';
        List<String> lines = splitLines(text);
        String[] output = new String[lines.size()];
        StatsDelta total = run(lines, output);
        // the separators are part of the input size
        total.bytes += trailingNewline ? lines.size() : lines.size() - 1;

        StringBuilder joined = new StringBuilder(text.length() + 64);
        for (int i = 0; i < output.length; i++) {
            if (i > 0) {
                joined.append('\n');
            }
            joined.append(output[i]);
        }
        if (trailingNewline) {
            joined.append('\n');
        }
        stats.record(total);
        stats.recordElapsed(System.nanoTime() - started);
        return total.linesModified == 0 ? text : joined.toString();
    }

    /**
     * Split on {@code '\n'}, dropping the empty remainder after a final newline.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = text.length();
        while (start < length) {
            int newline = text.indexOf('\n', start);
            if (newline < 0) {
                lines.add(text.substring(start));
                return lines;
            }
            lines.add(text.substring(start, newline));
            start = newline + 1;
        }
        return lines;
    }

    /**
     * Cut {@code weights} into {@code groups} non-empty contiguous ranges of about equal weight.
     *
     * @return group boundaries, group g covers {@code [bounds[g], bounds[g + 1])}
     */
    static int[] partition(long[] weights, int groups) {
        int n = weights.length;
        if (groups < 1 || groups > n) {
            throw new IllegalArgumentException("Cannot split " + n + " lines into " + groups + " groups");
        }
        long total = 0;
        for (long weight : weights) {
            total += weight;
        }
        int[] bounds = new int[groups + 1];
        long cumulative = 0;
        int index = 0;
        for (int g = 1; g < groups; g++) {
            long target = total * g / groups;
            // every later group needs at least one line
            int maxIndex = n - (groups - g);
            int minIndex = bounds[g - 1] + 1;
            while (index < maxIndex && (index < minIndex || cumulative + weights[index] <= target)) {
                cumulative += weights[index];
                index++;
            }
            bounds[g] = index;
        }
        bounds[groups] = n;
        return bounds;
    }

    private StatsDelta run(List<String> lines, String[] output) {
        int n = lines.size();
        long[] lineBytes = new long[n];
        for (int i = 0; i < n; i++) {
            String line = lines.get(i);
            if (line == null) {
                throw new NullPointerException("Line " + i + " is null");
            }
            lineBytes[i] = Utf8.encodedLength(line);
        }

        int groups = Math.min(threadCount, n);
        if (groups <= 1 || executor == null) {
            try {
                return redactRange(lines, lineBytes, output, 0, n);
            } catch (RuntimeException e) {
                throw new RedactionException(e.getMessage(), e);
            }
        }

        // +1 so empty lines still carry weight
        long[] weights = new long[n];
        for (int i = 0; i < n; i++) {
            weights[i] = lineBytes[i] + 1;
        }
        int[] bounds = partition(weights, groups);
        List<Future<StatsDelta>> futures = new ArrayList<>(groups);
        try {
            for (int g = 0; g < groups; g++) {
                int from = bounds[g];
                int to = bounds[g + 1];
                futures.add(executor.submit(() -> redactRange(lines, lineBytes, output, from, to)));
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new RedactionException("worker pool is shut down", e);
        }
        return collect(futures);
    }

    private StatsDelta collect(List<Future<StatsDelta>> futures) {
        StatsDelta total = new StatsDelta();
        Throwable failure = null;
        for (Future<StatsDelta> future : futures) {
            try {
                total.add(future.get());
            } catch (ExecutionException e) {
                // keep waiting, no worker may still write into the output after we return
                if (failure == null) {
                    failure = e.getCause();
                } else {
                    failure.addSuppressed(e.getCause());
                }
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new RedactionException("interrupted while waiting for workers", e);
            }
        }
        if (failure != null) {
            throw new RedactionException("worker failed: " + failure.getMessage(), failure);
        }
        return total;
    }

    private StatsDelta redactRange(List<String> lines, long[] lineBytes, String[] output, int from, int to) {
        StatsDelta delta = new StatsDelta();
        PatternSet patterns = redactor.getPatterns();
        for (int i = from; i < to; i++) {
            RedactionResult result = redactor.redact(lines.get(i));
            output[i] = result.text();
            delta.record(result, lineBytes[i], patterns);
        }
        return delta;
    }

    /**
     * Stop the worker pool and wait for running calls to finish.
     */
    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Worker threads did not stop within 30 seconds, interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
