package me.bechberger.plumbr;

import me.bechberger.plumbr.config.RedactorConfig;
import me.bechberger.plumbr.engine.StatsSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many callers sharing one instance.
 */
class PlumbrConcurrencyTest {

    private static final int CALLERS = 8;
    private static final int ROUNDS = 50;

    @Test
    void concurrentCallersGetCorrectResultsAndExactTotals() throws Exception {
        RedactorConfig config = new RedactorConfig();
        config.setNumThreads(4);
        List<String> batch = List.of("password=pw1", "clean", "mail me@example.com", "");

        ExecutorService callers = Executors.newFixedThreadPool(CALLERS);
        try (Plumbr plumbr = Plumbr.create(config)) {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int c = 0; c < CALLERS; c++) {
                tasks.add(() -> {
                    for (int r = 0; r < ROUNDS; r++) {
                        if (!"password=[REDACTED:password]".equals(plumbr.redact("password=pw1"))) {
                            return false;
                        }
                        List<String> out = plumbr.redactLines(batch);
                        if (!out.get(2).equals("mail [REDACTED:email]") || !out.get(1).equals("clean")) {
                            return false;
                        }
                        StatsSnapshot snapshot = plumbr.getStats();
                        if (snapshot.linesModified() > snapshot.linesProcessed()) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> result : callers.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }

            StatsSnapshot stats = plumbr.getStats();
            long calls = (long) CALLERS * ROUNDS;
            assertThat(stats.linesProcessed()).isEqualTo(calls * 5);
            assertThat(stats.linesModified()).isEqualTo(calls * 3);
            assertThat(stats.patternsMatched()).isEqualTo(calls * 3);
            assertThat(stats.categoryMatches()).containsEntry("password", calls * 2).containsEntry("email", calls);
        } finally {
            callers.shutdownNow();
        }
    }
}
