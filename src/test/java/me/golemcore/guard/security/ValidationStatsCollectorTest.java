package me.golemcore.guard.security;

import me.golemcore.guard.domain.model.ValidationAction;
import me.golemcore.guard.domain.model.ValidationStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationStatsCollectorTest {

    private ValidationStatsCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ValidationStatsCollector();
    }

    @Test
    void shouldStartEmpty() {
        assertEquals(ValidationStats.empty(), collector.snapshot());
    }

    @Test
    void shouldCountCommandOutcomes() {
        collector.recordCommand(ValidationAction.ALLOW, false, 1_000_000);
        collector.recordCommand(ValidationAction.DENY, true, 3_000_000);
        collector.recordCommand(ValidationAction.ASK, false, 2_000_000);

        ValidationStats stats = collector.snapshot();
        assertEquals(3, stats.getCommandsValidated());
        assertEquals(1, stats.getCommandsBlocked());
        assertEquals(1, stats.getCommandsWarned());
        assertEquals(1, stats.getObfuscationDetected());
        assertEquals(2.0, stats.getAvgValidationTimeMs(), 1e-9);
    }

    @Test
    void shouldCountFileOutcomes() {
        collector.recordFile(ValidationAction.DENY, 500_000);
        collector.recordFile(ValidationAction.ALLOW, 1_500_000);

        ValidationStats stats = collector.snapshot();
        assertEquals(2, stats.getFilesValidated());
        assertEquals(1, stats.getFilesBlocked());
        assertEquals(2, stats.getSamples());
        assertEquals(1.0, stats.getAvgValidationTimeMs(), 1e-9);
    }

    @Test
    void shouldClampNegativeDurations() {
        collector.recordCommand(ValidationAction.ALLOW, false, -5);

        assertEquals(0.0, collector.snapshot().getAvgValidationTimeMs(), 0.0);
    }

    @Test
    void shouldResetEverything() {
        collector.recordCommand(ValidationAction.DENY, true, 1_000);
        collector.recordFile(ValidationAction.DENY, 1_000);

        collector.reset();

        assertEquals(ValidationStats.empty(), collector.snapshot());
    }

    @Test
    void shouldNotLoseUpdatesUnderConcurrency() throws Exception {
        int threads = 8;
        int perThread = 5_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        collector.recordCommand(i % 2 == 0 ? ValidationAction.DENY : ValidationAction.ALLOW,
                                false, 10);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        ValidationStats stats = collector.snapshot();
        assertEquals((long) threads * perThread, stats.getCommandsValidated());
        assertEquals((long) threads * perThread / 2, stats.getCommandsBlocked());
        assertTrue(stats.getAvgValidationTimeMs() > 0.0);
    }
}
