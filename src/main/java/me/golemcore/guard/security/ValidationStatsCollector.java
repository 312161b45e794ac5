package me.golemcore.guard.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.guard.domain.model.ValidationAction;
import me.golemcore.guard.domain.model.ValidationStats;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe aggregation of validation counters and timing.
 *
 * <p>
 * Every update is a handful of {@link LongAdder} increments, so concurrent
 * validators never contend on a lock. The average is derived at snapshot time
 * from the total elapsed nanoseconds and the sample count (cumulative mean).
 * Snapshots are not linearizable with respect to concurrent updates.
 *
 * @since 1.0
 */
public class ValidationStatsCollector {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LongAdder commandsValidated = new LongAdder();
    private final LongAdder commandsBlocked = new LongAdder();
    private final LongAdder commandsWarned = new LongAdder();
    private final LongAdder filesValidated = new LongAdder();
    private final LongAdder filesBlocked = new LongAdder();
    private final LongAdder obfuscationDetected = new LongAdder();
    private final LongAdder samples = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();

    /**
     * Record one command decision.
     */
    public void recordCommand(ValidationAction action, boolean obfuscated, long elapsedNanos) {
        commandsValidated.increment();
        if (action == ValidationAction.DENY) {
            commandsBlocked.increment();
        } else if (action == ValidationAction.ASK) {
            commandsWarned.increment();
        }
        if (obfuscated) {
            obfuscationDetected.increment();
        }
        recordTiming(elapsedNanos);
    }

    /**
     * Record one file decision.
     */
    public void recordFile(ValidationAction action, long elapsedNanos) {
        filesValidated.increment();
        if (action == ValidationAction.DENY) {
            filesBlocked.increment();
        }
        recordTiming(elapsedNanos);
    }

    private void recordTiming(long elapsedNanos) {
        samples.increment();
        totalNanos.add(Math.max(0L, elapsedNanos));
    }

    public ValidationStats snapshot() {
        long sampleCount = samples.sum();
        double average = sampleCount == 0 ? 0.0 : totalNanos.sum() / NANOS_PER_MILLI / sampleCount;
        return ValidationStats.builder()
                .commandsValidated(commandsValidated.sum())
                .commandsBlocked(commandsBlocked.sum())
                .commandsWarned(commandsWarned.sum())
                .filesValidated(filesValidated.sum())
                .filesBlocked(filesBlocked.sum())
                .obfuscationDetected(obfuscationDetected.sum())
                .samples(sampleCount)
                .avgValidationTimeMs(average)
                .build();
    }

    public void reset() {
        commandsValidated.reset();
        commandsBlocked.reset();
        commandsWarned.reset();
        filesValidated.reset();
        filesBlocked.reset();
        obfuscationDetected.reset();
        samples.reset();
        totalNanos.reset();
    }
}
