// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.correspondence;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Step counter for a search, which logs the rate of progress no more often than once
 * per log interval. The clock is consulted only every {@code logCheckSteps} steps.
 */
class SearchProgress {
    private static final Logger log = LogManager.getFormatterLogger(SearchProgress.class);
    static final int logCheckSteps = 10000;
    private final String name;
    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    SearchProgress(String name) {
        this.name = name;
    }

    SearchProgress setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    long steps() { return stepCount; }

    Stopwatch elapsed() { return stopwatch; }

    /**
     * Count one step of the search.
     * @param state describes the current search state; evaluated only if a report is due
     */
    void step(Supplier<String> state) {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress(state);
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
