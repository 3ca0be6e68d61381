package com.carillon.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Aligns the playout thread to the start of each wall-clock minute.
 *
 * <p>
 * The clock is polled at a bounded interval rather than in a tight loop.
 * A boundary is reported at most once: after returning minute {@code m},
 * {@link #waitForMinuteBoundary()} waits for a later minute even if second 0
 * of {@code m} is still in progress.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; owned by the single playout thread.
 * </p>
 *
 * @since 1.0.0
 */
public class ClockSync {

    private static final Logger LOG = LoggerFactory.getLogger(ClockSync.class);

    /** Upper bound on the poll interval. */
    public static final Duration MAX_POLL_INTERVAL = Duration.ofMillis(500);

    /** How far ahead of the next boundary the loop wakes up. */
    static final Duration WAKE_MARGIN = Duration.ofSeconds(1);

    private final Clock clock;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    private LocalDateTime lastBoundary;

    /**
     * @param clock        wall clock, in the zone chimes follow
     * @param pollInterval time between clock reads while waiting; must be in
     *                     (0, {@link #MAX_POLL_INTERVAL}]
     * @param sleeper      pause implementation
     * @throws IllegalArgumentException if {@code pollInterval} is out of range
     */
    public ClockSync(Clock clock, Duration pollInterval, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()
                || pollInterval.compareTo(MAX_POLL_INTERVAL) > 0) {
            throw new IllegalArgumentException(
                    "Poll interval must be in (0, " + MAX_POLL_INTERVAL.toMillis() + "] ms, got: "
                            + pollInterval.toMillis() + " ms");
        }
    }

    /**
     * Block until the clock's second field is 0 in a minute not yet reported.
     *
     * @return the minute that just began, truncated to the minute
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public LocalDateTime waitForMinuteBoundary() throws InterruptedException {
        while (true) {
            LocalDateTime now = now();
            if (now.getSecond() == 0) {
                LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
                if (!minute.equals(lastBoundary)) {
                    lastBoundary = minute;
                    LOG.trace("Minute boundary {}", minute);
                    return minute;
                }
            }
            sleeper.sleep(pollInterval);
        }
    }

    /**
     * Time left until {@link #WAKE_MARGIN} before the next minute boundary,
     * never negative.
     *
     * @return sleep duration for the idle part of the minute
     */
    public Duration untilShortlyBeforeNextMinute() {
        LocalDateTime now = now();
        LocalDateTime next = now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        Duration remaining = Duration.between(now, next).minus(WAKE_MARGIN);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Pause for {@link #untilShortlyBeforeNextMinute()}.
     *
     * @throws InterruptedException if the thread is interrupted while paused
     */
    public void sleepUntilShortlyBeforeNextMinute() throws InterruptedException {
        Duration idle = untilShortlyBeforeNextMinute();
        if (!idle.isZero()) {
            sleeper.sleep(idle);
        }
    }

    /**
     * @return current wall-clock time
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
