package com.carillon.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to. Doubles as a {@link Sleeper} that
 * advances the clock instead of waiting.
 */
final class MutableClock extends Clock implements Sleeper {

    private Instant instant;
    private int sleeps;

    MutableClock(LocalDateTime start) {
        this.instant = start.toInstant(ZoneOffset.UTC);
    }

    void set(LocalDateTime time) {
        instant = time.toInstant(ZoneOffset.UTC);
    }

    void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    int sleeps() {
        return sleeps;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps++;
        advance(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
