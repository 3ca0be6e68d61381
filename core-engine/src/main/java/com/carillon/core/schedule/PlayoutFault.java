package com.carillon.core.schedule;

import com.carillon.core.model.ChimeRule;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A rule that failed at playout time and was removed from the schedule.
 *
 * @since 1.0.0
 */
public final class PlayoutFault {

    private final int position;
    private final ChimeRule rule;
    private final LocalDateTime tick;
    private final Exception cause;
    private final boolean removed;

    /**
     * @param position 1-based line of the rule in the evaluated snapshot
     * @param rule     the failing rule
     * @param tick     minute being played
     * @param cause    what went wrong
     * @param removed  whether the rule was still in the store and got removed
     */
    public PlayoutFault(int position, ChimeRule rule, LocalDateTime tick, Exception cause,
            boolean removed) {
        this.position = position;
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
        this.removed = removed;
    }

    public int getPosition() {
        return position;
    }

    public ChimeRule getRule() {
        return rule;
    }

    public LocalDateTime getTick() {
        return tick;
    }

    public Exception getCause() {
        return cause;
    }

    public boolean isRemoved() {
        return removed;
    }

    @Override
    public String toString() {
        return "PlayoutFault{" +
                "position=" + position +
                ", rule=" + rule +
                ", tick=" + tick +
                ", cause=" + cause.getMessage() +
                ", removed=" + removed +
                '}';
    }
}
