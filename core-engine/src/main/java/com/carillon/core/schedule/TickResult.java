package com.carillon.core.schedule;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one playout tick: what was played, in order, what failed, and
 * when playback finished.
 */
public final class TickResult {

    private final LocalDateTime tick;
    private final LocalDateTime finishedAt;
    private final int evaluated;
    private final List<Path> played;
    private final List<PlayoutFault> faults;

    TickResult(LocalDateTime tick, LocalDateTime finishedAt, int evaluated, List<Path> played,
            List<PlayoutFault> faults) {
        this.tick = tick;
        this.finishedAt = finishedAt;
        this.evaluated = evaluated;
        this.played = Collections.unmodifiableList(new ArrayList<>(played));
        this.faults = Collections.unmodifiableList(new ArrayList<>(faults));
    }

    public LocalDateTime getTick() {
        return tick;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    /**
     * Minute boundaries that went by while this tick was playing. Rules due
     * at those minutes are not played.
     *
     * @return 0 when the tick finished within its own minute
     */
    public long getSkippedMinutes() {
        return Math.max(0, ChronoUnit.MINUTES.between(tick, finishedAt.truncatedTo(ChronoUnit.MINUTES)));
    }

    /** Number of rules in the snapshot that was scanned. */
    public int getEvaluated() {
        return evaluated;
    }

    public List<Path> getPlayed() {
        return played;
    }

    public List<PlayoutFault> getFaults() {
        return faults;
    }

    @Override
    public String toString() {
        return "TickResult{tick=" + tick + ", evaluated=" + evaluated
                + ", played=" + played.size() + ", faults=" + faults.size()
                + ", skippedMinutes=" + getSkippedMinutes() + '}';
    }
}
