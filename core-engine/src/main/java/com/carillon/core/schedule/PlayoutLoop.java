package com.carillon.core.schedule;

import com.carillon.core.matching.RuleMatcher;
import com.carillon.core.model.ChimeRule;
import com.carillon.core.sound.PlaybackException;
import com.carillon.core.sound.SoundLibrary;
import com.carillon.core.sound.SoundPlayer;
import com.carillon.core.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The minute-by-minute scheduler.
 *
 * <h3>Tick</h3>
 * <ol>
 * <li>Wait for the minute boundary ({@link ClockSync}).</li>
 * <li>Take a snapshot of the {@link RuleStore}.</li>
 * <li>For each rule in line order, ask {@link RuleMatcher} whether it is due
 * and, if so, resolve its sound and play it to completion before looking at
 * the next rule.</li>
 * <li>Sleep until shortly before the next boundary.</li>
 * </ol>
 *
 * <h3>Late playback</h3>
 * <p>
 * Nothing is queued. If the sounds of one tick run past the next minute
 * boundary, rules due in the minutes that went by are skipped. The skip is
 * logged at WARN and counted in {@link TickResult#getSkippedMinutes()}.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A rule whose sound cannot be resolved or played is reported, removed from
 * the store and skipped; the scan continues with the next rule. No rule
 * failure stops the loop. There is no timeout on {@link SoundPlayer#play}: a
 * player that hangs stalls later ticks.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #run()} is meant for one dedicated thread. {@link #stop()},
 * {@link #getState()} and listener registration may be called from any
 * thread. The store lock is never held while a sound plays.
 * </p>
 *
 * @since 1.0.0
 */
public class PlayoutLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PlayoutLoop.class);

    private final RuleStore store;
    private final ClockSync clockSync;
    private final SoundLibrary library;
    private final SoundPlayer player;

    private final List<PlayoutListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile PlayoutState state = PlayoutState.IDLE;

    /**
     * @param store     shared rule store
     * @param clockSync minute aligner
     * @param library   sound resolution
     * @param player    audio output
     * @throws NullPointerException if any argument is {@code null}
     */
    public PlayoutLoop(RuleStore store, ClockSync clockSync, SoundLibrary library,
            SoundPlayer player) {
        this.store = Objects.requireNonNull(store, "RuleStore must not be null");
        this.clockSync = Objects.requireNonNull(clockSync, "ClockSync must not be null");
        this.library = Objects.requireNonNull(library, "SoundLibrary must not be null");
        this.player = Objects.requireNonNull(player, "SoundPlayer must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Run ticks until {@link #stop()} is called or the thread is interrupted.
     */
    @Override
    public void run() {
        running.set(true);
        LOG.info("Playout loop started with {} rule(s)", store.size());
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                state = PlayoutState.SYNCING;
                LocalDateTime now = clockSync.waitForMinuteBoundary();

                runTick(now);

                state = PlayoutState.IDLE;
                clockSync.sleepUntilShortlyBeforeNextMinute();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Playout loop interrupted");
        } finally {
            running.set(false);
            state = PlayoutState.STOPPED;
            LOG.info("Playout loop stopped");
        }
    }

    /**
     * Ask the loop to exit once the current tick is over.
     */
    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public PlayoutState getState() {
        return state;
    }

    public void addListener(PlayoutListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------

    /**
     * Evaluate and play every rule due at {@code now}.
     *
     * @param now the minute being played
     * @return what was played, which rules failed and whether the tick ran
     *         past the next minute
     * @throws InterruptedException if the thread is interrupted during
     *                              playback
     */
    public TickResult runTick(LocalDateTime now) throws InterruptedException {
        Objects.requireNonNull(now, "Timestamp must not be null");
        state = PlayoutState.EVALUATING;

        List<ChimeRule> rules = store.snapshot();
        List<Path> played = new ArrayList<>();
        List<PlayoutFault> faults = new ArrayList<>();

        for (int i = 0; i < rules.size(); i++) {
            ChimeRule rule = rules.get(i);
            int position = i + 1;
            if (!RuleMatcher.isDue(rule, now)) {
                continue;
            }
            try {
                Path file = library.resolve(rule.getSound(), now);
                LOG.debug("Line {} due at {}: playing {}", position, now, file);
                state = PlayoutState.PLAYING;
                player.play(file);
                played.add(file);
            } catch (PlaybackException e) {
                faults.add(heal(position, rule, now, e));
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure evaluating line {}", position, e);
                faults.add(heal(position, rule, now, e));
            } finally {
                state = PlayoutState.EVALUATING;
            }
        }

        TickResult result = new TickResult(now, clockSync.now(), rules.size(), played, faults);
        if (result.getSkippedMinutes() > 0) {
            LOG.warn("Playout for {} ran until {}; {} minute(s) skipped, rules due then will not play",
                    now, result.getFinishedAt(), result.getSkippedMinutes());
        }
        LOG.debug("Tick finished: {}", result);
        return result;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PlayoutFault heal(int position, ChimeRule rule, LocalDateTime now, Exception cause) {
        boolean removed = store.removeFaulted(position, rule);
        PlayoutFault fault = new PlayoutFault(position, rule, now, cause, removed);
        if (removed) {
            LOG.error("Line {} could not be played and was removed: {} ({})",
                    position, rule, cause.getMessage());
        } else {
            LOG.warn("Line {} could not be played and was already gone from the schedule: {} ({})",
                    position, rule, cause.getMessage());
        }
        for (PlayoutListener listener : listeners) {
            try {
                listener.onRuleRemoved(fault);
            } catch (RuntimeException e) {
                LOG.warn("Playout listener {} failed", listener, e);
            }
        }
        return fault;
    }
}
