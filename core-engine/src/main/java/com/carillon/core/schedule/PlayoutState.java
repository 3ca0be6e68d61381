package com.carillon.core.schedule;

/**
 * Phase of the {@link PlayoutLoop}.
 */
public enum PlayoutState {
    /** Between ticks, sleeping until shortly before the next minute. */
    IDLE,
    /** Waiting for second 0 of the next minute. */
    SYNCING,
    /** Scanning the rule snapshot. */
    EVALUATING,
    /** Blocked on the sound player. */
    PLAYING,
    /** The loop has exited. */
    STOPPED
}
