package com.carillon.core.schedule;

/**
 * Receives runtime diagnostics from the {@link PlayoutLoop}.
 *
 * <p>
 * Called on the playout thread. Implementations must not block for long;
 * exceptions they throw are logged and ignored.
 * </p>
 */
@FunctionalInterface
public interface PlayoutListener {

    /**
     * A rule could not be played and was taken out of the schedule.
     *
     * @param fault what failed and where
     */
    void onRuleRemoved(PlayoutFault fault);
}
