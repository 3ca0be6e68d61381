/**
 * Minute-aligned playout scheduling.
 *
 * <p>
 * {@link com.carillon.core.schedule.PlayoutLoop} runs on its own thread,
 * synchronised to the wall clock by
 * {@link com.carillon.core.schedule.ClockSync}, and reports removed rules to
 * {@link com.carillon.core.schedule.PlayoutListener}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.carillon.core.schedule;
