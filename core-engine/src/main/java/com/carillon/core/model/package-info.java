/**
 * Domain model of the carillon scheduler.
 *
 * <ul>
 * <li>{@link com.carillon.core.model.ChimeRule} - immutable schedule entry</li>
 * <li>{@link com.carillon.core.model.SoundRef} - strike sentinel or named
 * sound file</li>
 * <li>{@link com.carillon.core.model.Weekday} - Sunday-first weekday
 * symbols</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.carillon.core.model;
