package com.carillon.core.config;

import com.carillon.core.editor.RuleParser;
import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.RuleValidationException;

/**
 * One rule entry of the startup YAML, in the same notation the operator
 * types.
 *
 * <pre>
 * - days: su-sa
 *   hours: 0-23
 *   minute: 15
 *   sound: Quarter
 * </pre>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    // Scalars are kept as parsed by YAML (a bare 9 is an Integer) and read
    // back as text.

    /** {@code mm/dd/yy}, a weekday symbol, or a weekday range. */
    private Object days;

    /** An hour or an hour range. */
    private Object hours;

    private Integer minute;

    /** File name or {@code Strike}. */
    private Object sound;

    /**
     * Convert to a rule using the operator input rules.
     *
     * @return the rule
     * @throws RuleValidationException if a field is missing or malformed
     */
    public ChimeRule toRule() throws RuleValidationException {
        String daysText = text(days);
        String hoursText = text(hours);
        if (daysText == null || daysText.isBlank()) {
            throw new RuleValidationException("days", "'days' is required");
        }
        if (hoursText == null || hoursText.isBlank()) {
            throw new RuleValidationException("hours", "'hours' is required");
        }
        if (minute == null) {
            throw new RuleValidationException("minute", "'minute' is required");
        }
        ChimeRule.Builder builder = ChimeRule.builder();
        RuleParser.parseDays(daysText, builder);
        RuleParser.parseHours(hoursText, builder);
        return builder
                .minute(RuleParser.parseMinute(Integer.toString(minute)))
                .sound(RuleParser.parseSound(text(sound)))
                .build();
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public Object getDays() {
        return days;
    }

    public void setDays(Object days) {
        this.days = days;
    }

    public Object getHours() {
        return hours;
    }

    public void setHours(Object hours) {
        this.hours = hours;
    }

    public Integer getMinute() {
        return minute;
    }

    public void setMinute(Integer minute) {
        this.minute = minute;
    }

    public Object getSound() {
        return sound;
    }

    public void setSound(Object sound) {
        this.sound = sound;
    }

    @Override
    public String toString() {
        return days + " " + hours + " " + minute + " " + sound;
    }
}
