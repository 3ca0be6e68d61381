package com.carillon.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One scheduled playout directive: when a sound plays and which sound.
 *
 * <p>
 * A rule either fires on one exact calendar date ({@link #getFixedDate()}) or
 * recurs on an inclusive weekday range. In both cases it also carries an
 * inclusive hour range and an exact minute. When a fixed date is set, both
 * weekday fields hold {@link #DISABLED_WEEKDAY} so the rule can never match as
 * a recurring rule.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Field ranges are checked at
 * {@link Builder#build()} time; an invalid combination throws
 * {@link IllegalArgumentException}. Instances are immutable: an edit replaces
 * the rule at its position with a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChimeRule {

    /** Weekday sentinel of a fixed-date rule; outside 0..6 so it never matches. */
    public static final int DISABLED_WEEKDAY = 8;

    public static final int MAX_HOUR = 23;
    public static final int MAX_MINUTE = 59;

    private final LocalDate fixedDate;
    private final int startWeekday;
    private final int endWeekday;
    private final int startHour;
    private final int endHour;
    private final int minute;
    private final SoundRef sound;

    private ChimeRule(Builder builder) {
        this.fixedDate = builder.fixedDate;
        this.startWeekday = fixedDate != null ? DISABLED_WEEKDAY : builder.startWeekday;
        this.endWeekday = fixedDate != null ? DISABLED_WEEKDAY : builder.endWeekday;
        this.startHour = builder.startHour;
        this.endHour = builder.endHour;
        this.minute = builder.minute;
        this.sound = builder.sound;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ChimeRule} instances.
     *
     * <p>
     * Exactly one of {@link #fixedDate(LocalDate)} or
     * {@link #weekdays(int, int)} must be called. A single hour or weekday is
     * a range whose bounds are equal.
     * </p>
     */
    public static class Builder {
        private LocalDate fixedDate;
        private boolean weekdaysSet;
        private int startWeekday = DISABLED_WEEKDAY;
        private int endWeekday = DISABLED_WEEKDAY;
        private int startHour = -1;
        private int endHour = -1;
        private int minute = -1;
        private SoundRef sound;

        public Builder fixedDate(LocalDate fixedDate) {
            this.fixedDate = fixedDate;
            return this;
        }

        public Builder weekdays(int startWeekday, int endWeekday) {
            this.weekdaysSet = true;
            this.startWeekday = startWeekday;
            this.endWeekday = endWeekday;
            return this;
        }

        public Builder weekdays(Weekday start, Weekday end) {
            return weekdays(start.index(), end.index());
        }

        public Builder weekday(Weekday day) {
            return weekdays(day, day);
        }

        public Builder hours(int startHour, int endHour) {
            this.startHour = startHour;
            this.endHour = endHour;
            return this;
        }

        public Builder hour(int hour) {
            return hours(hour, hour);
        }

        public Builder minute(int minute) {
            this.minute = minute;
            return this;
        }

        public Builder sound(SoundRef sound) {
            this.sound = sound;
            return this;
        }

        /**
         * Build the rule.
         *
         * @return a new {@link ChimeRule}
         * @throws NullPointerException     if no sound was set
         * @throws IllegalArgumentException if a field is out of range or both
         *                                  or neither of fixed date and weekday
         *                                  range were set
         */
        public ChimeRule build() {
            Objects.requireNonNull(sound, "sound must not be null");
            List<String> errors = new ArrayList<>();

            if (fixedDate != null && weekdaysSet) {
                errors.add("fixed date and weekday range are mutually exclusive");
            }
            if (fixedDate == null && !weekdaysSet) {
                errors.add("either a fixed date or a weekday range is required");
            }
            if (weekdaysSet) {
                checkWeekday(startWeekday, "startWeekday", errors);
                checkWeekday(endWeekday, "endWeekday", errors);
            }
            checkRange(startHour, MAX_HOUR, "startHour", errors);
            checkRange(endHour, MAX_HOUR, "endHour", errors);
            checkRange(minute, MAX_MINUTE, "minute", errors);

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid ChimeRule: " + String.join("; ", errors));
            }
            return new ChimeRule(this);
        }

        private static void checkWeekday(int value, String name, List<String> errors) {
            if ((value < 0 || value > 6) && value != DISABLED_WEEKDAY) {
                errors.add(name + " must be in [0, 6] or " + DISABLED_WEEKDAY + ", got: " + value);
            }
        }

        private static void checkRange(int value, int max, String name, List<String> errors) {
            if (value < 0 || value > max) {
                errors.add(name + " must be in [0, " + max + "], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Optional<LocalDate> getFixedDate() {
        return Optional.ofNullable(fixedDate);
    }

    public boolean isFixedDate() {
        return fixedDate != null;
    }

    public int getStartWeekday() {
        return startWeekday;
    }

    public int getEndWeekday() {
        return endWeekday;
    }

    public int getStartHour() {
        return startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public int getMinute() {
        return minute;
    }

    public SoundRef getSound() {
        return sound;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChimeRule that))
            return false;
        return startWeekday == that.startWeekday
                && endWeekday == that.endWeekday
                && startHour == that.startHour
                && endHour == that.endHour
                && minute == that.minute
                && Objects.equals(fixedDate, that.fixedDate)
                && sound.equals(that.sound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fixedDate, startWeekday, endWeekday, startHour, endHour, minute, sound);
    }

    @Override
    public String toString() {
        return "ChimeRule{" +
                (fixedDate != null
                        ? "fixedDate=" + fixedDate
                        : "weekdays=" + startWeekday + "-" + endWeekday) +
                ", hours=" + startHour + "-" + endHour +
                ", minute=" + minute +
                ", sound='" + sound + '\'' +
                '}';
    }
}
