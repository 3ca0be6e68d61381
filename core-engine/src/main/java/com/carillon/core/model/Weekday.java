package com.carillon.core.model;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Day of the week as the operator types it, indexed from Sunday.
 *
 * <p>
 * The index ({@code su}=0 ... {@code sa}=6) is what {@link ChimeRule} stores
 * for its recurring weekday range.
 * </p>
 *
 * @since 1.0.0
 */
public enum Weekday {
    SUNDAY(0, "su"),
    MONDAY(1, "mo"),
    TUESDAY(2, "tu"),
    WEDNESDAY(3, "we"),
    THURSDAY(4, "th"),
    FRIDAY(5, "fr"),
    SATURDAY(6, "sa");

    private static final Map<String, Weekday> BY_SYMBOL = Map.of(
            "su", SUNDAY, "mo", MONDAY, "tu", TUESDAY, "we", WEDNESDAY,
            "th", THURSDAY, "fr", FRIDAY, "sa", SATURDAY);

    private final int index;
    private final String symbol;

    Weekday(int index, String symbol) {
        this.index = index;
        this.symbol = symbol;
    }

    /**
     * @return index 0..6, Sunday first
     */
    public int index() {
        return index;
    }

    /**
     * @return the two-letter symbol used in rule text
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Parse a two-letter weekday symbol (case insensitive).
     *
     * @param symbol the text to parse
     * @return the weekday, or empty if the symbol is unknown
     */
    public static Optional<Weekday> parse(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SYMBOL.get(symbol.toLowerCase(Locale.ROOT)));
    }

    /**
     * @param index weekday index 0..6
     * @return the weekday with that index
     * @throws IllegalArgumentException if {@code index} is not in 0..6
     */
    public static Weekday ofIndex(int index) {
        for (Weekday w : values()) {
            if (w.index == index) {
                return w;
            }
        }
        throw new IllegalArgumentException("Weekday index must be in [0, 6], got: " + index);
    }

    /**
     * Convert an ISO {@link DayOfWeek} (Monday first) to the Sunday-first index.
     *
     * @param dayOfWeek the ISO day
     * @return index 0..6
     */
    public static int indexOf(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
