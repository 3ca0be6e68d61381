package com.carillon.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * What a rule plays: either the hour-count strike sequence or a named sound
 * file.
 *
 * <p>
 * Named references are case sensitive and may contain spaces. The keyword
 * {@code Strike} is recognised in any case by {@link #parse(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SoundRef {

    /** Keyword that selects the strike sequence for the current hour. */
    public static final String STRIKE_KEYWORD = "Strike";

    /** The strike sentinel. */
    public static final SoundRef STRIKE = new SoundRef(STRIKE_KEYWORD, true);

    private final String name;
    private final boolean strike;

    private SoundRef(String name, boolean strike) {
        this.name = name;
        this.strike = strike;
    }

    /**
     * Reference a sound file by name.
     *
     * @param name file name relative to the sound base directory
     * @return a named reference
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static SoundRef named(String name) {
        Objects.requireNonNull(name, "Sound name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Sound name must not be blank");
        }
        return new SoundRef(name, false);
    }

    /**
     * Parse operator text: {@code strike} in any case yields {@link #STRIKE},
     * anything else a named reference.
     *
     * @param text raw sound field
     * @return the parsed reference
     */
    public static SoundRef parse(String text) {
        Objects.requireNonNull(text, "Sound text must not be null");
        if (text.toLowerCase(Locale.ROOT).equals("strike")) {
            return STRIKE;
        }
        return named(text);
    }

    public boolean isStrike() {
        return strike;
    }

    /**
     * @return the file name, or {@value #STRIKE_KEYWORD} for the strike sentinel
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SoundRef that))
            return false;
        return strike == that.strike && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, strike);
    }

    @Override
    public String toString() {
        return name;
    }
}
