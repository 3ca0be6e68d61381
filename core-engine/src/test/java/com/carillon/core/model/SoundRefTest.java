package com.carillon.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SoundRef} and {@link Weekday}.
 */
class SoundRefTest {

    @Test
    @DisplayName("Should parse the strike keyword in any case")
    void shouldParseStrikeKeyword() {
        assertThat(SoundRef.parse("strike")).isSameAs(SoundRef.STRIKE);
        assertThat(SoundRef.parse("STRIKE")).isSameAs(SoundRef.STRIKE);
        assertThat(SoundRef.parse("Strike").isStrike()).isTrue();
    }

    @Test
    @DisplayName("Should keep named sounds case sensitive with spaces")
    void shouldKeepNamedSoundsVerbatim() {
        SoundRef ref = SoundRef.parse("Westminster Quarters");

        assertThat(ref.isStrike()).isFalse();
        assertThat(ref.getName()).isEqualTo("Westminster Quarters");
        assertThat(ref).isNotEqualTo(SoundRef.parse("westminster quarters"));
    }

    @Test
    @DisplayName("Should reject a blank sound name")
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> SoundRef.named("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should index weekdays from Sunday")
    void shouldIndexWeekdaysFromSunday() {
        assertThat(Weekday.indexOf(DayOfWeek.SUNDAY)).isZero();
        assertThat(Weekday.indexOf(DayOfWeek.MONDAY)).isEqualTo(1);
        assertThat(Weekday.indexOf(DayOfWeek.SATURDAY)).isEqualTo(6);
        assertThat(Weekday.parse("Fr")).contains(Weekday.FRIDAY);
        assertThat(Weekday.parse("xx")).isEmpty();
        assertThat(Weekday.ofIndex(3)).isEqualTo(Weekday.WEDNESDAY);
    }
}
