package com.carillon.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChimeRule}.
 */
class ChimeRuleTest {

    @Test
    @DisplayName("Should build a recurring weekday rule")
    void shouldBuildWeekdayRule() {
        ChimeRule rule = ChimeRule.builder()
                .weekdays(Weekday.MONDAY, Weekday.FRIDAY)
                .hours(8, 17)
                .minute(30)
                .sound(SoundRef.named("Half"))
                .build();

        assertThat(rule.isFixedDate()).isFalse();
        assertThat(rule.getFixedDate()).isEmpty();
        assertThat(rule.getStartWeekday()).isEqualTo(1);
        assertThat(rule.getEndWeekday()).isEqualTo(5);
        assertThat(rule.getStartHour()).isEqualTo(8);
        assertThat(rule.getEndHour()).isEqualTo(17);
        assertThat(rule.getMinute()).isEqualTo(30);
        assertThat(rule.getSound().getName()).isEqualTo("Half");
    }

    @Test
    @DisplayName("Should disable weekdays on a fixed-date rule")
    void shouldDisableWeekdaysForFixedDate() {
        ChimeRule rule = ChimeRule.builder()
                .fixedDate(LocalDate.of(2021, 12, 25))
                .hour(10)
                .minute(0)
                .sound(SoundRef.STRIKE)
                .build();

        assertThat(rule.isFixedDate()).isTrue();
        assertThat(rule.getStartWeekday()).isEqualTo(ChimeRule.DISABLED_WEEKDAY);
        assertThat(rule.getEndWeekday()).isEqualTo(ChimeRule.DISABLED_WEEKDAY);
        assertThat(rule.getStartHour()).isEqualTo(rule.getEndHour()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject a rule with both a fixed date and weekdays")
    void shouldRejectDateAndWeekdays() {
        assertThatThrownBy(() -> ChimeRule.builder()
                .fixedDate(LocalDate.of(2022, 1, 1))
                .weekday(Weekday.SUNDAY)
                .hour(9).minute(0).sound(SoundRef.STRIKE)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mutually exclusive");
    }

    @Test
    @DisplayName("Should reject a rule with neither a fixed date nor weekdays")
    void shouldRejectMissingDays() {
        assertThatThrownBy(() -> ChimeRule.builder()
                .hour(9).minute(0).sound(SoundRef.STRIKE)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("either a fixed date or a weekday range");
    }

    @Test
    @DisplayName("Should report every out-of-range field at once")
    void shouldRejectOutOfRangeFields() {
        assertThatThrownBy(() -> ChimeRule.builder()
                .weekdays(0, 7)
                .hours(0, 24)
                .minute(60)
                .sound(SoundRef.STRIKE)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("endWeekday")
                .hasMessageContaining("endHour")
                .hasMessageContaining("minute");
    }

    @Test
    @DisplayName("Should require a sound")
    void shouldRequireSound() {
        assertThatThrownBy(() -> ChimeRule.builder().weekday(Weekday.SUNDAY).hour(9).minute(0).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should compare rules by value")
    void shouldCompareByValue() {
        ChimeRule a = ChimeRule.builder().weekdays(0, 6).hours(0, 23).minute(15)
                .sound(SoundRef.named("Quarter")).build();
        ChimeRule b = ChimeRule.builder().weekdays(0, 6).hours(0, 23).minute(15)
                .sound(SoundRef.named("Quarter")).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b).isNotSameAs(b);
    }
}
