package com.carillon.core.editor;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.RuleValidationException;
import com.carillon.core.model.SoundRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleParser}.
 */
class RuleParserTest {

    // ---------------------------------------------------------------
    // Command kinds
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should parse ? as help and an empty line as show")
    void shouldParseHelpAndShow() throws RuleValidationException {
        assertThat(RuleParser.parse("?").getKind()).isEqualTo(EditorCommand.Kind.HELP);
        assertThat(RuleParser.parse("").getKind()).isEqualTo(EditorCommand.Kind.SHOW);
        assertThat(RuleParser.parse("   ").getKind()).isEqualTo(EditorCommand.Kind.SHOW);
        assertThat(RuleParser.parse(null).getKind()).isEqualTo(EditorCommand.Kind.SHOW);
    }

    @Test
    @DisplayName("Should parse a lone line number as delete")
    void shouldParseDelete() throws RuleValidationException {
        EditorCommand command = RuleParser.parse("3");

        assertThat(command.getKind()).isEqualTo(EditorCommand.Kind.DELETE);
        assertThat(command.getPosition()).isEqualTo(3);
        assertThat(command.getRule()).isEmpty();
    }

    @Test
    @DisplayName("Should parse a weekday range rule")
    void shouldParseWeekdayRule() throws RuleValidationException {
        EditorCommand command = RuleParser.parse("2 mo-fr 8-17 0 Strike");

        assertThat(command.getKind()).isEqualTo(EditorCommand.Kind.UPSERT);
        assertThat(command.getPosition()).isEqualTo(2);
        assertThat(command.getRule()).contains(ChimeRule.builder()
                .weekdays(1, 5)
                .hours(8, 17)
                .minute(0)
                .sound(SoundRef.STRIKE)
                .build());
    }

    @Test
    @DisplayName("Should parse a fixed-date rule whose tune has spaces")
    void shouldParseFixedDateRule() throws RuleValidationException {
        ChimeRule rule = RuleParser.parse("1 12/25/21 10 30 Christmas Peal").getRule().orElseThrow();

        assertThat(rule.getFixedDate()).contains(LocalDate.of(2021, 12, 25));
        assertThat(rule.getStartWeekday()).isEqualTo(ChimeRule.DISABLED_WEEKDAY);
        assertThat(rule.getStartHour()).isEqualTo(10);
        assertThat(rule.getEndHour()).isEqualTo(10);
        assertThat(rule.getMinute()).isEqualTo(30);
        assertThat(rule.getSound()).isEqualTo(SoundRef.named("Christmas Peal"));
    }

    @Test
    @DisplayName("Should accept a single weekday and strike in any case")
    void shouldParseSingleWeekday() throws RuleValidationException {
        ChimeRule rule = RuleParser.parse("1 SU 0-23 0 sTrIkE").getRule().orElseThrow();

        assertThat(rule.getStartWeekday()).isZero();
        assertThat(rule.getEndWeekday()).isZero();
        assertThat(rule.getSound().isStrike()).isTrue();
    }

    // ---------------------------------------------------------------
    // Rejections
    // ---------------------------------------------------------------

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "x su 9 0 Bell        | line    | Input must begin with a line number",
            "0 su 9 0 Bell        | line    | Line number must be 1 or greater",
            "1 su 9 0             | line    | Enter five items",
            "1  su 9 0 Bell       | weekday | Day(s) must be su",
            "1 su-mo-tu 9 0 Bell  | weekday | Weekday lists are not supported",
            "1 fr-mo 9 0 Bell     | weekday | runs past Saturday",
            "1 xx 9 0 Bell        | weekday | Day(s) must be su",
            "1 12/25/2021 9 0 Bell| date    | Date must be mm/dd/yy",
            "1 1/1/2022 9 0 Bell  | date    | Date must be mm/dd/yy",
            "1 12/5/021 9 0 Bell  | date    | Date must be mm/dd/yy",
            "1 13/01/21 9 0 Bell  | date    | 13 is not a valid month",
            "1 12/32/21 9 0 Bell  | date    | 32 is not a valid day",
            "1 12/25/20 9 0 Bell  | date    | 20 is not a valid year",
            "1 02/30/22 9 0 Bell  | date    | is not a calendar date",
            "1 su a 0 Bell        | hour    | Start hour a must be numeric",
            "1 su 8-24 0 Bell     | hour    | End hour 24 must be between 0 and 23",
            "1 su 22-2 0 Bell     | hour    | runs past midnight",
            "1 su 1-2-3 0 Bell    | hour    | Hour range must be start-end",
            "1 su 9 x Bell        | minute  | Minute x must be numeric",
            "1 su 9 60 Bell       | minute  | Minute 60 must be between 0 and 59",
    })
    @DisplayName("Should reject malformed input with a message naming the field")
    void shouldRejectMalformedInput(String line, String field, String message) {
        assertThatThrownBy(() -> RuleParser.parse(line.strip()))
                .isInstanceOfSatisfying(RuleValidationException.class, e -> {
                    assertThat(e.getMessage()).contains(message);
                    assertThat(e.field()).isEqualTo(field);
                });
    }

    @Test
    @DisplayName("Should reject a trailing space in place of the tune")
    void shouldRejectBlankTune() {
        assertThatThrownBy(() -> RuleParser.parse("1 su 9 0  "))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("Enter five items");
    }

    @Test
    @DisplayName("Should suggest the split for a wrapping weekday range")
    void shouldSuggestSplit() {
        assertThatThrownBy(() -> RuleParser.parse("1 fr-mo 9 0 Bell"))
                .hasMessageContaining("fr-sa and su-mo");
    }

    @Test
    @DisplayName("Should accept the earliest allowed year and leap days")
    void shouldAcceptBoundaryDates() throws RuleValidationException {
        assertThat(RuleParser.parseDate("01/01/21")).isEqualTo(LocalDate.of(2021, 1, 1));
        assertThat(RuleParser.parseDate("02/29/24")).isEqualTo(LocalDate.of(2024, 2, 29));
    }
}
