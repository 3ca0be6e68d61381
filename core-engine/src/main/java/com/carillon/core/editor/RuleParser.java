package com.carillon.core.editor;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.RuleValidationException;
import com.carillon.core.model.SoundRef;
import com.carillon.core.model.Weekday;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Turns one line of operator input into an {@link EditorCommand}.
 *
 * <h3>Grammar</h3>
 * <pre>
 *   ?                                   instructions
 *   (empty)                             show schedule
 *   Line#                               delete line
 *   Line# Day(s) Hour(s) Minute Tune    insert or replace line
 * </pre>
 * <p>
 * Items are separated by a single space. {@code Day(s)} is {@code mm/dd/yy}
 * (year 2021 or later), a weekday symbol, or a weekday range such as
 * {@code mo-fr}. {@code Hour(s)} is {@code 0..23} or a range such as
 * {@code 8-17}. {@code Tune} is the rest of the line: a case-sensitive file
 * name, possibly with spaces, or {@code Strike} in any case.
 * </p>
 * <p>
 * Ranges are inclusive and must not run backwards: {@code fr-mo} or
 * {@code 22-2} are rejected, since the scheduler never matches them. Enter
 * two lines instead.
 * </p>
 * <p>
 * Sound file existence is not checked here; see
 * {@link com.carillon.core.sound.SoundLibrary#checkAvailable(SoundRef)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleParser {

    /** Earliest two-digit year accepted in a fixed date. */
    public static final int MIN_YEAR = 21;

    private RuleParser() {
        // utility class - not instantiable
    }

    /**
     * Parse a command line.
     *
     * @param line raw input without line terminator; {@code null} is treated
     *             as empty
     * @return the command
     * @throws RuleValidationException with a corrective message if the line is
     *                                 malformed
     */
    public static EditorCommand parse(String line) throws RuleValidationException {
        String text = line == null ? "" : line.stripTrailing();
        String[] items = text.split(" ", -1);

        if (items[0].equals("?")) {
            return EditorCommand.help();
        }
        if (items[0].isEmpty()) {
            return EditorCommand.show();
        }

        int position = parseLineNumber(items[0]);
        if (items.length == 1) {
            return EditorCommand.delete(position);
        }
        if (items.length < 5) {
            throw new RuleValidationException("line",
                    "Enter five items, separated by single space: Line# Day Hour(s) Minute and Tune");
        }

        ChimeRule.Builder rule = ChimeRule.builder();
        parseDays(items[1], rule);
        parseHours(items[2], rule);
        rule.minute(parseMinute(items[3]));
        rule.sound(parseSound(text.split(" ", 5)[4]));
        return EditorCommand.upsert(position, rule.build());
    }

    /**
     * Parse the day field of a rule: a fixed date or a weekday range.
     *
     * @param field the text
     * @param rule  builder receiving the parsed value
     * @throws RuleValidationException if the field is malformed
     */
    public static void parseDays(String field, ChimeRule.Builder rule) throws RuleValidationException {
        if (field.contains("/")) {
            rule.fixedDate(parseDate(field));
            return;
        }
        String[] days = field.split("-", -1);
        if (days.length > 2) {
            throw new RuleValidationException("weekday", "Weekday lists are not supported. Use multiple lines instead");
        }
        Optional<Weekday> start = Weekday.parse(days[0]);
        Optional<Weekday> end = days.length == 2 ? Weekday.parse(days[1]) : start;
        if (start.isEmpty() || end.isEmpty()) {
            throw new RuleValidationException("weekday", "Day(s) must be su, mo, tu, we, th, fr or sa");
        }
        if (end.get().index() < start.get().index()) {
            throw new RuleValidationException("weekday",
                    "Weekday range " + field + " runs past Saturday. Use two lines instead, e.g. "
                            + start.get() + "-sa and su-" + end.get());
        }
        rule.weekdays(start.get(), end.get());
    }

    /**
     * Parse a {@code mm/dd/yy} date.
     *
     * @param field the text
     * @return the date, in the 2000s
     * @throws RuleValidationException if the text is not a real date in 2021
     *                                 or later
     */
    public static LocalDate parseDate(String field) throws RuleValidationException {
        String[] parts = field.split("/", -1);
        if (parts.length != 3 || !isTwoDigits(parts[0]) || !isTwoDigits(parts[1])
                || !isTwoDigits(parts[2])) {
            throw new RuleValidationException("date", "Date must be mm/dd/yy");
        }
        int month = Integer.parseInt(parts[0]);
        int day = Integer.parseInt(parts[1]);
        int year = Integer.parseInt(parts[2]);
        if (month < 1 || month > 12) {
            throw new RuleValidationException("date", month + " is not a valid month");
        }
        if (day < 1 || day > 31) {
            throw new RuleValidationException("date", day + " is not a valid day");
        }
        if (year < MIN_YEAR) {
            throw new RuleValidationException("date", year + " is not a valid year");
        }
        try {
            return LocalDate.of(2000 + year, month, day);
        } catch (DateTimeException e) {
            throw new RuleValidationException("date", field + " is not a calendar date");
        }
    }

    /**
     * Parse an hour or inclusive hour range.
     *
     * @param field the text
     * @param rule  builder receiving the parsed range
     * @throws RuleValidationException if the field is malformed
     */
    public static void parseHours(String field, ChimeRule.Builder rule) throws RuleValidationException {
        String[] hours = field.split("-", -1);
        if (hours.length > 2) {
            throw new RuleValidationException("hour", "Hour range must be start-end");
        }
        int start = parseHour(hours[0], "Start hour");
        int end = hours.length == 2 ? parseHour(hours[1], "End hour") : start;
        if (end < start) {
            throw new RuleValidationException("hour",
                    "Hour range " + field + " runs past midnight. Use two lines instead, e.g. "
                            + start + "-23 and 0-" + end);
        }
        rule.hours(start, end);
    }

    /**
     * @param field the text
     * @return minute 0..59
     * @throws RuleValidationException if the field is not a minute
     */
    public static int parseMinute(String field) throws RuleValidationException {
        if (!isNumeric(field)) {
            throw new RuleValidationException("minute", "Minute " + field + " must be numeric");
        }
        int minute = parseBounded(field);
        if (minute > ChimeRule.MAX_MINUTE) {
            throw new RuleValidationException("minute", "Minute " + field + " must be between 0 and 59");
        }
        return minute;
    }

    /**
     * @param field the text; {@code strike} in any case selects the strike
     * @return the sound reference
     * @throws RuleValidationException if the field is blank
     */
    public static SoundRef parseSound(String field) throws RuleValidationException {
        if (field == null || field.isBlank()) {
            throw new RuleValidationException("sound", "Tune must be a file name or Strike");
        }
        return SoundRef.parse(field);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static int parseLineNumber(String field) throws RuleValidationException {
        if (!isNumeric(field)) {
            throw new RuleValidationException("line", "Input must begin with a line number");
        }
        int position = parseBounded(field);
        if (position < 1) {
            throw new RuleValidationException("line", "Line number must be 1 or greater");
        }
        return position;
    }

    private static int parseHour(String text, String label) throws RuleValidationException {
        if (!isNumeric(text)) {
            throw new RuleValidationException("hour", label + " " + text + " must be numeric");
        }
        int hour = parseBounded(text);
        if (hour > ChimeRule.MAX_HOUR) {
            throw new RuleValidationException("hour", label + " " + text + " must be between 0 and 23");
        }
        return hour;
    }

    /** Digits only; caps absurdly long input instead of overflowing. */
    private static int parseBounded(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        return trimmed.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(trimmed);
    }

    private static boolean isTwoDigits(String text) {
        return text.length() == 2 && isNumeric(text);
    }

    private static boolean isNumeric(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
