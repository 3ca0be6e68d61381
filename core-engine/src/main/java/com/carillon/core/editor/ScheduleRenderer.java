package com.carillon.core.editor;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.Weekday;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders the schedule in the same space-separated form it is entered in,
 * prefixed with line numbers.
 *
 * <pre>
 * Day(s) Hr(s) Min Tune
 * 1: su-sa 0-23 0 Strike
 * 2: 12/25/21 10 30 Christmas Peal
 * </pre>
 *
 * @since 1.0.0
 */
public final class ScheduleRenderer {

    public static final String HEADER = "Day(s) Hr(s) Min Tune";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MM/dd/yy");

    private ScheduleRenderer() {
        // utility class - not instantiable
    }

    /**
     * @param rules rules in line order
     * @return header followed by one numbered line per rule
     */
    public static List<String> render(List<ChimeRule> rules) {
        Objects.requireNonNull(rules, "Rules must not be null");
        List<String> lines = new ArrayList<>(rules.size() + 1);
        lines.add(HEADER);
        for (int i = 0; i < rules.size(); i++) {
            lines.add((i + 1) + ": " + format(rules.get(i)));
        }
        return lines;
    }

    /**
     * @param rule the rule
     * @return days, hours, minute and tune separated by single spaces
     */
    public static String format(ChimeRule rule) {
        StringBuilder sb = new StringBuilder();
        if (rule.isFixedDate()) {
            sb.append(DATE.format(rule.getFixedDate().get()));
        } else {
            appendRange(sb, symbol(rule.getStartWeekday()), symbol(rule.getEndWeekday()));
        }
        sb.append(' ');
        appendRange(sb, Integer.toString(rule.getStartHour()), Integer.toString(rule.getEndHour()));
        sb.append(' ').append(rule.getMinute());
        sb.append(' ').append(rule.getSound().getName());
        return sb.toString();
    }

    private static void appendRange(StringBuilder sb, String start, String end) {
        sb.append(start);
        if (!start.equals(end)) {
            sb.append('-').append(end);
        }
    }

    private static String symbol(int weekday) {
        return weekday >= 0 && weekday <= Weekday.SATURDAY.index()
                ? Weekday.ofIndex(weekday).symbol()
                : "--";
    }
}
