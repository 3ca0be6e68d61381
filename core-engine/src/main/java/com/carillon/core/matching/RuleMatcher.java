package com.carillon.core.matching;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.Weekday;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Decides whether a rule is due at a given minute.
 *
 * <p>
 * Each rule is judged on its own; there is no precedence or exclusivity
 * between rules. All bounds are inclusive. A range whose end lies before its
 * start matches nothing.
 * </p>
 *
 * <p>
 * Seconds are ignored: the caller evaluates once per minute, at second 0,
 * and nothing here prevents a second evaluation within the same minute from
 * matching again.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RuleMatcher.class);

    private RuleMatcher() {
        // utility class - not instantiable
    }

    /**
     * @param rule the rule to test; must not be {@code null}
     * @param now  the wall-clock minute being evaluated; must not be
     *             {@code null}
     * @return {@code true} if the rule fires at {@code now}
     */
    public static boolean isDue(ChimeRule rule, LocalDateTime now) {
        Objects.requireNonNull(rule, "Rule must not be null");
        Objects.requireNonNull(now, "Timestamp must not be null");

        if (rule.isFixedDate()) {
            if (!rule.getFixedDate().get().equals(now.toLocalDate())) {
                return false;
            }
        } else if (!inRange(Weekday.indexOf(now.getDayOfWeek()),
                rule.getStartWeekday(), rule.getEndWeekday())) {
            return false;
        }

        if (!inRange(now.getHour(), rule.getStartHour(), rule.getEndHour())) {
            return false;
        }
        if (now.getMinute() != rule.getMinute()) {
            return false;
        }

        LOG.trace("Rule {} is due at {}", rule, now);
        return true;
    }

    private static boolean inRange(int value, int start, int end) {
        return value >= start && value <= end;
    }
}
