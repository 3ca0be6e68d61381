package com.carillon.core.config;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.RuleValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-level POJO for the startup rule set YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - days: su-sa
 *     hours: 0-23
 *     minute: 0
 *     sound: Strike
 * </pre>
 *
 * <p>
 * Call {@link #toChimeRules()} after loading to validate and convert every
 * entry.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * Return the rule definitions. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rule definitions (used by SnakeYAML during deserialization).
     *
     * @param rules the definitions
     */
    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate and convert every definition, in order.
     *
     * <p>
     * Collects all errors and throws a single exception if any entry is
     * invalid.
     * </p>
     *
     * @return unmodifiable list of rules
     * @throws IllegalStateException if one or more entries are invalid
     */
    public List<ChimeRule> toChimeRules() {
        List<String> errors = new ArrayList<>();
        List<ChimeRule> result = new ArrayList<>(rules.size());

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition definition = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                result.add(definition.toRule());
            } catch (RuleValidationException | IllegalArgumentException e) {
                errors.add("rule " + (i + 1) + " (" + definition + "): " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}
