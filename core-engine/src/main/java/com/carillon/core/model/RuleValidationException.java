package com.carillon.core.model;

/**
 * Operator input that cannot become a {@link ChimeRule}.
 *
 * <p>
 * The message is meant for the operator and says what was expected;
 * {@link #field()} names the rule field that was wrong.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String field;

    public RuleValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Name of the offending field, e.g. {@code "minute"}. */
    public String field() {
        return field;
    }
}
