package com.carillon.core.store;

/**
 * Thrown when a position does not address an existing rule.
 *
 * @since 1.0.0
 */
public final class RuleNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final int size;

    public RuleNotFoundException(int position, int size) {
        super(size == 0
                ? "No line " + position + " to delete: the schedule is empty"
                : "No line " + position + " to delete: the schedule has " + size + " line(s)");
        this.position = position;
        this.size = size;
    }

    /** 1-based position that was requested. */
    public int position() {
        return position;
    }

    /** Store size at the time of the request. */
    public int size() {
        return size;
    }
}
