package com.carillon.core.editor;

import com.carillon.core.model.ChimeRule;

import java.util.Objects;
import java.util.Optional;

/**
 * One parsed line of operator input.
 *
 * @since 1.0.0
 */
public final class EditorCommand {

    /** What the operator asked for. */
    public enum Kind {
        /** {@code ?} - print the instructions. */
        HELP,
        /** Empty line - print the schedule. */
        SHOW,
        /** Line number alone - delete that line. */
        DELETE,
        /** Line number plus rule fields - insert or replace that line. */
        UPSERT
    }

    private static final EditorCommand HELP = new EditorCommand(Kind.HELP, 0, null);
    private static final EditorCommand SHOW = new EditorCommand(Kind.SHOW, 0, null);

    private final Kind kind;
    private final int position;
    private final ChimeRule rule;

    private EditorCommand(Kind kind, int position, ChimeRule rule) {
        this.kind = kind;
        this.position = position;
        this.rule = rule;
    }

    public static EditorCommand help() {
        return HELP;
    }

    public static EditorCommand show() {
        return SHOW;
    }

    public static EditorCommand delete(int position) {
        return new EditorCommand(Kind.DELETE, position, null);
    }

    public static EditorCommand upsert(int position, ChimeRule rule) {
        return new EditorCommand(Kind.UPSERT, position,
                Objects.requireNonNull(rule, "Rule must not be null"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return 1-based line number for {@link Kind#DELETE} and
     *         {@link Kind#UPSERT}, 0 otherwise
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the rule for {@link Kind#UPSERT}
     */
    public Optional<ChimeRule> getRule() {
        return Optional.ofNullable(rule);
    }

    @Override
    public String toString() {
        return "EditorCommand{kind=" + kind + ", position=" + position + ", rule=" + rule + '}';
    }
}
