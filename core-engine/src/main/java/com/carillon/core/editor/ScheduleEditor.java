package com.carillon.core.editor;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.RuleValidationException;
import com.carillon.core.schedule.PlayoutFault;
import com.carillon.core.schedule.PlayoutListener;
import com.carillon.core.sound.SoundLibrary;
import com.carillon.core.store.RuleNotFoundException;
import com.carillon.core.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * Applies operator commands to the {@link RuleStore} and writes everything
 * the operator sees.
 *
 * <p>
 * Each call to {@link #handle(String)} processes one input line: invalid
 * input produces a corrective message and leaves the store unchanged; valid
 * edits are applied and the renumbered schedule is printed.
 * </p>
 *
 * <p>
 * Also listens to the playout loop so that a rule removed at playout time is
 * reported on the same console, followed by the current schedule and a fresh
 * prompt. Output blocks from both threads are written atomically.
 * </p>
 *
 * @since 1.0.0
 */
public class ScheduleEditor implements PlayoutListener {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleEditor.class);

    static final String PROMPT = ">";

    private final RuleStore store;
    private final SoundLibrary library;
    private final PrintWriter out;

    /**
     * @param store   the shared rule store
     * @param library used to check that a rule's sound exists before it is
     *                stored
     * @param out     operator console
     */
    public ScheduleEditor(RuleStore store, SoundLibrary library, PrintWriter out) {
        this.store = Objects.requireNonNull(store, "RuleStore must not be null");
        this.library = Objects.requireNonNull(library, "SoundLibrary must not be null");
        this.out = Objects.requireNonNull(out, "Output must not be null");
    }

    /**
     * Print the instructions, the schedule, and the first prompt.
     */
    public void start() {
        synchronized (out) {
            printLines(Instructions.LINES);
            out.println();
            printSchedule();
            prompt();
        }
    }

    /**
     * Process one line of input.
     *
     * @param line the line without terminator
     */
    public void handle(String line) {
        synchronized (out) {
            try {
                EditorCommand command = RuleParser.parse(line);
                apply(command);
            } catch (RuleValidationException e) {
                LOG.debug("Rejected input '{}' ({}): {}", line, e.field(), e.getMessage());
                out.println("Error: " + e.getMessage());
            }
            prompt();
        }
    }

    @Override
    public void onRuleRemoved(PlayoutFault fault) {
        synchronized (out) {
            out.println();
            out.println("Internal Error: A scheduled event could not be played ("
                    + fault.getCause().getMessage() + ")");
            out.println("Event " + fault.getPosition() + ": " + ScheduleRenderer.format(fault.getRule()));
            if (fault.isRemoved()) {
                out.println("Event " + fault.getPosition() + " deleted. Resuming schedule");
            } else {
                out.println("Event " + fault.getPosition() + " was already deleted. Resuming schedule");
            }
            printSchedule();
            prompt();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void apply(EditorCommand command) throws RuleValidationException {
        switch (command.getKind()) {
            case HELP -> printLines(Instructions.LINES);
            case SHOW -> printSchedule();
            case DELETE -> {
                try {
                    ChimeRule removed = store.deleteAt(command.getPosition());
                    LOG.info("Operator deleted line {}: {}", command.getPosition(), removed);
                } catch (RuleNotFoundException e) {
                    out.println(e.getMessage());
                    return;
                }
                printSchedule();
            }
            case UPSERT -> {
                ChimeRule rule = command.getRule().orElseThrow();
                library.checkAvailable(rule.getSound());
                store.upsertAt(command.getPosition(), rule);
                LOG.info("Operator set line {}: {}", command.getPosition(), rule);
                printSchedule();
            }
        }
    }

    private void printSchedule() {
        out.println();
        printLines(ScheduleRenderer.render(store.snapshot()));
    }

    private void printLines(List<String> lines) {
        lines.forEach(out::println);
    }

    private void prompt() {
        out.print(PROMPT);
        out.flush();
    }
}
