package com.carillon.app;

import com.carillon.core.editor.ScheduleEditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Reads operator input line by line and hands each line to the
 * {@link ScheduleEditor}.
 *
 * <p>
 * Runs until end of input. No input line can end the loop: an unexpected
 * failure while handling a line is logged and the line is discarded.
 * </p>
 *
 * @since 1.0.0
 */
public class ConsoleEditor implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleEditor.class);

    private final ScheduleEditor editor;
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleEditor(ScheduleEditor editor, BufferedReader in, PrintWriter out) {
        this.editor = Objects.requireNonNull(editor, "ScheduleEditor must not be null");
        this.in = Objects.requireNonNull(in, "Input must not be null");
        this.out = Objects.requireNonNull(out, "Output must not be null");
    }

    @Override
    public void run() {
        editor.start();
        while (true) {
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                LOG.error("Console input failed; editing is no longer possible", e);
                return;
            }
            if (line == null) {
                LOG.info("Console input closed; editing ended");
                return;
            }
            try {
                editor.handle(line);
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure handling input '{}'", line, e);
                synchronized (out) {
                    out.println("Unanticipated Error: User input line discarded");
                    out.flush();
                }
            }
        }
    }
}
