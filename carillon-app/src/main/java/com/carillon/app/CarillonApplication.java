package com.carillon.app;

import com.carillon.core.config.RulesLoader;
import com.carillon.core.editor.ScheduleEditor;
import com.carillon.core.schedule.ClockSync;
import com.carillon.core.schedule.PlayoutLoop;
import com.carillon.core.schedule.Sleeper;
import com.carillon.core.sound.SoundLibrary;
import com.carillon.core.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;

/**
 * Main entry point of the carillon.
 *
 * <h3>Threads</h3>
 *
 * <pre>
 *   main              console editor: stdin -&gt; ScheduleEditor -&gt; RuleStore
 *   carillon-playout  PlayoutLoop: RuleStore snapshot -&gt; RuleMatcher -&gt; ClipSoundPlayer
 * </pre>
 *
 * <p>
 * The playout thread is not a daemon: closing the console leaves the
 * schedule running. The process ends when it is killed; a shutdown hook stops
 * the loop.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link CarillonConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CarillonApplication {

    private static final Logger LOG = LoggerFactory.getLogger(CarillonApplication.class);

    private CarillonApplication() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        CarillonConfig config = CarillonConfig.fromEnvironment();
        LOG.info("Starting carillon with config: {}", config);

        // 2. Load the startup schedule
        RuleStore store = new RuleStore(RulesLoader.load(config.getRulesConfigPath()));

        // 3. Sounds
        SoundLibrary library = new SoundLibrary(config.getSoundPath(), config.getSoundExtension());
        if (!Files.isDirectory(library.getBasePath())) {
            LOG.warn("Sound directory {} does not exist; every due rule will fail and be removed",
                    library.getBasePath());
        }

        // 4. Playout thread
        ClockSync clockSync = new ClockSync(Clock.system(config.getZone()),
                config.getClockPollInterval(), Sleeper.SYSTEM);
        PlayoutLoop loop = new PlayoutLoop(store, clockSync, library, new ClipSoundPlayer());

        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        ScheduleEditor editor = new ScheduleEditor(store, library, out);
        loop.addListener(editor);

        Thread playout = new Thread(loop, "carillon-playout");
        playout.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.stop();
            playout.interrupt();
        }, "carillon-shutdown"));

        // 5. Console editor on the main thread
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ConsoleEditor(editor, in, out).run();

        LOG.info("Console closed; playout continues");
        playout.join();
    }
}
