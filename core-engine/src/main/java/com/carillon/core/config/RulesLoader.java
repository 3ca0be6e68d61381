package com.carillon.core.config;

import com.carillon.core.model.ChimeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the schedule the carillon starts with.
 *
 * <p>
 * An installation may keep its own schedule in a YAML file; without one, the
 * tower-clock schedule {@value #DEFAULT_RESOURCE} bundled on the classpath
 * (hour strike plus quarter chimes) is used. A configured file that does not
 * exist is logged and the bundled schedule is used instead, so a typo in the
 * path still leaves a ringing clock.
 * </p>
 *
 * <p>
 * Entries are written in the operator's notation ({@code days: mo-fr},
 * {@code hours: 8-17}) and go through the same field parsers as console
 * input. One bad entry stops startup, with every bad entry listed. Sound
 * files are not looked up here; a missing file is dealt with when its rule
 * comes due.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Bundled tower-clock schedule. */
    public static final String DEFAULT_RESOURCE = "default-rules.yml";

    private RulesLoader() {
    }

    /**
     * Load the installation's schedule, or the bundled one.
     *
     * @param configuredPath YAML file chosen by the installation; blank or
     *                       {@code null} selects the bundled schedule
     * @return the startup rules, in line order
     * @throws IllegalStateException if the chosen schedule is malformed
     */
    public static List<ChimeRule> load(String configuredPath) {
        if (configuredPath == null || configuredPath.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        if (!Files.isRegularFile(Path.of(configuredPath))) {
            LOG.warn("Schedule file {} does not exist; starting with the bundled {}",
                    configuredPath, DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromFile(configuredPath);
    }

    /**
     * @param path YAML file
     * @return the rules it defines
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read or holds
     *                                  invalid rules
     */
    public static List<ChimeRule> fromFile(String path) {
        Objects.requireNonNull(path, "Schedule file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return read(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read schedule file " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return the rules it defines
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if it holds invalid rules
     */
    public static List<ChimeRule> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return read(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read schedule resource " + resource, e);
        }
    }

    private static List<ChimeRule> read(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig schedule;
        try {
            schedule = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + source + ": " + e.getMessage(), e);
        }
        if (schedule == null || schedule.getRules().isEmpty()) {
            LOG.warn("{} defines no rules; the carillon starts silent", source);
            return List.of();
        }

        List<ChimeRule> rules = schedule.toChimeRules();
        LOG.info("Schedule of {} line(s) read from {}", rules.size(), source);
        return rules;
    }
}
