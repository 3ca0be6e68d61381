package com.carillon.core.sound;

import com.carillon.core.model.RuleValidationException;
import com.carillon.core.model.SoundRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps {@link SoundRef}s to files under one base directory.
 *
 * <h3>Naming</h3>
 * <ul>
 * <li>The strike for a 12-hour count {@code n} (1..12) is
 * {@code Strike<n><ext>}.</li>
 * <li>A named sound is {@code <name><ext>}, unless the name already ends in
 * the extension (compared case-insensitively).</li>
 * </ul>
 *
 * <p>
 * Immutable; shared read-only by the editor and the playout loop.
 * </p>
 *
 * @since 1.0.0
 */
public final class SoundLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(SoundLibrary.class);

    /** File name prefix of the twelve strike sounds. */
    public static final String STRIKE_PREFIX = "Strike";

    public static final int STRIKE_FILES = 12;

    private final Path basePath;
    private final String extension;

    /**
     * @param basePath  directory holding the sound files
     * @param extension default extension including the dot, e.g. {@code .mp3}
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if {@code extension} does not start
     *                                  with a dot
     */
    public SoundLibrary(Path basePath, String extension) {
        this.basePath = Objects.requireNonNull(basePath, "Sound base path must not be null");
        this.extension = Objects.requireNonNull(extension, "Sound extension must not be null");
        if (!extension.startsWith(".") || extension.length() < 2) {
            throw new IllegalArgumentException(
                    "Sound extension must start with '.', got: '" + extension + "'");
        }
    }

    // ---------------------------------------------------------------
    // Strike arithmetic
    // ---------------------------------------------------------------

    /**
     * Number of strikes for a 24-hour clock hour on a 12-hour dial.
     *
     * @param hour 0..23
     * @return 1..12; midnight and noon both give 12
     */
    public static int strikeCount(int hour) {
        int count = hour % 12;
        return count == 0 ? 12 : count;
    }

    /**
     * @param hour 0..23
     * @return the strike sound identifier for that hour, e.g. {@code "12"}
     */
    public static String strikeIdentifier(int hour) {
        return Integer.toString(strikeCount(hour));
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * @param count strike count 1..12
     * @return path of the strike file for that count
     */
    public Path strikeFile(int count) {
        if (count < 1 || count > STRIKE_FILES) {
            throw new IllegalArgumentException("Strike count must be in [1, 12], got: " + count);
        }
        return basePath.resolve(STRIKE_PREFIX + count + extension);
    }

    /**
     * Resolve a reference to the file to play at {@code now}.
     *
     * @param sound the reference
     * @param now   the minute being played; its hour selects the strike
     * @return the file path (not checked for existence)
     */
    public Path resolve(SoundRef sound, LocalDateTime now) {
        Objects.requireNonNull(sound, "Sound must not be null");
        if (sound.isStrike()) {
            return strikeFile(strikeCount(now.getHour()));
        }
        return namedFile(sound.getName());
    }

    private Path namedFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        String fileName = lower.endsWith(extension.toLowerCase(Locale.ROOT))
                ? name
                : name + extension;
        return basePath.resolve(fileName);
    }

    // ---------------------------------------------------------------
    // Availability
    // ---------------------------------------------------------------

    /**
     * Check that the file(s) behind a reference can be read. For the strike
     * sentinel all twelve strike files are required.
     *
     * @param sound the reference
     * @throws RuleValidationException naming the first missing file
     */
    public void checkAvailable(SoundRef sound) throws RuleValidationException {
        Objects.requireNonNull(sound, "Sound must not be null");
        if (sound.isStrike()) {
            for (int count = 1; count <= STRIKE_FILES; count++) {
                Path file = strikeFile(count);
                if (!Files.isReadable(file)) {
                    throw new RuleValidationException("sound",
                            "File " + file + " is missing; striking requires all twelve Strike files");
                }
            }
            return;
        }
        Path file = namedFile(sound.getName());
        if (!Files.exists(file)) {
            throw new RuleValidationException("sound", file + " not found - check sPeLLing");
        }
        if (!Files.isReadable(file)) {
            throw new RuleValidationException("sound", file + " is not readable");
        }
        LOG.debug("Sound '{}' available at {}", sound, file);
    }

    public Path getBasePath() {
        return basePath;
    }

    @Override
    public String toString() {
        return "SoundLibrary{basePath=" + basePath + ", extension='" + extension + "'}";
    }
}
