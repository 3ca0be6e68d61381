package com.carillon.app;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Typed, immutable configuration of the carillon process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * an installation is configured from its service unit or shell profile.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class CarillonConfig {

    public static final String ENV_SOUND_PATH = "CARILLON_SOUND_PATH";
    public static final String ENV_SOUND_EXTENSION = "CARILLON_SOUND_EXTENSION";
    public static final String ENV_RULES_PATH = "CARILLON_RULES_PATH";
    public static final String ENV_CLOCK_POLL_MS = "CARILLON_CLOCK_POLL_MS";
    public static final String ENV_ZONE = "CARILLON_ZONE";

    // ---------------------------------------------------------------
    // Sounds
    // ---------------------------------------------------------------
    private final Path soundPath;
    private final String soundExtension;

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------
    private final String rulesConfigPath;

    // ---------------------------------------------------------------
    // Clock
    // ---------------------------------------------------------------
    private final long clockPollMs;
    private final ZoneId zone;

    private CarillonConfig(Builder b) {
        this.soundPath = b.soundPath;
        this.soundExtension = b.soundExtension;
        this.rulesConfigPath = b.rulesConfigPath;
        this.clockPollMs = b.clockPollMs;
        this.zone = b.zone;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link CarillonConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static CarillonConfig fromEnvironment() {
        try {
            Builder builder = new Builder()
                    .soundPath(Path.of(env(ENV_SOUND_PATH, "sounds")))
                    .soundExtension(env(ENV_SOUND_EXTENSION, ".mp3"))
                    .rulesConfigPath(env(ENV_RULES_PATH, ""))
                    .clockPollMs(Long.parseLong(env(ENV_CLOCK_POLL_MS, "200")));
            String zone = env(ENV_ZONE, "");
            if (!zone.isBlank()) {
                builder.zone(ZoneId.of(zone));
            }
            return builder.build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeException e) {
            throw new IllegalStateException(
                    "Failed to parse " + ENV_ZONE + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getSoundPath() {
        return soundPath;
    }

    public String getSoundExtension() {
        return soundExtension;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public long getClockPollMs() {
        return clockPollMs;
    }

    public Duration getClockPollInterval() {
        return Duration.ofMillis(clockPollMs);
    }

    public ZoneId getZone() {
        return zone;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CarillonConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (poll interval in [1, 500] ms, extension starting with a dot).
     * </p>
     */
    public static class Builder {
        private Path soundPath = Path.of("sounds");
        private String soundExtension = ".mp3";
        private String rulesConfigPath = "";
        private long clockPollMs = 200;
        private ZoneId zone = ZoneId.systemDefault();

        public Builder soundPath(Path v) {
            this.soundPath = v;
            return this;
        }

        public Builder soundExtension(String v) {
            this.soundExtension = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder clockPollMs(long v) {
            this.clockPollMs = v;
            return this;
        }

        public Builder zone(ZoneId v) {
            this.zone = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link CarillonConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public CarillonConfig build() {
            Objects.requireNonNull(soundPath, "soundPath required");
            Objects.requireNonNull(zone, "zone required");
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");

            if (soundExtension == null || !soundExtension.startsWith(".") || soundExtension.length() < 2) {
                throw new IllegalArgumentException(
                        "soundExtension must start with '.', got: " + soundExtension);
            }
            if (clockPollMs < 1 || clockPollMs > 500) {
                throw new IllegalArgumentException(
                        "clockPollMs must be in [1, 500], got: " + clockPollMs);
            }

            return new CarillonConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "CarillonConfig{" +
                "soundPath=" + soundPath +
                ", soundExtension='" + soundExtension + '\'' +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", clockPollMs=" + clockPollMs +
                ", zone=" + zone +
                '}';
    }
}
