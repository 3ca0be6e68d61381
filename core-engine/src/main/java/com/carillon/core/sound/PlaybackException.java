package com.carillon.core.sound;

import java.nio.file.Path;

/**
 * Thrown when a sound cannot be played: the file is missing, unreadable, or
 * cannot be decoded, or the audio line cannot be opened.
 *
 * @since 1.0.0
 */
public final class PlaybackException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path soundFile;

    public PlaybackException(Path soundFile, String message) {
        super(message);
        this.soundFile = soundFile;
    }

    public PlaybackException(Path soundFile, String message, Throwable cause) {
        super(message, cause);
        this.soundFile = soundFile;
    }

    /** The file that failed to play. */
    public Path soundFile() {
        return soundFile;
    }
}
