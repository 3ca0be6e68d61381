package com.carillon.core.sound;

import java.nio.file.Path;

/**
 * Platform audio output.
 *
 * <p>
 * {@link #play(Path)} blocks the calling thread until the sound has finished.
 * Implementations are called from the playout thread only, one sound at a
 * time.
 * </p>
 */
@FunctionalInterface
public interface SoundPlayer {

    /**
     * Play a sound file to completion.
     *
     * @param soundFile resolved file to play
     * @throws PlaybackException    if the file is missing or cannot be played
     * @throws InterruptedException if the playout thread is interrupted while
     *                              waiting for the sound to finish
     */
    void play(Path soundFile) throws PlaybackException, InterruptedException;
}
