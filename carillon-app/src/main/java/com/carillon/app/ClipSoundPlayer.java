package com.carillon.app;

import com.carillon.core.sound.PlaybackException;
import com.carillon.core.sound.SoundPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SoundPlayer} on top of {@code javax.sound.sampled}.
 *
 * <p>
 * The file is decoded to 16-bit signed PCM and streamed to the default
 * output line; {@link #play(Path)} returns once the line has drained. WAV and
 * AIFF are decoded by the JDK; MP3 by the {@code mp3spi} service provider on
 * the runtime classpath.
 * </p>
 *
 * @since 1.0.0
 */
public class ClipSoundPlayer implements SoundPlayer {

    private static final Logger LOG = LoggerFactory.getLogger(ClipSoundPlayer.class);

    private static final int BUFFER_BYTES = 16 * 1024;

    @Override
    public void play(Path soundFile) throws PlaybackException, InterruptedException {
        if (!Files.isReadable(soundFile)) {
            throw new PlaybackException(soundFile, "Sound file " + soundFile + " is missing or unreadable");
        }
        try (AudioInputStream encoded = AudioSystem.getAudioInputStream(soundFile.toFile())) {
            AudioFormat pcm = toPcm(encoded.getFormat());
            try (AudioInputStream decoded = AudioSystem.getAudioInputStream(pcm, encoded)) {
                stream(decoded, pcm);
            }
        } catch (UnsupportedAudioFileException e) {
            throw new PlaybackException(soundFile, "Unsupported audio format: " + soundFile, e);
        } catch (LineUnavailableException e) {
            throw new PlaybackException(soundFile, "Audio output unavailable: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new PlaybackException(soundFile, "Cannot decode " + soundFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PlaybackException(soundFile, "Failed to read " + soundFile + ": " + e.getMessage(), e);
        }
        LOG.debug("Finished playing {}", soundFile);
    }

    private static void stream(AudioInputStream decoded, AudioFormat pcm)
            throws LineUnavailableException, IOException, InterruptedException {
        SourceDataLine line = AudioSystem.getSourceDataLine(pcm);
        line.open(pcm);
        line.start();
        try {
            byte[] buffer = new byte[BUFFER_BYTES];
            int read;
            while ((read = decoded.read(buffer)) != -1) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Playback interrupted");
                }
                line.write(buffer, 0, read);
            }
            line.drain();
        } finally {
            line.stop();
            line.close();
        }
    }

    private static AudioFormat toPcm(AudioFormat source) {
        int channels = source.getChannels();
        return new AudioFormat(
                AudioFormat.Encoding.PCM_SIGNED,
                source.getSampleRate(),
                16,
                channels,
                channels * 2,
                source.getSampleRate(),
                false);
    }
}
