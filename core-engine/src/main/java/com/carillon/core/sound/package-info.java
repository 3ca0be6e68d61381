/**
 * Sound resolution and the audio output boundary.
 *
 * <p>
 * {@link com.carillon.core.sound.SoundLibrary} turns rule sound references
 * into files; {@link com.carillon.core.sound.SoundPlayer} is implemented by
 * the application with the platform's audio stack.
 * </p>
 *
 * @since 1.0.0
 */
package com.carillon.core.sound;
