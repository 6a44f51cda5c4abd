package com.phillippitts.groundstation.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static com.phillippitts.groundstation.service.audio.PcmFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.groundstation.service.audio.PcmFormat.PCM16_MAX;

/**
 * Renders the audible cue a satellite plays when its command could not be processed.
 *
 * <p>The cue is a sine tone with a linear fade-in and fade-out, so playback starts and ends
 * without a click. Output is PCM16LE mono at the session's sample rate.
 */
public final class ErrorToneGenerator {

    /** Tone frequency in Hz. */
    public static final int DEFAULT_FREQUENCY_HZ = 800;

    /** Tone length in seconds. */
    public static final double DEFAULT_DURATION_SECONDS = 0.5;

    /** Length of each fade ramp in seconds. */
    public static final double FADE_SECONDS = 0.05;

    private ErrorToneGenerator() {}

    /**
     * Renders the default error tone.
     */
    public static byte[] errorTone(int sampleRate) {
        return tone(sampleRate, DEFAULT_FREQUENCY_HZ, DEFAULT_DURATION_SECONDS);
    }

    /**
     * Renders a faded sine tone.
     *
     * @param sampleRate      samples per second, must be positive
     * @param frequencyHz     tone frequency
     * @param durationSeconds tone length
     * @return PCM16LE mono samples
     */
    public static byte[] tone(int sampleRate, int frequencyHz, double durationSeconds) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        int samples = (int) (sampleRate * durationSeconds);
        int fadeSamples = (int) (sampleRate * FADE_SECONDS);
        ByteBuffer out = ByteBuffer.allocate(samples * BYTES_PER_SAMPLE).order(ByteOrder.LITTLE_ENDIAN);

        for (int i = 0; i < samples; i++) {
            double t = (double) i / sampleRate;
            double value = Math.sin(2 * Math.PI * frequencyHz * t) * envelope(i, samples, fadeSamples);
            out.putShort((short) (value * PCM16_MAX));
        }
        return out.array();
    }

    private static double envelope(int index, int samples, int fadeSamples) {
        if (fadeSamples <= 1) {
            return 1.0;
        }
        if (index < fadeSamples) {
            return (double) index / (fadeSamples - 1);
        }
        int fromEnd = samples - 1 - index;
        if (fromEnd < fadeSamples) {
            return (double) fromEnd / (fadeSamples - 1);
        }
        return 1.0;
    }
}
