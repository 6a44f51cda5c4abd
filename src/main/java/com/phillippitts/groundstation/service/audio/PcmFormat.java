package com.phillippitts.groundstation.service.audio;

/**
 * Single source of truth for satellite audio sample layout.
 * Satellites stream and play 16-bit signed PCM, little-endian; the sample rate is per session.
 */
public final class PcmFormat {

    /** Bytes per 16-bit sample. */
    public static final int BYTES_PER_SAMPLE = 2;

    /** Bytes per float32 sample sent to the speech-to-text service. */
    public static final int BYTES_PER_FLOAT_SAMPLE = 4;

    /** Divisor mapping a signed 16-bit sample into [-1.0, 1.0). */
    public static final float PCM16_SCALE = 32768f;

    /** Largest positive 16-bit sample value, used when rendering generated tones. */
    public static final int PCM16_MAX = Short.MAX_VALUE;

    private PcmFormat() {}

    /**
     * Number of whole 16-bit samples in a byte count.
     */
    public static long sampleCount(long byteCount) {
        return byteCount / BYTES_PER_SAMPLE;
    }
}
