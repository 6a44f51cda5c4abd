package com.phillippitts.groundstation.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.groundstation.service.audio.PcmFormat.BYTES_PER_FLOAT_SAMPLE;
import static com.phillippitts.groundstation.service.audio.PcmFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.groundstation.service.audio.PcmFormat.PCM16_SCALE;

/**
 * Converts captured PCM16LE audio into the float32 representation the speech-to-text service
 * expects.
 *
 * <p>A trailing odd byte (half a sample) is ignored.
 */
public final class PcmConverter {

    private PcmConverter() {}

    /**
     * Concatenates buffered chunks in order.
     */
    public static byte[] concat(List<byte[]> chunks) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        int total = 0;
        for (byte[] chunk : chunks) {
            total += chunk.length;
        }
        byte[] joined = new byte[total];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, joined, offset, chunk.length);
            offset += chunk.length;
        }
        return joined;
    }

    /**
     * Converts PCM16LE samples to floats in [-1.0, 1.0) by dividing by 32768.
     * Silence stays zero.
     */
    public static float[] toFloat(byte[] pcm16le) {
        Objects.requireNonNull(pcm16le, "pcm16le must not be null");
        ByteBuffer in = ByteBuffer.wrap(pcm16le).order(ByteOrder.LITTLE_ENDIAN);
        float[] samples = new float[pcm16le.length / BYTES_PER_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = in.getShort() / PCM16_SCALE;
        }
        return samples;
    }

    /**
     * Serializes float samples as float32 little-endian bytes.
     */
    public static byte[] toFloat32LeBytes(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        ByteBuffer out = ByteBuffer.allocate(samples.length * BYTES_PER_FLOAT_SAMPLE)
                .order(ByteOrder.LITTLE_ENDIAN);
        for (float sample : samples) {
            out.putFloat(sample);
        }
        return out.array();
    }
}
