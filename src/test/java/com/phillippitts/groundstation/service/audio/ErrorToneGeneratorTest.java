package com.phillippitts.groundstation.service.audio;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorToneGeneratorTest {

    @Test
    void defaultToneLastsHalfASecond() {
        assertThat(ErrorToneGenerator.errorTone(16000)).hasSize(16000);
        assertThat(ErrorToneGenerator.errorTone(44100)).hasSize(44100);
    }

    @Test
    void fadesInAndOut() {
        byte[] tone = ErrorToneGenerator.errorTone(16000);
        ByteBuffer in = ByteBuffer.wrap(tone).order(ByteOrder.LITTLE_ENDIAN);
        int samples = tone.length / PcmFormat.BYTES_PER_SAMPLE;

        assertThat(in.getShort(0)).isZero();
        assertThat(in.getShort((samples - 1) * PcmFormat.BYTES_PER_SAMPLE)).isZero();

        int peak = 0;
        for (int i = 0; i < samples; i++) {
            peak = Math.max(peak, Math.abs(in.getShort(i * PcmFormat.BYTES_PER_SAMPLE)));
        }
        assertThat(peak).isGreaterThan(30000);
    }

    @Test
    void rejectsNonPositiveSampleRate() {
        assertThatThrownBy(() -> ErrorToneGenerator.errorTone(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
