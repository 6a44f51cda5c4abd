package com.phillippitts.groundstation.service.capture;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.exception.BrokerNotConnectedException;
import com.phillippitts.groundstation.service.broker.ClientRequestPublisher;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import com.phillippitts.groundstation.service.speech.SpeechToTextClient;
import com.phillippitts.groundstation.testutil.FakeSpeechToTextClient;
import com.phillippitts.groundstation.testutil.RecordingTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.phillippitts.groundstation.service.capture.ControlSignal.CANCEL_COMMAND;
import static com.phillippitts.groundstation.service.capture.ControlSignal.END_COMMAND;
import static com.phillippitts.groundstation.service.capture.ControlSignal.START_COMMAND;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SatelliteAudioProcessorTest {

    private static final int SAMPLE_RATE = 16000;
    /** 0.5 s error tone at 16 kHz, 16-bit mono. */
    private static final int ERROR_TONE_BYTES = 16000;

    private RecordingTransport transport;
    private FakeSpeechToTextClient stt;
    private ClientRequestPublisher publisher;
    private SatelliteProperties properties;
    private GroundStationMetrics metrics;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport("ws-1");
        stt = new FakeSpeechToTextClient("turn on the lights");
        publisher = mock(ClientRequestPublisher.class);
        properties = new SatelliteProperties();
        BrokerProperties brokerProperties = new BrokerProperties();
        brokerProperties.setClientId("test-station");
        metrics = new GroundStationMetrics(new SimpleMeterRegistry(), new SessionRegistry(brokerProperties));
    }

    @Test
    void ignoresAudioWhileIdle() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onAudio(new byte[320]);

        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
        assertThat(processor.bufferedBytes()).isZero();
    }

    @Test
    void transcribesAndPublishesOnEndCommand() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onAudio(new byte[320]);
        assertThat(processor.bufferedBytes()).isEqualTo(640);
        processor.onControlSignal(END_COMMAND);

        assertThat(stt.requests()).singleElement().satisfies(samples -> assertThat(samples).hasSize(320));
        verify(publisher).publish("turn on the lights", "kitchen", "assistant/kitchen/output");
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
        assertThat(processor.bufferedBytes()).isZero();
        assertThat(transport.frames()).isEmpty();
    }

    @Test
    void convertsSignedPcmToUnitRangeFloats() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[]{0x00, (byte) 0x80, (byte) 0xFF, 0x7F, 0x00, 0x00, 0x00, 0x40});
        processor.onControlSignal(END_COMMAND);

        float[] samples = stt.requests().get(0);
        assertThat(samples).containsExactly(-1.0f, 32767f / 32768f, 0.0f, 0.5f);
    }

    @Test
    void chunkThatWouldOverflowBufferIsDiscardedAndBufferFlushed() {
        properties.setMaxBufferBytes(1000);
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[600]);
        processor.onAudio(new byte[600]);

        assertThat(stt.requests()).singleElement().satisfies(samples -> assertThat(samples).hasSize(300));
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
        assertThat(processor.bufferedBytes()).isZero();
    }

    @Test
    void flushesWhenCommandExceedsMaximumDuration() {
        properties.setMaxCommandInputSeconds(1);
        SatelliteAudioProcessor processor = newProcessor();
        byte[] halfSecond = new byte[SAMPLE_RATE];

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(halfSecond);
        processor.onAudio(halfSecond);
        assertThat(stt.requests()).isEmpty();
        processor.onAudio(halfSecond);

        assertThat(stt.requests()).singleElement()
                .satisfies(samples -> assertThat(samples).hasSize(3 * SAMPLE_RATE / 2));
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void cancelDiscardsBufferedAudio() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(CANCEL_COMMAND);

        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
        assertThat(processor.bufferedBytes()).isZero();
        assertThat(stt.requests()).isEmpty();
    }

    @Test
    void signalsOutOfStateAreIgnored() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(END_COMMAND);
        processor.onControlSignal(CANCEL_COMMAND);
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(START_COMMAND);

        assertThat(processor.state()).isEqualTo(CaptureState.COLLECTING_AUDIO);
        assertThat(processor.bufferedBytes()).isEqualTo(320);
        assertThat(stt.requests()).isEmpty();
    }

    @Test
    void endWithoutAudioReturnsToIdleWithoutTranscribing() {
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onControlSignal(END_COMMAND);

        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
        assertThat(stt.requests()).isEmpty();
        assertThat(transport.frames()).isEmpty();
    }

    @Test
    void transcriptionFailureSendsErrorTone() {
        stt.shouldFail = true;
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(END_COMMAND);

        assertThat(transport.binaries()).singleElement()
                .satisfies(tone -> assertThat(tone).hasSize(ERROR_TONE_BYTES));
        verify(publisher, never()).publish(anyString(), anyString(), anyString());
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void publishFailureSendsErrorTone() {
        when(publisher.publish(any(), any(), any())).thenThrow(new BrokerNotConnectedException("input"));
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(END_COMMAND);

        assertThat(transport.binaries()).hasSize(1);
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void unexpectedTranscriberErrorSendsErrorToneAndReturnsToIdle() {
        SpeechToTextClient failing = samples -> {
            throw new IllegalStateException("boom");
        };
        SessionConfig config = new SessionConfig(SAMPLE_RATE, 1, 1, 512, "kitchen", null);
        SatelliteAudioProcessor processor =
                new SatelliteAudioProcessor(transport, config, failing, publisher, properties, metrics);

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(END_COMMAND);

        assertThat(transport.binaries()).singleElement()
                .satisfies(tone -> assertThat(tone).hasSize(ERROR_TONE_BYTES));
        verify(publisher, never()).publish(anyString(), anyString(), anyString());
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void unexpectedPublisherErrorSendsErrorTone() {
        when(publisher.publish(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(END_COMMAND);

        assertThat(transport.binaries()).hasSize(1);
        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void errorToneFailureOnClosedTransportIsSwallowed() {
        stt.shouldFail = true;
        transport.failSends = true;
        SatelliteAudioProcessor processor = newProcessor();

        processor.onControlSignal(START_COMMAND);
        processor.onAudio(new byte[320]);
        processor.onControlSignal(END_COMMAND);

        assertThat(processor.state()).isEqualTo(CaptureState.IDLE);
    }

    @Test
    void parsesOnlyExactSignalNames() {
        assertThat(ControlSignal.fromWire("START_COMMAND")).contains(START_COMMAND);
        assertThat(ControlSignal.fromWire("start_command")).isEmpty();
        assertThat(ControlSignal.fromWire("DANCE")).isEmpty();
        assertThat(ControlSignal.fromWire(null)).isEmpty();
    }

    private SatelliteAudioProcessor newProcessor() {
        SessionConfig config = new SessionConfig(SAMPLE_RATE, 1, 1, 512, "kitchen", null);
        return new SatelliteAudioProcessor(transport, config, stt, publisher, properties, metrics);
    }
}
