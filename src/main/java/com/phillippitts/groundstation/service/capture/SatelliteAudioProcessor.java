package com.phillippitts.groundstation.service.capture;

import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.domain.TranscriptionResult;
import com.phillippitts.groundstation.exception.BrokerConnectionException;
import com.phillippitts.groundstation.exception.BrokerNotConnectedException;
import com.phillippitts.groundstation.exception.TranscriptionException;
import com.phillippitts.groundstation.service.audio.ErrorToneGenerator;
import com.phillippitts.groundstation.service.audio.PcmConverter;
import com.phillippitts.groundstation.service.audio.PcmFormat;
import com.phillippitts.groundstation.service.broker.ClientRequestPublisher;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.session.SatelliteTransport;
import com.phillippitts.groundstation.service.speech.SpeechToTextClient;
import com.phillippitts.groundstation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns the control signals and audio chunks of one satellite into published requests.
 *
 * <p>Audio is buffered between {@code START_COMMAND} and {@code END_COMMAND}. The buffer is
 * flushed early when the command exceeds the configured duration, or when the next chunk would
 * push it past the byte cap (that chunk is discarded). A flush transcribes the audio, then
 * publishes a {@link com.phillippitts.groundstation.domain.ClientRequest}; if either step fails
 * the satellite hears an error tone instead.
 *
 * <p><b>Thread Safety:</b> State and buffer are guarded by a {@link ReentrantLock}. The
 * speech-to-text call and the publish run outside the lock while the state is
 * {@link CaptureState#PROCESSING_STT}; chunks and signals arriving meanwhile are ignored.
 */
public final class SatelliteAudioProcessor {

    private static final Logger LOG = LogManager.getLogger(SatelliteAudioProcessor.class);

    private final SatelliteTransport transport;
    private final SessionConfig config;
    private final SpeechToTextClient speechToText;
    private final ClientRequestPublisher requestPublisher;
    private final GroundStationMetrics metrics;
    private final int maxBufferBytes;
    private final long maxSamples;

    private final Lock lock = new ReentrantLock();
    private final List<byte[]> buffer = new ArrayList<>();
    private CaptureState state = CaptureState.IDLE;
    private long bufferedBytes;
    private long bufferedSamples;

    public SatelliteAudioProcessor(SatelliteTransport transport,
                                   SessionConfig config,
                                   SpeechToTextClient speechToText,
                                   ClientRequestPublisher requestPublisher,
                                   SatelliteProperties properties,
                                   GroundStationMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.speechToText = Objects.requireNonNull(speechToText, "speechToText");
        this.requestPublisher = Objects.requireNonNull(requestPublisher, "requestPublisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.maxBufferBytes = properties.getMaxBufferBytes();
        this.maxSamples = (long) properties.getMaxCommandInputSeconds() * config.samplerate();
    }

    /**
     * Applies a control signal. Signals that do not fit the current state are logged and ignored.
     */
    public void onControlSignal(ControlSignal signal) {
        LOG.debug("Received control signal: {}", signal);
        byte[] command = null;
        lock.lock();
        try {
            switch (signal) {
                case START_COMMAND -> {
                    if (state != CaptureState.IDLE) {
                        LOG.warn("Cannot start audio collection in state {}", state);
                        return;
                    }
                    clearBuffer();
                    state = CaptureState.COLLECTING_AUDIO;
                    LOG.info("Started collecting audio from satellite");
                }
                case END_COMMAND -> {
                    if (state != CaptureState.COLLECTING_AUDIO) {
                        LOG.warn("Cannot end audio collection in state {}", state);
                        return;
                    }
                    command = beginProcessing();
                }
                case CANCEL_COMMAND -> {
                    if (state != CaptureState.COLLECTING_AUDIO) {
                        LOG.warn("Nothing to cancel in state {}", state);
                        return;
                    }
                    clearBuffer();
                    state = CaptureState.IDLE;
                    LOG.info("Cancelled audio collection");
                }
                default -> throw new IllegalStateException("Unhandled signal " + signal);
            }
        } finally {
            lock.unlock();
        }
        process(command);
    }

    /**
     * Buffers one PCM16LE chunk, flushing when a duration or size limit is reached.
     */
    public void onAudio(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        byte[] command;
        lock.lock();
        try {
            if (state != CaptureState.COLLECTING_AUDIO) {
                LOG.warn("Received {} bytes of audio in state {}, ignoring", chunk.length, state);
                return;
            }
            if (bufferedBytes + chunk.length > maxBufferBytes) {
                LOG.warn("Audio buffer size limit of {} bytes reached, processing current audio", maxBufferBytes);
                command = beginProcessing();
            } else {
                buffer.add(chunk);
                bufferedBytes += chunk.length;
                bufferedSamples += PcmFormat.sampleCount(chunk.length);
                LOG.debug("Collected audio chunk (buffer size: {} bytes)", bufferedBytes);
                if (bufferedSamples <= maxSamples) {
                    return;
                }
                LOG.info("Maximum audio duration reached, processing current audio");
                command = beginProcessing();
            }
        } finally {
            lock.unlock();
        }
        process(command);
    }

    public CaptureState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public long bufferedBytes() {
        lock.lock();
        try {
            return bufferedBytes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must hold the lock. Returns the joined audio, or null when nothing was buffered.
     */
    private byte[] beginProcessing() {
        if (buffer.isEmpty()) {
            LOG.warn("No audio data to process");
            state = CaptureState.IDLE;
            return null;
        }
        byte[] command = PcmConverter.concat(buffer);
        clearBuffer();
        state = CaptureState.PROCESSING_STT;
        return command;
    }

    private void process(byte[] command) {
        if (command == null) {
            return;
        }
        try {
            float[] samples = PcmConverter.toFloat(command);
            LOG.info("Processing {} bytes of audio ({} samples)", command.length, samples.length);
            TranscriptionResult result = transcribe(samples);
            if (result != null) {
                publish(result.text());
            }
        } finally {
            lock.lock();
            try {
                clearBuffer();
                state = CaptureState.IDLE;
            } finally {
                lock.unlock();
            }
        }
    }

    private TranscriptionResult transcribe(float[] samples) {
        long start = System.nanoTime();
        try {
            TranscriptionResult result = speechToText.transcribe(samples);
            metrics.recordSttLatency(System.nanoTime() - start);
            metrics.incrementSttSuccess();
            LOG.info("STT result: {}", LogSanitizer.preview(result.text()));
            return result;
        } catch (TranscriptionException e) {
            metrics.incrementSttFailure(failureReason(e));
            LOG.error("Failed to get STT response: {}", e.getMessage());
            sendErrorTone();
            return null;
        } catch (RuntimeException e) {
            metrics.incrementSttFailure("unexpected");
            LOG.error("Unexpected speech-to-text failure", e);
            sendErrorTone();
            return null;
        }
    }

    private void publish(String text) {
        try {
            requestPublisher.publish(text, config.room(), config.outputTopic());
        } catch (BrokerNotConnectedException | BrokerConnectionException e) {
            metrics.incrementPublishFailure();
            LOG.error("Could not publish request for room {}: {}", config.room(), e.getMessage());
            sendErrorTone();
        } catch (RuntimeException e) {
            metrics.incrementPublishFailure();
            LOG.error("Unexpected failure publishing request for room {}", config.room(), e);
            sendErrorTone();
        }
    }

    private void sendErrorTone() {
        try {
            transport.sendBinary(ErrorToneGenerator.errorTone(config.samplerate()));
            LOG.debug("Sent error tone to satellite");
        } catch (IOException e) {
            LOG.error("Failed to send error tone: {}", e.getMessage());
        }
    }

    private void clearBuffer() {
        buffer.clear();
        bufferedBytes = 0;
        bufferedSamples = 0;
    }

    private static String failureReason(TranscriptionException e) {
        int status = e.getStatusCode();
        if (status == 0) {
            return "unavailable";
        }
        return status < 500 ? "http_4xx" : "http_5xx";
    }
}
