package com.phillippitts.groundstation.service.delivery;

import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.exception.SynthesisException;
import com.phillippitts.groundstation.service.broker.Sleeper;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.session.SatelliteTransport;
import com.phillippitts.groundstation.service.speech.TextToSpeechClient;
import com.phillippitts.groundstation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains one session's delivery queue into speech on the satellite.
 *
 * <p>Each activation takes at most {@code batchSize} messages without blocking. Per message the
 * alert cue is sent first when requested, then the text is synthesized and the audio sent.
 * A failed synthesis skips the message; a failed send ends the batch, and the messages already
 * taken are lost. While the queue is empty the loop pauses for {@code idlePause}.
 *
 * <p>Lifecycle: {@link #start(Executor)} once, {@link #stop()} any number of times. Once stopped,
 * the loop never starts.
 */
public final class OutputDeliveryThrottle implements Runnable {

    private static final Logger LOG = LogManager.getLogger(OutputDeliveryThrottle.class);

    private final SatelliteTransport transport;
    private final BlockingQueue<BrokerMessage> queue;
    private final int sampleRate;
    private final TextToSpeechClient textToSpeech;
    private final GroundStationMetrics metrics;
    private final int batchSize;
    private final Duration idlePause;
    private final Duration stopTimeout;
    private final String alertCue;

    private final Lock lifecycleLock = new ReentrantLock();
    private boolean started;
    private boolean stopRequested;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean running;
    private volatile Thread worker;
    private volatile Sleeper sleeper = Sleeper.THREAD_SLEEP;

    public OutputDeliveryThrottle(SatelliteTransport transport,
                                  BlockingQueue<BrokerMessage> queue,
                                  int sampleRate,
                                  TextToSpeechClient textToSpeech,
                                  SatelliteProperties properties,
                                  GroundStationMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sampleRate = sampleRate;
        this.textToSpeech = Objects.requireNonNull(textToSpeech, "textToSpeech");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.batchSize = properties.getDeliveryBatchSize();
        this.idlePause = properties.getDeliveryIdlePause();
        this.stopTimeout = properties.getDeliveryStopTimeout();
        this.alertCue = properties.getAlertCue();
    }

    /**
     * Submits the drain loop.
     *
     * @return {@code false} if {@link #stop()} was already called; nothing is submitted
     * @throws IllegalStateException if already started
     * @throws java.util.concurrent.RejectedExecutionException if the executor has no free thread
     */
    public boolean start(Executor executor) {
        lifecycleLock.lock();
        try {
            if (stopRequested) {
                LOG.debug("Delivery loop stopped before start, not submitting");
                return false;
            }
            if (started) {
                throw new IllegalStateException("Delivery loop already started");
            }
            started = true;
            running = true;
        } finally {
            lifecycleLock.unlock();
        }
        try {
            executor.execute(this);
        } catch (RuntimeException e) {
            running = false;
            finished.countDown();
            throw e;
        }
        return true;
    }

    /**
     * Sends up to one batch of queued messages.
     *
     * @return number of messages taken from the queue
     */
    public int drainOnce() {
        int taken = 0;
        while (taken < batchSize) {
            BrokerMessage message = queue.poll();
            if (message == null) {
                break;
            }
            taken++;
            try {
                deliver(message);
            } catch (IOException e) {
                LOG.warn("Satellite send failed, ending batch after {} message(s): {}", taken, e.getMessage());
                break;
            }
        }
        return taken;
    }

    @Override
    public void run() {
        worker = Thread.currentThread();
        LOG.debug("Delivery loop started");
        try {
            while (running) {
                try {
                    if (drainOnce() == 0) {
                        sleeper.sleep(idlePause);
                    }
                } catch (RuntimeException e) {
                    LOG.error("Error processing broker responses", e);
                    sleeper.sleep(idlePause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            worker = null;
            finished.countDown();
            LOG.debug("Delivery loop stopped");
        }
    }

    /**
     * Stops the loop and waits, bounded by the configured timeout, for it to exit.
     * An in-flight synthesis call is interrupted.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (stopRequested) {
                return;
            }
            stopRequested = true;
            running = false;
            if (!started) {
                return;
            }
        } finally {
            lifecycleLock.unlock();
        }
        Thread current = worker;
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
        }
        if (current == Thread.currentThread()) {
            return;
        }
        try {
            if (!finished.await(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Delivery loop did not stop within {}", stopTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running && finished.getCount() > 0;
    }

    /** Visible for tests */
    void setSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    private void deliver(BrokerMessage message) throws IOException {
        if (message.playAlertBefore()) {
            transport.sendText(alertCue);
        }
        byte[] audio;
        try {
            audio = textToSpeech.synthesize(message.text(), sampleRate);
        } catch (SynthesisException e) {
            metrics.incrementTtsFailure();
            LOG.warn("Skipping response {}: {}", LogSanitizer.preview(message.text()), e.getMessage());
            return;
        }
        transport.sendBinary(audio);
        metrics.incrementTtsSuccess();
        LOG.debug("Sent {} bytes of speech for {}", audio.length, LogSanitizer.preview(message.text()));
    }
}
