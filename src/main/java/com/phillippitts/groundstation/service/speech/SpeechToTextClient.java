package com.phillippitts.groundstation.service.speech;

import com.phillippitts.groundstation.domain.TranscriptionResult;
import com.phillippitts.groundstation.exception.TranscriptionException;

/**
 * Contract for the external speech-to-text service.
 *
 * <p>Thread Safety: Implementations must be thread-safe; every satellite session calls the same
 * instance.
 */
public interface SpeechToTextClient {

    /**
     * Transcribes one spoken command.
     *
     * @param samples mono samples normalized to [-1.0, 1.0)
     * @return the transcription, never null
     * @throws TranscriptionException if the service times out, answers with an error status or
     *                                returns a body that fails validation
     */
    TranscriptionResult transcribe(float[] samples);
}
