package com.phillippitts.groundstation.service.capture;

/**
 * Phases of one satellite's command capture.
 *
 * <pre>
 * IDLE → COLLECTING_AUDIO (START_COMMAND)
 * COLLECTING_AUDIO → PROCESSING_STT (END_COMMAND, duration or size limit)
 * COLLECTING_AUDIO → IDLE (CANCEL_COMMAND)
 * PROCESSING_STT → IDLE (always, after transcription and publish)
 * </pre>
 */
public enum CaptureState {
    IDLE,
    COLLECTING_AUDIO,
    PROCESSING_STT
}
