package com.phillippitts.groundstation.service.speech;

import com.phillippitts.groundstation.exception.SynthesisException;

/**
 * Contract for the external text-to-speech service.
 */
public interface TextToSpeechClient {

    /**
     * Synthesizes speech.
     *
     * @param text       text to speak
     * @param sampleRate sample rate of the satellite's speaker
     * @return raw audio bytes, at least {@value HttpTextToSpeechClient#MIN_AUDIO_BYTES} long
     * @throws SynthesisException if the service fails or returns too little audio
     */
    byte[] synthesize(String text, int sampleRate);
}
