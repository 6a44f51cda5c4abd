package com.phillippitts.groundstation.testutil;

import com.phillippitts.groundstation.exception.SynthesisException;
import com.phillippitts.groundstation.service.speech.TextToSpeechClient;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Text-to-speech double: "audio" is the UTF-8 bytes of the text, so tests can read back what
 * was spoken. Texts listed in {@code failingTexts} throw.
 */
public class FakeTextToSpeechClient implements TextToSpeechClient {

    public volatile Set<String> failingTexts = Set.of();
    private final List<String> texts = new CopyOnWriteArrayList<>();
    private final List<Integer> sampleRates = new CopyOnWriteArrayList<>();

    @Override
    public byte[] synthesize(String text, int sampleRate) {
        texts.add(text);
        sampleRates.add(sampleRate);
        if (failingTexts.contains(text)) {
            throw new SynthesisException("tts failed for " + text);
        }
        return ("audio:" + text).getBytes(StandardCharsets.UTF_8);
    }

    public static String spoken(byte[] audio) {
        return new String(audio, StandardCharsets.UTF_8).substring("audio:".length());
    }

    public List<String> texts() {
        return List.copyOf(texts);
    }

    public List<Integer> sampleRates() {
        return List.copyOf(sampleRates);
    }
}
