package com.phillippitts.groundstation.service.capture;

import java.util.Arrays;
import java.util.Optional;

/**
 * Text control frames a satellite sends around a spoken command.
 */
public enum ControlSignal {
    START_COMMAND,
    END_COMMAND,
    CANCEL_COMMAND;

    /**
     * Parses the exact wire form of a signal.
     *
     * @return the signal, or empty for unknown text
     */
    public static Optional<ControlSignal> fromWire(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(signal -> signal.name().equals(text))
                .findFirst();
    }
}
