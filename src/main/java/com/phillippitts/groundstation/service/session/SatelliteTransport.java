package com.phillippitts.groundstation.service.session;

import java.io.IOException;

/**
 * Bidirectional frame channel to one satellite.
 *
 * <p>Implementations must allow sends from the reader thread and the delivery thread at the
 * same time.
 */
public interface SatelliteTransport {

    /**
     * Connection identity, unique for the lifetime of the process.
     */
    String id();

    boolean isOpen();

    /**
     * Sends a text frame.
     *
     * @throws IOException if the transport is closed or the write fails
     */
    void sendText(String text) throws IOException;

    /**
     * Sends a binary frame.
     *
     * @throws IOException if the transport is closed or the write fails
     */
    void sendBinary(byte[] data) throws IOException;

    /**
     * Closes the transport with the given status. Never throws; closing twice is a no-op.
     */
    void close(SatelliteCloseReason reason);
}
