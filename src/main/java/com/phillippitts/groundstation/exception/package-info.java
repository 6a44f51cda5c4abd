/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.groundstation.exception.GroundStationException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.groundstation.exception.BrokerNotConnectedException} - publish
 *       attempted while the broker is down</li>
 *   <li>{@link com.phillippitts.groundstation.exception.BrokerConnectionException} - connect,
 *       read, subscribe or publish failed on the broker transport</li>
 *   <li>{@link com.phillippitts.groundstation.exception.MessageDecodingException} - broker
 *       payload is not valid UTF-8 JSON of the expected shape</li>
 *   <li>{@link com.phillippitts.groundstation.exception.SessionConfigException} - satellite
 *       handshake is malformed</li>
 *   <li>{@link com.phillippitts.groundstation.exception.InvalidTokenException} - text endpoint
 *       called without the configured token</li>
 *   <li>{@link com.phillippitts.groundstation.exception.TranscriptionException} and
 *       {@link com.phillippitts.groundstation.exception.SynthesisException} - speech service
 *       failures</li>
 * </ul>
 *
 * <p>Broker and speech failures are transient; decoding and handshake failures reject a single
 * message or session. None of them is fatal to the process.
 *
 * @see com.phillippitts.groundstation.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.groundstation.exception;
