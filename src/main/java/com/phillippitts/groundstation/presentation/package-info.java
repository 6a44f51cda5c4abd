/**
 * Presentation layer: the satellite WebSocket endpoint and the HTTP endpoints.
 *
 * <p>Presentation depends on services, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - {@code /satellite} endpoint; adapts Spring WebSocket
 *       sessions to {@link com.phillippitts.groundstation.service.session.SatelliteTransport}</li>
 *   <li>{@code presentation.controller} - health, readiness and text ingestion</li>
 *   <li>{@code presentation.exception} - maps domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers and handlers are thin adapters; session logic lives in services</li>
 *   <li>Controllers throw domain exceptions, the exception handler picks the status code</li>
 *   <li>Error bodies never carry exception messages or stack traces</li>
 * </ul>
 *
 * @see com.phillippitts.groundstation.presentation.websocket.SatelliteWebSocketHandler
 * @see com.phillippitts.groundstation.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.groundstation.presentation;
