/**
 * Logging infrastructure: Log4j2 with ThreadContext (MDC) keys for correlation.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - set by
 *       {@link com.phillippitts.groundstation.config.logging.MdcFilter} for every HTTP request</li>
 *   <li>{@code deviceId} - X-Device-ID header, or the text endpoint's device_id</li>
 *   <li>{@code sessionId}, {@code room} - set while a satellite frame is handled</li>
 * </ul>
 */
package com.phillippitts.groundstation.config.logging;
