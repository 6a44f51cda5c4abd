/**
 * Service layer of the ground station.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.broker} - MQTT connection, reconnect loop, wire codec</li>
 *   <li>{@code service.session} - session registry and lifecycle</li>
 *   <li>{@code service.capture} - per-session command capture and transcription</li>
 *   <li>{@code service.delivery} - per-session throttled speech output</li>
 *   <li>{@code service.routing} - broker topic to session queue routing</li>
 *   <li>{@code service.speech} - HTTP clients for speech-to-text and text-to-speech</li>
 *   <li>{@code service.audio} - PCM helpers</li>
 *   <li>{@code service.health}, {@code service.metrics} - actuator integration</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions) and use constructor injection.
 */
package com.phillippitts.groundstation.service;
