/**
 * MQTT broker connectivity.
 *
 * <p>{@link com.phillippitts.groundstation.service.broker.BrokerConnectionManager} owns the one
 * broker connection of the process. It connects on startup and reconnects with capped
 * exponential backoff. After every successful connect it re-subscribes the full subscription set.
 * Inbound messages are handed one at a time to an
 * {@link com.phillippitts.groundstation.service.broker.InboundMessageHandler}.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.groundstation.service.broker.BrokerConnection} - transport seam;
 *       Paho in production, an in-memory fake in tests</li>
 *   <li>{@link com.phillippitts.groundstation.service.broker.ReconnectBackoff} - delay sequence</li>
 *   <li>{@link com.phillippitts.groundstation.service.broker.MessageCodec} - JSON wire format</li>
 *   <li>{@link com.phillippitts.groundstation.service.broker.ClientRequestPublisher} - publishes
 *       transcribed or typed requests to the backend input topic</li>
 * </ul>
 *
 * <p>State changes are published as
 * {@link com.phillippitts.groundstation.service.broker.BrokerConnectionStateChangedEvent}.
 */
package com.phillippitts.groundstation.service.broker;
