package com.phillippitts.groundstation.service.broker;

import com.phillippitts.groundstation.exception.BrokerConnectionException;

/**
 * Opens connections to the broker.
 */
@FunctionalInterface
public interface BrokerConnectionFactory {

    /**
     * Connects to the broker.
     *
     * @return an open connection
     * @throws BrokerConnectionException if the broker is unreachable or refuses the connection
     */
    BrokerConnection open();
}
