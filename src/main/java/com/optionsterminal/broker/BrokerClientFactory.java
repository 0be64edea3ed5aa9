package com.optionsterminal.broker;

/**
 * Establishes an authenticated broker session. One client is created per gateway
 * session and discarded on disconnect.
 */
public interface BrokerClientFactory {

    /**
     * @throws com.optionsterminal.exception.BrokerException if the broker rejects the credentials
     */
    BrokerClient createSession(BrokerCredentials credentials);
}
