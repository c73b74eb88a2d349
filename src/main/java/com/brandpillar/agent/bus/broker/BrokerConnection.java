package com.brandpillar.agent.bus.broker;

/**
 * One live broker connection.
 */
public interface BrokerConnection extends AutoCloseable {

    BrokerChannel createChannel();

    /**
     * Registers a listener told about shutdowns the application did not initiate.
     */
    void addShutdownListener(BrokerShutdownListener listener);

    boolean isOpen();

    /**
     * Closes the connection. Errors are not propagated.
     */
    @Override
    void close();
}
