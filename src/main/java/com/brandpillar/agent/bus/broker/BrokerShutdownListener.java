package com.brandpillar.agent.bus.broker;

/**
 * Callback for a connection or channel lost without the application asking for it.
 *
 * <p>Invoked on a broker client thread: implementations must not block.
 */
@FunctionalInterface
public interface BrokerShutdownListener {

    void onShutdown(Throwable cause);
}
