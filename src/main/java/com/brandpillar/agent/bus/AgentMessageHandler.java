package com.brandpillar.agent.bus;

import com.brandpillar.agent.bus.model.AgentMessage;

/**
 * Business logic of one agent.
 *
 * <p>Returning normally acknowledges the message; throwing triggers a delayed
 * redelivery, and the message is dead-lettered once its attempts are exhausted.
 * Implementations may be invoked concurrently (up to the prefetch count), may see
 * the same message id more than once, and must not rely on delivery order.
 */
@FunctionalInterface
public interface AgentMessageHandler {

    void handle(AgentMessage message) throws Exception;
}
