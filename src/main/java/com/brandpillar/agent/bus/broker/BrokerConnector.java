package com.brandpillar.agent.bus.broker;

import com.brandpillar.agent.bus.AgentMessageBusProperties;

/**
 * Dials a topic-exchange broker.
 *
 * <p>Implementations must not recover connections on their own; the bus owns the
 * reconnect policy. Failures are reported as Spring AMQP {@link org.springframework.amqp.AmqpException}s.
 */
@FunctionalInterface
public interface BrokerConnector {

    BrokerConnection connect(AgentMessageBusProperties properties);
}
