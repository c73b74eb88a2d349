package com.brandpillar.agent.bus;

import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;

import java.util.Set;

/**
 * Reliable publish/subscribe bus between agents over one topic exchange.
 *
 * <p>Addressing is carried by the routing key {@code <target>.<type>}:
 * <ul>
 *     <li>direct: a message targeting an agent type reaches that agent's queue</li>
 *     <li>broadcast: a message targeting {@code broadcast} reaches every agent queue</li>
 *     <li>type-keyed: a message whose type is an agent type name also reaches that agent</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * {@code
 * bus.connect();
 * bus.createDeadLetterExchange();
 * bus.subscribe(AgentType.PUBLISHER, message -> publishingService.handle(message));
 * bus.publish(message);
 * ...
 * bus.disconnect();
 * }
 * </pre>
 */
public interface AgentMessageBus extends AutoCloseable {

    /**
     * Dials the broker, opens the channel and declares the main exchange.
     * A no-op when already connected.
     *
     * @throws com.brandpillar.agent.bus.exception.MessageBusConnectionException if the broker cannot be reached
     */
    void connect();

    /**
     * Publishes a persistent message. Does not wait for any consumer.
     *
     * @throws com.brandpillar.agent.bus.exception.MessageBusNotConnectedException if there is no live channel
     */
    void publish(AgentMessage message);

    /**
     * Declares and binds the agent's queue and starts consuming it. Calling again for
     * the same agent type replaces the handler.
     *
     * @throws com.brandpillar.agent.bus.exception.MessageBusNotConnectedException if there is no live channel
     */
    void subscribe(AgentType agentType, AgentMessageHandler handler);

    /**
     * Declares the dead-letter exchange and the catch-all dead-letter queue. Idempotent.
     *
     * @throws com.brandpillar.agent.bus.exception.MessageBusNotConnectedException if there is no live channel
     */
    void createDeadLetterExchange();

    /**
     * Cancels pending reconnects and redeliveries, forgets all subscriptions and closes
     * the channel and connection. Idempotent; close errors are logged, not thrown.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Agent types with a registered handler.
     */
    Set<AgentType> subscriptions();

    /**
     * Disconnects and releases the bus' threads. The bus cannot be used afterwards.
     */
    @Override
    void close();
}
