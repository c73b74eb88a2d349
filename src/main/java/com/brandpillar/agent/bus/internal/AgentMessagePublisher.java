package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.exception.MessagePublishException;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;

/**
 * Sends agent messages on the current channel.
 *
 * <p>Regular publishes go to the agent exchange under {@code <target>.<type>}.
 * Redeliveries go through the default exchange straight to the queue that failed
 * them, so a failed broadcast is not fanned out to every agent again.
 */
@Slf4j
@RequiredArgsConstructor
public class AgentMessagePublisher {

    private final ConnectionManager connectionManager;
    private final TopologyBootstrapper topology;
    private final AgentMessageCodec codec;
    private final BusMetrics metrics;

    /**
     * @throws com.brandpillar.agent.bus.exception.MessageBusNotConnectedException if there is no live channel
     * @throws MessagePublishException if the broker rejects the publish
     */
    public void publish(AgentMessage message) {
        String routingKey = RoutingKeys.forMessage(message);
        send(topology.exchangeName(), routingKey, message);

        metrics.published(message.getTarget());
        log.debug("Message published: id={} type={} routingKey={}",
                message.getId(), message.getType(), routingKey);
    }

    /**
     * Sends a redelivery of {@code message} to the queue of {@code agentType}.
     */
    public void republish(AgentType agentType, AgentMessage message) {
        send(BrokerChannel.DEFAULT_EXCHANGE, agentType.queueName(), message);

        log.debug("Message redelivered: id={} queue={} retryCount={}",
                message.getId(), agentType.queueName(), message.getRetryCount());
    }

    private void send(String exchange, String routingKey, AgentMessage message) {
        BrokerChannel channel = connectionManager.currentChannel();
        Message amqpMessage = codec.encode(message);

        try {
            channel.publish(exchange, routingKey, amqpMessage);
        } catch (AmqpException ex) {
            log.error("Failed to publish message id={} routingKey={}", message.getId(), routingKey, ex);
            throw new MessagePublishException("Failed to publish message " + message.getId(), ex);
        }
    }
}
