package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.model.AgentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

/**
 * Declares the bus topology:
 * <ul>
 *     <li>the durable main topic exchange</li>
 *     <li>one durable queue per agent type, with dead-letter exchange and TTL arguments,
 *     bound with the direct, broadcast and type-keyed patterns</li>
 *     <li>the dead-letter exchange {@code <exchange>.dlx} and its catch-all queue
 *     {@code <exchange>.dlq} bound with {@code #}</li>
 * </ul>
 *
 * <p>Every declaration is idempotent.
 */
@Slf4j
public class TopologyBootstrapper {

    private final String exchangeName;
    private final long queueTtlMillis;

    public TopologyBootstrapper(AgentMessageBusProperties properties) {
        this.exchangeName = properties.getExchangeName();
        this.queueTtlMillis = properties.getQueueTtl().toMillis();
    }

    public String exchangeName() {
        return exchangeName;
    }

    public String deadLetterExchangeName() {
        return exchangeName + ".dlx";
    }

    public String deadLetterQueueName() {
        return exchangeName + ".dlq";
    }

    public void declareMainExchange(BrokerChannel channel) {
        channel.declareExchange(mainExchange());
        log.debug("Declared exchange: {}", exchangeName);
    }

    public void declareDeadLetterTopology(BrokerChannel channel) {
        TopicExchange dlx = new TopicExchange(deadLetterExchangeName(), true, false);
        Queue dlq = QueueBuilder.durable(deadLetterQueueName()).build();

        channel.declareExchange(dlx);
        channel.declareQueue(dlq);
        channel.declareBinding(BindingBuilder.bind(dlq).to(dlx).with("#"));

        log.info("Dead letter exchange created: dlx={} dlq={}", dlx.getName(), dlq.getName());
    }

    public Queue declareAgentQueue(BrokerChannel channel, AgentType agentType) {
        Queue queue = QueueBuilder.durable(agentType.queueName())
                .withArgument("x-dead-letter-exchange", deadLetterExchangeName())
                .withArgument("x-message-ttl", queueTtlMillis)
                .build();
        channel.declareQueue(queue);

        TopicExchange exchange = mainExchange();
        for (String pattern : RoutingKeys.bindingPatterns(agentType)) {
            channel.declareBinding(BindingBuilder.bind(queue).to(exchange).with(pattern));
        }

        log.debug("Declared queue: queue={} exchange={} patterns={}",
                queue.getName(), exchangeName, RoutingKeys.bindingPatterns(agentType));
        return queue;
    }

    private TopicExchange mainExchange() {
        return new TopicExchange(exchangeName, true, false);
    }
}
