package com.brandpillar.agent.bus.broker;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.Queue;

/**
 * AMQP channel operations used by the bus.
 *
 * <p>Declarations take Spring AMQP declarables and are idempotent when repeated with
 * the same arguments. All methods report failures as unchecked
 * {@link org.springframework.amqp.AmqpException}s.
 */
public interface BrokerChannel extends AutoCloseable {

    /** Name of the broker's default direct exchange, which routes by queue name. */
    String DEFAULT_EXCHANGE = "";

    void basicQos(int prefetchCount);

    void declareExchange(Exchange exchange);

    void declareQueue(Queue queue);

    void declareBinding(Binding binding);

    void publish(String exchange, String routingKey, Message message);

    /**
     * Starts a manual-acknowledgment consumer.
     *
     * @return the consumer tag
     */
    String consume(String queue, DeliveryListener listener);

    void ack(long deliveryTag);

    /**
     * Rejects a single delivery. Without requeue the broker dead-letters it when the
     * queue has a dead-letter exchange, and drops it otherwise.
     */
    void reject(long deliveryTag, boolean requeue);

    void addShutdownListener(BrokerShutdownListener listener);

    boolean isOpen();

    /**
     * Closes the channel. Errors are not propagated.
     */
    @Override
    void close();
}
