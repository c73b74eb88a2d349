package com.brandpillar.agent.bus.broker;

import org.springframework.amqp.core.Message;

/**
 * Receives deliveries from a manual-acknowledgment consumer. The delivery tag is
 * available from {@link org.springframework.amqp.core.MessageProperties#getDeliveryTag()}.
 */
@FunctionalInterface
public interface DeliveryListener {

    void onDelivery(Message message);
}
