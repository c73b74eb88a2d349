package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.broker.BrokerChannel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;

import java.util.Objects;

/**
 * Settlement handle for one delivery, bound to the channel it arrived on.
 *
 * <p>Usage:
 * <pre>
 *   MessageContext ctx = MessageContext.of(channel, message);
 *   ctx.ack();           // acknowledge, the broker discards the message
 *   ctx.deadLetter();    // reject without requeue, the queue's DLX takes it
 *   ctx.requeue();       // reject with requeue
 * </pre>
 *
 * <p>A delivery tag is only meaningful on its own channel; after a reconnect the
 * settlement of an old delivery fails and the broker redelivers the message.
 * All broker failures are wrapped in {@link MessagingOperationException}.
 */
@Getter
@Accessors(fluent = true)
@Slf4j
public class MessageContext {

    private final BrokerChannel channel;
    private final long deliveryTag;
    private final String messageId;

    private MessageContext(BrokerChannel channel, long deliveryTag, String messageId) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.messageId = messageId;
    }

    public static MessageContext of(BrokerChannel channel, Message message) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return new MessageContext(
                channel,
                message.getMessageProperties().getDeliveryTag(),
                message.getMessageProperties().getMessageId());
    }

    /**
     * Acknowledge the delivery.
     *
     * @throws MessagingOperationException if the channel call fails
     */
    public void ack() {
        try {
            channel.ack(deliveryTag);
            log.debug("Ack successful (tag={}, messageId={})", deliveryTag, messageId);
        } catch (Exception e) {
            throw new MessagingOperationException("Failed to ack message " + messageId, e);
        }
    }

    /**
     * Reject the delivery without requeue so the broker routes it to the queue's
     * dead-letter exchange.
     *
     * @throws MessagingOperationException if the channel call fails
     */
    public void deadLetter() {
        try {
            channel.reject(deliveryTag, false);
            log.debug("Rejected without requeue (tag={}, messageId={})", deliveryTag, messageId);
        } catch (Exception e) {
            throw new MessagingOperationException("Failed to dead-letter message " + messageId, e);
        }
    }

    /**
     * Return the delivery to its queue for another consumer.
     *
     * @throws MessagingOperationException if the channel call fails
     */
    public void requeue() {
        try {
            channel.reject(deliveryTag, true);
            log.debug("Requeued (tag={}, messageId={})", deliveryTag, messageId);
        } catch (Exception e) {
            throw new MessagingOperationException("Failed to requeue message " + messageId, e);
        }
    }

    /**
     * Runtime exception used by {@link MessageContext} to wrap broker failures.
     */
    public static class MessagingOperationException extends RuntimeException {
        public MessagingOperationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
