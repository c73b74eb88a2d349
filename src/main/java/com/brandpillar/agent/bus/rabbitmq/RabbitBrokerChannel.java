package com.brandpillar.agent.bus.rabbitmq;

import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.broker.BrokerShutdownListener;
import com.brandpillar.agent.bus.broker.DeliveryListener;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.amqp.rabbit.support.DefaultMessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.MessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link BrokerChannel} backed by a native RabbitMQ client channel.
 *
 * <p>Message properties are converted with Spring AMQP's
 * {@link DefaultMessagePropertiesConverter}, so headers arrive as plain Java values.
 */
@Slf4j
class RabbitBrokerChannel implements BrokerChannel {

    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private final Channel channel;
    private final MessagePropertiesConverter converter = new DefaultMessagePropertiesConverter();

    RabbitBrokerChannel(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void basicQos(int prefetchCount) {
        try {
            channel.basicQos(prefetchCount);
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void declareExchange(Exchange exchange) {
        try {
            channel.exchangeDeclare(
                    exchange.getName(),
                    exchange.getType(),
                    exchange.isDurable(),
                    exchange.isAutoDelete(),
                    exchange.isInternal(),
                    exchange.getArguments());
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void declareQueue(Queue queue) {
        try {
            channel.queueDeclare(
                    queue.getName(),
                    queue.isDurable(),
                    queue.isExclusive(),
                    queue.isAutoDelete(),
                    queue.getArguments());
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void declareBinding(Binding binding) {
        if (!binding.isDestinationQueue()) {
            throw new IllegalArgumentException("Only queue bindings are supported: " + binding);
        }
        try {
            channel.queueBind(
                    binding.getDestination(),
                    binding.getExchange(),
                    binding.getRoutingKey(),
                    binding.getArguments());
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void publish(String exchange, String routingKey, Message message) {
        AMQP.BasicProperties properties =
                converter.fromMessageProperties(message.getMessageProperties(), CHARSET);
        try {
            channel.basicPublish(exchange, routingKey, false, properties, message.getBody());
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public String consume(String queue, DeliveryListener listener) {
        try {
            return channel.basicConsume(queue, false, new DefaultConsumer(channel) {

                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    MessageProperties messageProperties =
                            converter.toMessageProperties(properties, envelope, CHARSET);
                    messageProperties.setConsumerTag(consumerTag);
                    messageProperties.setConsumerQueue(queue);
                    listener.onDelivery(new Message(body, messageProperties));
                }

                @Override
                public void handleCancel(String consumerTag) {
                    log.warn("Consumer cancelled by broker: queue={} consumerTag={}", queue, consumerTag);
                }
            });
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void ack(long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) {
        try {
            channel.basicReject(deliveryTag, requeue);
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void addShutdownListener(BrokerShutdownListener listener) {
        channel.addShutdownListener(cause -> {
            if (!cause.isInitiatedByApplication()) {
                listener.onShutdown(cause);
            }
        });
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        RabbitUtils.closeChannel(channel);
    }
}
