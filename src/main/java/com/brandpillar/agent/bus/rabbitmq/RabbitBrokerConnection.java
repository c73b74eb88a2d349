package com.brandpillar.agent.bus.rabbitmq;

import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.broker.BrokerConnection;
import com.brandpillar.agent.bus.broker.BrokerShutdownListener;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpResourceNotAvailableException;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;

/**
 * {@link BrokerConnection} backed by a native RabbitMQ client connection.
 */
@Slf4j
@RequiredArgsConstructor
class RabbitBrokerConnection implements BrokerConnection {

    private final Connection connection;

    @Override
    public BrokerChannel createChannel() {
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new AmqpResourceNotAvailableException("The channel limit of the connection is exhausted");
            }
            return new RabbitBrokerChannel(channel);
        } catch (IOException | ShutdownSignalException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    @Override
    public void addShutdownListener(BrokerShutdownListener listener) {
        connection.addShutdownListener(cause -> {
            if (!cause.isInitiatedByApplication()) {
                listener.onShutdown(cause);
            }
        });
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void close() {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (AlreadyClosedException e) {
            log.debug("RabbitMQ connection already closed");
        } catch (IOException e) {
            log.warn("Failed to close RabbitMQ connection", e);
        }
    }
}
