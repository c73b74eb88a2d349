package com.brandpillar.agent.bus.rabbitmq;

import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.broker.BrokerConnection;
import com.brandpillar.agent.bus.broker.BrokerConnector;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ implementation of {@link BrokerConnector}.
 *
 * <p>Every call dials a fresh connection from {@code agent-bus.url}; {@code amqps://}
 * URLs enable TLS. Client-side automatic recovery is switched off because the bus
 * re-declares its topology and consumers itself after a reconnect.
 */
@Slf4j
public class RabbitBrokerConnector implements BrokerConnector {

    private static final String CONNECTION_NAME = "agent-message-bus";

    @Override
    public BrokerConnection connect(AgentMessageBusProperties properties) {
        ConnectionFactory factory = createConnectionFactory(properties);

        try {
            Connection connection = factory.newConnection(CONNECTION_NAME);
            log.info("RabbitMQ connection opened: host={} port={} vhost={}",
                    factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new RabbitBrokerConnection(connection);
        } catch (IOException | TimeoutException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    ConnectionFactory createConnectionFactory(AgentMessageBusProperties properties) {
        ConnectionFactory factory = new ConnectionFactory();

        try {
            factory.setUri(properties.getUrl());
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException
                 | IllegalArgumentException e) {
            // the url may carry credentials, so neither the cause nor its message is kept
            log.error("Invalid agent-bus.url ({})", e.getClass().getSimpleName());
            throw new IllegalArgumentException("Invalid agent-bus.url");
        }

        factory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
        factory.setRequestedHeartbeat((int) properties.getRequestedHeartbeat().getSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        return factory;
    }
}
