package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.broker.BrokerConnection;
import com.brandpillar.agent.bus.broker.BrokerConnector;
import com.brandpillar.agent.bus.exception.MessageBusConnectionException;
import com.brandpillar.agent.bus.exception.MessageBusNotConnectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the broker connection and its single channel.
 *
 * <p>An unexpected shutdown of either marks the bus disconnected and runs the
 * connection-lost callback; the stale resources are released by the next
 * {@link #connect()}. Shutdown callbacks run on the broker client's threads and
 * never wait for the monitor, since closing a channel needs those threads.
 */
@Slf4j
public class ConnectionManager {

    private final AgentMessageBusProperties properties;
    private final BrokerConnector connector;
    private final TopologyBootstrapper topology;
    private final Runnable onConnectionLost;

    private final Object monitor = new Object();

    private volatile BrokerConnection connection;
    private volatile BrokerChannel channel;
    private final AtomicBoolean connected = new AtomicBoolean();

    public ConnectionManager(AgentMessageBusProperties properties,
                             BrokerConnector connector,
                             TopologyBootstrapper topology,
                             Runnable onConnectionLost) {
        this.properties = properties;
        this.connector = connector;
        this.topology = topology;
        this.onConnectionLost = onConnectionLost;
    }

    /**
     * Dials the broker, opens the channel, applies the prefetch and declares the main
     * exchange. Returns the live channel unchanged when already connected.
     *
     * @throws MessageBusConnectionException if any step fails
     */
    public BrokerChannel connect() {
        BrokerChannel newChannel;
        synchronized (monitor) {
            if (connected.get()) {
                return channel;
            }
            release(channel, connection);
            channel = null;
            connection = null;

            BrokerConnection newConnection = null;
            try {
                newConnection = connector.connect(properties);
                newChannel = newConnection.createChannel();
                newChannel.basicQos(properties.getPrefetchCount());
                topology.declareMainExchange(newChannel);

                // listeners run at once on a resource that is already closed
                connection = newConnection;
                channel = newChannel;
                connected.set(true);

                BrokerConnection owner = newConnection;
                newConnection.addShutdownListener(cause -> connectionLost(owner, "connection", cause));
                newChannel.addShutdownListener(cause -> connectionLost(owner, "channel", cause));

                if (!newConnection.isOpen() || !newChannel.isOpen()) {
                    throw new AmqpConnectException("Broker closed the connection during setup", null);
                }
            } catch (RuntimeException e) {
                connected.set(false);
                connection = null;
                channel = null;
                if (newConnection != null) {
                    newConnection.close();
                }
                log.error("Failed to connect to message broker: {}", e.getMessage());
                throw new MessageBusConnectionException("Failed to connect to message broker", e);
            }
        }

        log.info("Connected to message broker: exchange={} prefetch={}",
                properties.getExchangeName(), properties.getPrefetchCount());
        return newChannel;
    }

    /**
     * @throws MessageBusNotConnectedException if there is no live channel
     */
    public BrokerChannel currentChannel() {
        BrokerChannel current = channel;
        if (!connected.get() || current == null) {
            throw new MessageBusNotConnectedException("Message bus not connected");
        }
        return current;
    }

    public boolean isConnected() {
        return connected.get();
    }

    /**
     * Closes channel then connection. Safe to call repeatedly.
     *
     * @return whether the bus was connected
     */
    public boolean disconnect() {
        BrokerChannel oldChannel;
        BrokerConnection oldConnection;
        boolean wasConnected;
        synchronized (monitor) {
            wasConnected = connected.getAndSet(false);
            oldChannel = channel;
            oldConnection = connection;
            channel = null;
            connection = null;
        }
        release(oldChannel, oldConnection);
        return wasConnected;
    }

    private void connectionLost(BrokerConnection owner, String resource, Throwable cause) {
        if (owner != connection || !connected.compareAndSet(true, false)) {
            return;
        }
        log.error("Broker {} lost: {}", resource, cause.getMessage());
        onConnectionLost.run();
    }

    private static void release(BrokerChannel oldChannel, BrokerConnection oldConnection) {
        try {
            if (oldChannel != null) {
                oldChannel.close();
            }
            if (oldConnection != null) {
                oldConnection.close();
            }
        } catch (RuntimeException e) {
            log.warn("Error while closing broker resources", e);
        }
    }
}
