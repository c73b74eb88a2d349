package com.brandpillar.agent.bus;

import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.broker.BrokerConnector;
import com.brandpillar.agent.bus.exception.MessageBusConnectionException;
import com.brandpillar.agent.bus.internal.AgentMessageCodec;
import com.brandpillar.agent.bus.internal.AgentMessagePublisher;
import com.brandpillar.agent.bus.internal.BusMetrics;
import com.brandpillar.agent.bus.internal.ConnectionManager;
import com.brandpillar.agent.bus.internal.ConsumerRegistry;
import com.brandpillar.agent.bus.internal.DeliveryPipeline;
import com.brandpillar.agent.bus.internal.ReconnectionSupervisor;
import com.brandpillar.agent.bus.internal.RetryPolicy;
import com.brandpillar.agent.bus.internal.RetryScheduler;
import com.brandpillar.agent.bus.internal.TopologyBootstrapper;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * {@link AgentMessageBus} over a single broker connection and channel.
 *
 * <p>The bus owns two thread pools: a single timer thread for redeliveries and
 * reconnects, and a cached pool that runs handlers. Both are released by
 * {@link #close()}. All state is per instance, so several buses may share a JVM.
 */
@Slf4j
public class DefaultAgentMessageBus implements AgentMessageBus {

    private final ScheduledThreadPoolExecutor scheduler;
    private final ExecutorService handlerExecutor;

    private final ConsumerRegistry registry = new ConsumerRegistry();
    private final TopologyBootstrapper topology;
    private final ConnectionManager connectionManager;
    private final AgentMessagePublisher publisher;
    private final RetryScheduler retryScheduler;
    private final DeliveryPipeline pipeline;
    private final ReconnectionSupervisor supervisor;

    private final Object lifecycle = new Object();

    /** Consumer tags on {@link #consumerChannel}, which is the channel they were started on. */
    private final Map<AgentType, String> consumerTags = new EnumMap<>(AgentType.class);
    private BrokerChannel consumerChannel;

    private volatile boolean closed;

    public DefaultAgentMessageBus(AgentMessageBusProperties properties,
                                  BrokerConnector connector,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry) {
        Objects.requireNonNull(properties, "properties must not be null");
        Objects.requireNonNull(connector, "connector must not be null");

        this.scheduler = new ScheduledThreadPoolExecutor(1, threadFactory("agent-bus-timer-"));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.handlerExecutor = Executors.newCachedThreadPool(threadFactory("agent-bus-handler-"));

        BusMetrics metrics = new BusMetrics(meterRegistry);
        AgentMessageCodec codec = new AgentMessageCodec(objectMapper);

        this.topology = new TopologyBootstrapper(properties);
        this.supervisor = new ReconnectionSupervisor(
                scheduler, properties.getReconnectDelay(), this::reconnect, this::isConnected);
        this.connectionManager = new ConnectionManager(
                properties, connector, topology, supervisor::scheduleReconnect);
        this.publisher = new AgentMessagePublisher(connectionManager, topology, codec, metrics);
        this.retryScheduler = new RetryScheduler(scheduler, publisher, properties.getReconnectDelay());
        this.pipeline = new DeliveryPipeline(
                registry, codec, RetryPolicy.from(properties.getRetry()), retryScheduler, metrics, handlerExecutor);
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    @Override
    public void connect() {
        synchronized (lifecycle) {
            ensureOpen();
            supervisor.resume();
            if (connectionManager.isConnected()) {
                return;
            }
            try {
                connectAndRestore();
            } catch (MessageBusConnectionException e) {
                supervisor.cancel();
                throw e;
            }
        }
    }

    @Override
    public void disconnect() {
        supervisor.cancel();

        synchronized (lifecycle) {
            retryScheduler.cancelAll();
            registry.clear();
            consumerTags.clear();
            consumerChannel = null;

            if (connectionManager.disconnect()) {
                log.info("Disconnected from message broker");
            }
        }
    }

    @Override
    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        disconnect();
        closed = true;
        scheduler.shutdownNow();
        handlerExecutor.shutdown();
    }

    // =====================================================================
    // MESSAGING
    // =====================================================================

    @Override
    public void publish(AgentMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        publisher.publish(message);
    }

    @Override
    public void subscribe(AgentType agentType, AgentMessageHandler handler) {
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        synchronized (lifecycle) {
            BrokerChannel channel = connectionManager.currentChannel();
            topology.declareAgentQueue(channel, agentType);

            boolean replaced = registry.register(agentType, handler).isPresent();
            startConsumer(agentType, channel);

            if (replaced) {
                log.info("Handler replaced → agentType={}", agentType);
            }
        }
    }

    @Override
    public void createDeadLetterExchange() {
        synchronized (lifecycle) {
            topology.declareDeadLetterTopology(connectionManager.currentChannel());
        }
    }

    @Override
    public Set<AgentType> subscriptions() {
        return registry.agentTypes();
    }

    int pendingRedeliveries() {
        return retryScheduler.pendingCount();
    }

    boolean isReconnectPending() {
        return supervisor.isReconnectPending();
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private void reconnect() {
        synchronized (lifecycle) {
            if (closed || supervisor.isCancelled() || connectionManager.isConnected()) {
                return;
            }
            log.info("Reconnecting to message broker...");
            connectAndRestore();
        }
    }

    /**
     * Connects and re-subscribes every registered agent type. A failure while restoring
     * drops the fresh connection so the next attempt starts clean.
     */
    private void connectAndRestore() {
        BrokerChannel channel = connectionManager.connect();

        Set<AgentType> agentTypes = registry.agentTypes();
        try {
            for (AgentType agentType : agentTypes) {
                topology.declareAgentQueue(channel, agentType);
                startConsumer(agentType, channel);
            }
        } catch (RuntimeException e) {
            connectionManager.disconnect();
            throw new MessageBusConnectionException("Failed to restore subscriptions", e);
        }

        if (!agentTypes.isEmpty()) {
            log.info("Restored {} subscription(s): {}", agentTypes.size(), agentTypes);
        }
    }

    private void startConsumer(AgentType agentType, BrokerChannel channel) {
        if (consumerChannel != channel) {
            consumerTags.clear();
            consumerChannel = channel;
        }
        if (consumerTags.containsKey(agentType)) {
            return;
        }

        String consumerTag = channel.consume(agentType.queueName(), pipeline.listenerFor(agentType, channel));
        consumerTags.put(agentType, consumerTag);

        log.info("Subscribed → agentType={} queue={} consumerTag={}",
                agentType, agentType.queueName(), consumerTag);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Message bus is closed");
        }
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
