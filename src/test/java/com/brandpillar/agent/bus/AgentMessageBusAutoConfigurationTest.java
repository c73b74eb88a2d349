package com.brandpillar.agent.bus;

import com.brandpillar.agent.bus.annotation.AgentListener;
import com.brandpillar.agent.bus.broker.BrokerConnector;
import com.brandpillar.agent.bus.broker.InMemoryBroker;
import com.brandpillar.agent.bus.internal.AgentListenerProcessor;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import com.brandpillar.agent.bus.model.MessageTarget;
import com.brandpillar.agent.bus.rabbitmq.RabbitBrokerConnector;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AgentMessageBusAutoConfigurationTest {

    private final InMemoryBroker broker = new InMemoryBroker();

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentMessageBusAutoConfiguration.class))
            .withBean(BrokerConnector.class, () -> broker);

    @Test
    void registersBusProcessorAndHealthIndicator() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AgentMessageBus.class);
            assertThat(context).hasSingleBean(AgentMessageBusProperties.class);
            assertThat(context).hasSingleBean(AgentListenerProcessor.class);
            assertThat(context).hasSingleBean(AgentMessageBusHealthIndicator.class);
            assertThat(context.getBean(BrokerConnector.class)).isSameAs(broker);
        });
    }

    @Test
    void rabbitConnectorIsTheDefault() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(AgentMessageBusAutoConfiguration.class))
                .withPropertyValues("agent-bus.auto-connect=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(BrokerConnector.class);
                    assertThat(context.getBean(BrokerConnector.class)).isInstanceOf(RabbitBrokerConnector.class);
                    assertThat(context.getBean(AgentMessageBus.class).isConnected()).isFalse();
                });
    }

    @Test
    void canBeDisabled() {
        contextRunner.withPropertyValues("agent-bus.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(AgentMessageBus.class));
    }

    @Test
    void bindsProperties() {
        contextRunner.withPropertyValues(
                        "agent-bus.exchange-name=test.agents",
                        "agent-bus.prefetch-count=3",
                        "agent-bus.reconnect-delay=250ms",
                        "agent-bus.retry.max-attempts=5",
                        "agent-bus.retry.initial-delay=2s",
                        "agent-bus.dead-letter.enabled=false")
                .run(context -> {
                    AgentMessageBusProperties properties = context.getBean(AgentMessageBusProperties.class);
                    assertThat(properties.getExchangeName()).isEqualTo("test.agents");
                    assertThat(properties.getPrefetchCount()).isEqualTo(3);
                    assertThat(properties.getReconnectDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(5);
                    assertThat(properties.getRetry().getInitialDelay()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(properties.getDeadLetter().isEnabled()).isFalse();
                    assertThat(broker.hasExchange("test.agents.dlx")).isFalse();
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        contextRunner.withPropertyValues("agent-bus.prefetch-count=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void listenersAreSubscribedOnStartup() {
        contextRunner.withBean(PublisherListener.class)
                .run(context -> {
                    AgentMessageBus bus = context.getBean(AgentMessageBus.class);
                    assertThat(bus.isConnected()).isTrue();
                    assertThat(bus.subscriptions()).containsExactly(AgentType.PUBLISHER);
                    assertThat(broker.hasExchange("brandpillar.agents.dlx")).isTrue();
                    assertThat(broker.consumerCount(AgentType.PUBLISHER.queueName())).isEqualTo(1);

                    bus.publish(AgentMessage.builder()
                            .id("m1")
                            .type("PUBLISH")
                            .target(MessageTarget.of(AgentType.PUBLISHER))
                            .build());

                    PublisherListener listener = context.getBean(PublisherListener.class);
                    await().atMost(Duration.ofSeconds(2)).until(() -> listener.received.size() == 1);
                });
    }

    @Test
    void autoConnectCanBeTurnedOff() {
        contextRunner.withBean(PublisherListener.class)
                .withPropertyValues("agent-bus.auto-connect=false")
                .run(context -> {
                    AgentMessageBus bus = context.getBean(AgentMessageBus.class);
                    assertThat(bus.isConnected()).isFalse();
                    assertThat(bus.subscriptions()).isEmpty();
                    assertThat(broker.connectAttempts()).isZero();
                });
    }

    @Test
    void duplicateListenersFailStartup() {
        contextRunner.withBean("first", PublisherListener.class)
                .withBean("second", PublisherListener.class)
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("Duplicate @AgentListener for PUBLISHER"));
    }

    @Test
    void listenerMustImplementTheHandlerInterface() {
        contextRunner.withBean(NotAHandler.class)
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("must implement AgentMessageHandler"));
    }

    @Test
    void healthFollowsTheConnection() {
        contextRunner.run(context -> {
            AgentMessageBusHealthIndicator health = context.getBean(AgentMessageBusHealthIndicator.class);
            assertThat(health.health().getStatus()).isEqualTo(Status.UP);
            assertThat(health.health().getDetails()).containsEntry("exchange", "brandpillar.agents");

            context.getBean(AgentMessageBus.class).disconnect();

            assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
        });
    }

    @Test
    void busIsClosedWithTheContext() {
        contextRunner.run(context -> assertThat(broker.openConnections()).isEqualTo(1));

        assertThat(broker.openConnections()).isZero();
    }

    @AgentListener(value = AgentType.PUBLISHER, description = "test publisher")
    static class PublisherListener implements AgentMessageHandler {

        private final List<AgentMessage> received = new CopyOnWriteArrayList<>();

        @Override
        public void handle(AgentMessage message) {
            received.add(message);
        }
    }

    @AgentListener(AgentType.LEARNING)
    static class NotAHandler {
    }
}
