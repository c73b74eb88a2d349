package com.brandpillar.agent.bus;

import com.brandpillar.agent.bus.broker.BrokerConnector;
import com.brandpillar.agent.bus.internal.AgentListenerProcessor;
import com.brandpillar.agent.bus.rabbitmq.RabbitBrokerConnector;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for the agent message bus.
 *
 * <p>Enabled by default; disable with:
 *
 * <pre>
 *   agent-bus.enabled = false
 * </pre>
 *
 * <p>The bus is supplied with the application's {@link ObjectMapper} and
 * {@link MeterRegistry} when they exist. Beans annotated with
 * {@link com.brandpillar.agent.bus.annotation.AgentListener} are subscribed on startup.
 */
@AutoConfiguration
@EnableConfigurationProperties(AgentMessageBusProperties.class)
@ConditionalOnProperty(prefix = "agent-bus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentMessageBusAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnector agentBusBrokerConnector() {
        return new RabbitBrokerConnector();
    }

    /**
     * Creates the bus. It is not connected here; {@link AgentListenerProcessor} connects
     * it once all singletons exist, or the application calls {@link AgentMessageBus#connect()}.
     *
     * @param objectMapper  application ObjectMapper, a default one is used when absent
     * @param meterRegistry application MeterRegistry, a {@link SimpleMeterRegistry} is used when absent
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(AgentMessageBus.class)
    public DefaultAgentMessageBus agentMessageBus(
            AgentMessageBusProperties properties,
            BrokerConnector brokerConnector,
            @Nullable ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry) {

        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();

        return new DefaultAgentMessageBus(properties, brokerConnector, mapper, registry);
    }

    @Bean
    public AgentListenerProcessor agentListenerProcessor(
            AgentMessageBus agentMessageBus,
            AgentMessageBusProperties properties,
            ApplicationContext context) {
        return new AgentListenerProcessor(agentMessageBus, properties, context);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean(name = "agentMessageBusHealthIndicator")
        @ConditionalOnMissingBean(name = "agentMessageBusHealthIndicator")
        public AgentMessageBusHealthIndicator agentMessageBusHealthIndicator(
                AgentMessageBus agentMessageBus,
                AgentMessageBusProperties properties) {
            return new AgentMessageBusHealthIndicator(agentMessageBus, properties);
        }
    }
}
