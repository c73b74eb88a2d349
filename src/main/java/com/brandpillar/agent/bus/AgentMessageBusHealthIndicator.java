package com.brandpillar.agent.bus;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports {@code UP} while the bus holds a live channel and {@code DOWN} otherwise,
 * for instance while a reconnect is pending.
 */
@RequiredArgsConstructor
public class AgentMessageBusHealthIndicator implements HealthIndicator {

    private final AgentMessageBus bus;
    private final AgentMessageBusProperties properties;

    @Override
    public Health health() {
        Health.Builder builder = bus.isConnected() ? Health.up() : Health.down();
        return builder
                .withDetail("exchange", properties.getExchangeName())
                .withDetail("subscriptions", bus.subscriptions())
                .build();
    }
}
