package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.model.AgentType;
import com.brandpillar.agent.bus.model.MessageTarget;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters of the bus, tagged by target or agent queue.
 */
@RequiredArgsConstructor
public class BusMetrics {

    private final MeterRegistry meterRegistry;

    void published(MessageTarget target) {
        meterRegistry.counter("agent.bus.publish", "target", target.key()).increment();
    }

    void consumed(AgentType agentType, long durationNs) {
        meterRegistry.timer("agent.bus.consume.latency", "queue", agentType.queueName())
                .record(durationNs, TimeUnit.NANOSECONDS);
        meterRegistry.counter("agent.bus.consume.success", "queue", agentType.queueName()).increment();
    }

    void failed(AgentType agentType) {
        meterRegistry.counter("agent.bus.consume.failure", "queue", agentType.queueName()).increment();
    }

    void retried(AgentType agentType) {
        meterRegistry.counter("agent.bus.consume.retry", "queue", agentType.queueName()).increment();
    }

    void deadLettered(AgentType agentType, String reason) {
        meterRegistry.counter("agent.bus.consume.dead-letter",
                "queue", agentType.queueName(), "reason", reason).increment();
    }
}
