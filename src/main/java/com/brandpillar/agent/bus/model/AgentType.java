package com.brandpillar.agent.bus.model;

import java.util.Locale;

/**
 * Closed set of worker roles on the bus.
 *
 * <p>An agent type is both a consumer identity (it owns exactly one queue) and an
 * addressable message target.
 */
public enum AgentType {

    NEWS_MONITOR,
    CONTENT_GENERATOR,
    QUALITY_CONTROL,
    PUBLISHER,
    LEARNING,
    ORCHESTRATOR;

    /**
     * Durable queue owned by this agent type, e.g. {@code agent.content_generator}.
     */
    public String queueName() {
        return "agent." + name().toLowerCase(Locale.ROOT);
    }
}
