package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import com.brandpillar.agent.bus.model.MessageTarget;

import java.util.List;

/**
 * Routing key conventions of the agent exchange.
 *
 * <pre>
 *   routingKey = target + "." + type        (target = agent type name or "broadcast")
 * </pre>
 *
 * Each agent queue is bound with {@code <agent>.*}, {@code broadcast.*} and {@code *.<agent>}.
 */
public final class RoutingKeys {

    private RoutingKeys() {
    }

    public static String forMessage(AgentMessage message) {
        String type = message.getType();
        if (type.isEmpty() || type.indexOf('.') >= 0) {
            throw new IllegalArgumentException(
                    "Message type must be a single non-empty routing word: '" + type + "'");
        }
        return message.getTarget().key() + "." + type;
    }

    public static List<String> bindingPatterns(AgentType agentType) {
        return List.of(
                agentType.name() + ".*",
                MessageTarget.BROADCAST_KEY + ".*",
                "*." + agentType.name()
        );
    }
}
