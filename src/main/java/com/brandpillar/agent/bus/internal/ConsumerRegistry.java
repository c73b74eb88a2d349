package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageHandler;
import com.brandpillar.agent.bus.model.AgentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Handler per agent type. At most one handler is registered for a queue; the
 * registry survives reconnects so consumers can be replayed.
 */
public class ConsumerRegistry {

    private final Map<AgentType, AgentMessageHandler> handlers = new EnumMap<>(AgentType.class);

    /**
     * @return the handler this one replaces, if any
     */
    public synchronized Optional<AgentMessageHandler> register(AgentType agentType, AgentMessageHandler handler) {
        Objects.requireNonNull(agentType, "agentType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        return Optional.ofNullable(handlers.put(agentType, handler));
    }

    public synchronized Optional<AgentMessageHandler> handlerFor(AgentType agentType) {
        return Optional.ofNullable(handlers.get(agentType));
    }

    public synchronized Set<AgentType> agentTypes() {
        return handlers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(handlers.keySet()));
    }

    public synchronized void clear() {
        handlers.clear();
    }
}
