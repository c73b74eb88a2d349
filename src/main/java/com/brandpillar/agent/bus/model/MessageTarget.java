package com.brandpillar.agent.bus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.Optional;

/**
 * Addressee of an {@link AgentMessage}: either one {@link AgentType} or every
 * subscribed agent.
 *
 * <p>On the wire a target is the agent type name or the literal {@code "broadcast"}.
 */
@EqualsAndHashCode
public final class MessageTarget {

    public static final String BROADCAST_KEY = "broadcast";

    private static final MessageTarget BROADCAST = new MessageTarget(null);

    /** {@code null} for broadcast. */
    private final AgentType agentType;

    private MessageTarget(AgentType agentType) {
        this.agentType = agentType;
    }

    public static MessageTarget broadcast() {
        return BROADCAST;
    }

    public static MessageTarget of(AgentType agentType) {
        return new MessageTarget(Objects.requireNonNull(agentType, "agentType must not be null"));
    }

    @JsonCreator
    public static MessageTarget parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Message target must not be blank");
        }
        if (BROADCAST_KEY.equals(value)) {
            return BROADCAST;
        }
        return of(AgentType.valueOf(value));
    }

    public boolean isBroadcast() {
        return agentType == null;
    }

    public Optional<AgentType> agentType() {
        return Optional.ofNullable(agentType);
    }

    /**
     * First segment of the routing key for messages sent to this target.
     */
    @JsonValue
    public String key() {
        return agentType == null ? BROADCAST_KEY : agentType.name();
    }

    @Override
    public String toString() {
        return key();
    }
}
