package com.brandpillar.agent.bus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Delivery priority hint. Serialized as its numeric level and copied into the
 * broker's priority property; it is not an ordering guarantee.
 */
@Getter
@RequiredArgsConstructor
public enum Priority {

    LOW(1),
    MEDIUM(5),
    HIGH(10),
    CRITICAL(20);

    @JsonValue
    private final int level;

    @JsonCreator
    public static Priority fromLevel(int level) {
        for (Priority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}
