package com.brandpillar.agent.bus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Retry settings carried by a single message, overriding the bus-wide
 * {@code agent-bus.retry.*} settings for that message. Delays are in millis.
 */
@Value
public class MessageRetryPolicy {

    int maxAttempts;

    double backoffMultiplier;

    long initialDelay;

    long maxDelay;

    @JsonCreator
    public MessageRetryPolicy(@JsonProperty("maxAttempts") int maxAttempts,
                              @JsonProperty("backoffMultiplier") double backoffMultiplier,
                              @JsonProperty("initialDelay") long initialDelay,
                              @JsonProperty("maxDelay") long maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        if (initialDelay < 0 || maxDelay < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoffMultiplier = backoffMultiplier;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }
}
