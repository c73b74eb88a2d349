package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.MessageRetryPolicy;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff for failed handler invocations.
 *
 * <p>With the defaults a message is handled at most three times, with redeliveries
 * after 1s and 2s.
 */
@Value
public class RetryPolicy {

    int maxAttempts;
    Duration initialDelay;
    double multiplier;
    Duration maxDelay;

    public static RetryPolicy from(AgentMessageBusProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(), retry.getMultiplier(), retry.getMaxDelay());
    }

    public static RetryPolicy from(MessageRetryPolicy policy) {
        return new RetryPolicy(policy.getMaxAttempts(), Duration.ofMillis(policy.getInitialDelay()),
                policy.getBackoffMultiplier(), Duration.ofMillis(policy.getMaxDelay()));
    }

    /**
     * The message's own policy when it carries one, otherwise this one.
     */
    public RetryPolicy forMessage(AgentMessage message) {
        return message.getRetryPolicy() != null ? from(message.getRetryPolicy()) : this;
    }

    /**
     * Whether a message that failed with the given retry count gets another attempt.
     */
    public boolean shouldRetry(int retryCount) {
        return retryCount + 1 < maxAttempts;
    }

    /**
     * Delay before redelivering a message that failed with the given retry count:
     * {@code initialDelay * multiplier^retryCount}, capped at {@code maxDelay}.
     */
    public Duration delayFor(int retryCount) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retryCount);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
