package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.MessageRetryPolicy;
import com.brandpillar.agent.bus.model.MessageTarget;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void defaultsAllowThreeInvocations() {
        RetryPolicy policy = RetryPolicy.from(new AgentMessageBusProperties().getRetry());

        assertThat(policy.shouldRetry(0)).isTrue();
        assertThat(policy.shouldRetry(1)).isTrue();
        assertThat(policy.shouldRetry(2)).isFalse();
        assertThat(policy.shouldRetry(7)).isFalse();
    }

    @Test
    void defaultBackoffDoubles() {
        RetryPolicy policy = RetryPolicy.from(new AgentMessageBusProperties().getRetry());

        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void delayIsCappedByMaxDelay() {
        RetryPolicy policy = new RetryPolicy(20, Duration.ofSeconds(1), 3.0, Duration.ofSeconds(30));

        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(27));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(60)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void singleAttemptNeverRetries() {
        RetryPolicy policy = new RetryPolicy(1, Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5));

        assertThat(policy.shouldRetry(0)).isFalse();
    }

    @Test
    void messagePolicyOverridesTheBusPolicy() {
        RetryPolicy busPolicy = RetryPolicy.from(new AgentMessageBusProperties().getRetry());
        AgentMessage plain = AgentMessage.builder().type("PING").target(MessageTarget.broadcast()).build();
        AgentMessage custom = plain.toBuilder()
                .retryPolicy(new MessageRetryPolicy(5, 3.0, 100, 1000))
                .build();

        assertThat(busPolicy.forMessage(plain)).isSameAs(busPolicy);

        RetryPolicy overridden = busPolicy.forMessage(custom);
        assertThat(overridden.shouldRetry(3)).isTrue();
        assertThat(overridden.shouldRetry(4)).isFalse();
        assertThat(overridden.delayFor(1)).isEqualTo(Duration.ofMillis(300));
        assertThat(overridden.delayFor(3)).isEqualTo(Duration.ofMillis(1000));
    }
}
