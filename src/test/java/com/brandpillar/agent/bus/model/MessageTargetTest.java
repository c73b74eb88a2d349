package com.brandpillar.agent.bus.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTargetTest {

    @Test
    void broadcastHasNoAgentType() {
        MessageTarget target = MessageTarget.broadcast();

        assertThat(target.isBroadcast()).isTrue();
        assertThat(target.agentType()).isEmpty();
        assertThat(target.key()).isEqualTo("broadcast");
    }

    @Test
    void agentTargetKeyIsTheEnumName() {
        MessageTarget target = MessageTarget.of(AgentType.QUALITY_CONTROL);

        assertThat(target.isBroadcast()).isFalse();
        assertThat(target.agentType()).contains(AgentType.QUALITY_CONTROL);
        assertThat(target.key()).isEqualTo("QUALITY_CONTROL");
    }

    @Test
    void parseAcceptsWireForms() {
        assertThat(MessageTarget.parse("broadcast")).isEqualTo(MessageTarget.broadcast());
        assertThat(MessageTarget.parse("LEARNING")).isEqualTo(MessageTarget.of(AgentType.LEARNING));
    }

    @Test
    void parseRejectsUnknownAgents() {
        assertThatThrownBy(() -> MessageTarget.parse("janitor")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MessageTarget.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void queueNamesAreLowerCase() {
        assertThat(AgentType.CONTENT_GENERATOR.queueName()).isEqualTo("agent.content_generator");
        assertThat(AgentType.NEWS_MONITOR.queueName()).isEqualTo("agent.news_monitor");
    }
}
