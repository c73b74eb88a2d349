package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.exception.MessageSerializationException;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import com.brandpillar.agent.bus.model.MessageTarget;
import com.brandpillar.agent.bus.model.Priority;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentMessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AgentMessageCodec codec = new AgentMessageCodec(objectMapper);

    @Test
    void encodeSetsBrokerProperties() {
        AgentMessage message = AgentMessage.builder()
                .id("m1")
                .type("GENERATE")
                .target(MessageTarget.of(AgentType.CONTENT_GENERATOR))
                .priority(Priority.HIGH)
                .retryCount(1)
                .build();

        Message encoded = codec.encode(message);
        MessageProperties properties = encoded.getMessageProperties();

        assertThat(properties.getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
        assertThat(properties.getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);
        assertThat(properties.getMessageId()).isEqualTo("m1");
        assertThat(properties.getType()).isEqualTo("GENERATE");
        assertThat(properties.getPriority()).isEqualTo(10);
        assertThat(properties.getTimestamp()).isNotNull();
        assertThat(properties.<Integer>getHeader(AgentMessageCodec.RETRY_COUNT_HEADER)).isEqualTo(1);
        assertThat(new String(encoded.getBody(), StandardCharsets.UTF_8)).contains("\"id\":\"m1\"");
    }

    @Test
    void decodeReadsTheBody() {
        AgentMessage message = AgentMessage.builder()
                .id("m1")
                .type("GENERATE")
                .source(AgentType.ORCHESTRATOR)
                .target(MessageTarget.broadcast())
                .build();

        assertThat(codec.decode(codec.encode(message))).isEqualTo(message);
    }

    @Test
    void headerRetryCountWinsOverBody() {
        AgentMessage message = AgentMessage.builder()
                .type("GENERATE")
                .target(MessageTarget.broadcast())
                .build();
        Message encoded = codec.encode(message);
        encoded.getMessageProperties().setHeader(AgentMessageCodec.RETRY_COUNT_HEADER, "2");

        assertThat(codec.decode(encoded).getRetryCount()).isEqualTo(2);
    }

    @Test
    void retryCountDefaultsToZero() {
        Message message = new Message("{}".getBytes(StandardCharsets.UTF_8), new MessageProperties());

        assertThat(AgentMessageCodec.retryCount(message)).isZero();

        message.getMessageProperties().setHeader(AgentMessageCodec.RETRY_COUNT_HEADER, "not-a-number");
        assertThat(AgentMessageCodec.retryCount(message)).isZero();

        message.getMessageProperties().setHeader(AgentMessageCodec.RETRY_COUNT_HEADER, 3L);
        assertThat(AgentMessageCodec.retryCount(message)).isEqualTo(3);
    }

    @Test
    void malformedBodiesAreSerializationErrors() {
        assertThatThrownBy(() -> codec.decode(body("not json")))
                .isInstanceOf(MessageSerializationException.class);
        assertThatThrownBy(() -> codec.decode(body("null")))
                .isInstanceOf(MessageSerializationException.class);
        assertThatThrownBy(() -> codec.decode(body("{\"id\":\"x\",\"target\":\"broadcast\"}")))
                .isInstanceOf(MessageSerializationException.class);
        assertThatThrownBy(() -> codec.decode(body("{\"type\":\"PING\",\"target\":\"NOBODY\"}")))
                .isInstanceOf(MessageSerializationException.class);
    }

    private static Message body(String json) {
        return new Message(json.getBytes(StandardCharsets.UTF_8), new MessageProperties());
    }
}
