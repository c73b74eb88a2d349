package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.exception.MessageSerializationException;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Objects;

/**
 * Converts {@link AgentMessage}s to and from AMQP messages.
 *
 * <p>The body is the UTF-8 JSON form of the message. Broker metadata (persistence,
 * message id, type, priority, timestamp and the {@value #RETRY_COUNT_HEADER} header)
 * travels in the message properties.
 */
public class AgentMessageCodec {

    public static final String RETRY_COUNT_HEADER = "x-retry-count";

    private final ObjectMapper objectMapper;

    public AgentMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Message encode(AgentMessage message) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new MessageSerializationException("Failed to serialize message " + message.getId(), e);
        }

        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding(StandardCharsets.UTF_8.name());
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(message.getId());
        properties.setType(message.getType());
        properties.setPriority(message.getPriority().getLevel());
        properties.setTimestamp(new Date());
        properties.setHeader(RETRY_COUNT_HEADER, message.getRetryCount());

        return MessageBuilder.withBody(body).andProperties(properties).build();
    }

    /**
     * Reads the message body. The retry count is taken from the
     * {@value #RETRY_COUNT_HEADER} header when present.
     *
     * @throws MessageSerializationException if the body is not a valid agent message
     */
    public AgentMessage decode(Message message) {
        AgentMessage decoded;
        try {
            decoded = objectMapper.readValue(message.getBody(), AgentMessage.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new MessageSerializationException(
                    "Malformed message body (messageId=" + message.getMessageProperties().getMessageId() + ")", e);
        }
        if (decoded == null) {
            throw new MessageSerializationException(
                    "Empty message body (messageId=" + message.getMessageProperties().getMessageId() + ")", null);
        }

        Integer headerRetryCount = headerRetryCount(message);
        if (headerRetryCount != null && headerRetryCount != decoded.getRetryCount()) {
            return decoded.withRetryCount(headerRetryCount);
        }
        return decoded;
    }

    /**
     * Retry count carried by the delivery, {@code 0} when the header is absent or unreadable.
     */
    public static int retryCount(Message message) {
        Integer value = headerRetryCount(message);
        return value != null ? value : 0;
    }

    private static Integer headerRetryCount(Message message) {
        Object raw = message.getMessageProperties().getHeaders().get(RETRY_COUNT_HEADER);
        if (raw instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (raw instanceof String text) {
            try {
                return Math.max(0, Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
