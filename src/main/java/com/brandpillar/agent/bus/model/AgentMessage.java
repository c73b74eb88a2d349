package com.brandpillar.agent.bus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Objects;
import java.util.UUID;

/**
 * Unit of communication between agents.
 *
 * <p>The {@code id} is chosen by the producer and stays the same across redeliveries;
 * every redelivery is a new wire message carrying an incremented {@code retryCount}.
 *
 * <p>Example:
 * <pre>
 * {@code
 * AgentMessage message = AgentMessage.builder()
 *         .type(MessageType.TASK_REQUEST)
 *         .source(AgentType.ORCHESTRATOR)
 *         .target(MessageTarget.of(AgentType.CONTENT_GENERATOR))
 *         .priority(Priority.HIGH)
 *         .payload(objectMapper.valueToTree(request))
 *         .build();
 * }
 * </pre>
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentMessage {

    String id;

    /** Discriminates payload semantics; must not contain {@code '.'}. */
    String type;

    AgentType source;

    MessageTarget target;

    Priority priority;

    /** Opaque JSON body, {@code null} when absent or JSON null. */
    JsonNode payload;

    @With
    int retryCount;

    /** Creation time in epoch millis. */
    long timestamp;

    boolean requiresAck;

    /** Handler timeout hint in millis; informational only. */
    long timeout;

    /** Overrides the bus-wide retry settings for this message; {@code null} when absent. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    MessageRetryPolicy retryPolicy;

    @Builder(toBuilder = true)
    @JsonCreator
    public AgentMessage(@JsonProperty("id") String id,
                        @JsonProperty("type") String type,
                        @JsonProperty("source") AgentType source,
                        @JsonProperty("target") MessageTarget target,
                        @JsonProperty("priority") Priority priority,
                        @JsonProperty("payload") JsonNode payload,
                        @JsonProperty("retryCount") int retryCount,
                        @JsonProperty("timestamp") long timestamp,
                        @JsonProperty("requiresAck") boolean requiresAck,
                        @JsonProperty("timeout") long timeout,
                        @JsonProperty("retryPolicy") MessageRetryPolicy retryPolicy) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.source = source;
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.priority = priority != null ? priority : Priority.MEDIUM;
        this.payload = payload == null || payload.isNull() ? null : payload;
        this.retryCount = retryCount;
        this.timestamp = timestamp > 0 ? timestamp : System.currentTimeMillis();
        this.requiresAck = requiresAck;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    public static class AgentMessageBuilder {

        public AgentMessageBuilder type(String type) {
            this.type = type;
            return this;
        }

        public AgentMessageBuilder type(MessageType type) {
            this.type = type.name();
            return this;
        }
    }
}
