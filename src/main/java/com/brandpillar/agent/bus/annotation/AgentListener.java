package com.brandpillar.agent.bus.annotation;

import com.brandpillar.agent.bus.model.AgentType;

import java.lang.annotation.*;

/**
 * Marks an {@link com.brandpillar.agent.bus.AgentMessageHandler} bean as the consumer
 * of one agent type's queue.
 *
 * <p>The bean is subscribed once the application context has started. Only one
 * listener may exist per agent type.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @AgentListener(AgentType.PUBLISHER)
 * public class PublisherAgent implements AgentMessageHandler {
 *
 *     @Override
 *     public void handle(AgentMessage message) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface AgentListener {

    /**
     * Agent type whose queue this bean consumes.
     */
    AgentType value();

    /**
     * Optional human-readable description, logged on subscription.
     */
    String description() default "";
}
