package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageBus;
import com.brandpillar.agent.bus.AgentMessageBusProperties;
import com.brandpillar.agent.bus.AgentMessageHandler;
import com.brandpillar.agent.bus.annotation.AgentListener;
import com.brandpillar.agent.bus.model.AgentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.EnumMap;
import java.util.Map;

/**
 * Subscribes {@link AgentListener} beans once all singletons are initialized.
 *
 * <p><b>Startup sequence:</b></p>
 * <ol>
 *     <li>connect the bus, when {@code agent-bus.auto-connect} is set</li>
 *     <li>declare the dead-letter topology, when {@code agent-bus.dead-letter.enabled} is set</li>
 *     <li>subscribe every listener bean to its agent type's queue</li>
 * </ol>
 *
 * <p>A listener bean must implement {@link AgentMessageHandler}, and at most one bean
 * may listen to an agent type. Violations fail startup.
 */
@Slf4j
@RequiredArgsConstructor
public class AgentListenerProcessor implements SmartInitializingSingleton {

    private final AgentMessageBus bus;
    private final AgentMessageBusProperties properties;
    private final ApplicationContext context;

    @Override
    public void afterSingletonsInstantiated() {
        Map<AgentType, AgentMessageHandler> listeners = discoverListeners();

        if (!properties.isAutoConnect()) {
            if (!listeners.isEmpty()) {
                log.info("agent-bus.auto-connect is off, {} agent listener(s) not subscribed", listeners.size());
            }
            return;
        }

        log.info("Initializing agent message bus...");
        bus.connect();

        if (properties.getDeadLetter().isEnabled()) {
            bus.createDeadLetterExchange();
        }

        listeners.forEach(bus::subscribe);
    }

    // =====================================================================
    // BEAN DISCOVERY
    // =====================================================================

    private Map<AgentType, AgentMessageHandler> discoverListeners() {
        Map<AgentType, AgentMessageHandler> listeners = new EnumMap<>(AgentType.class);
        Map<AgentType, String> beanNames = new EnumMap<>(AgentType.class);

        context.getBeansWithAnnotation(AgentListener.class).forEach((beanName, bean) -> {
            Class<?> clazz = AopUtils.getTargetClass(bean);
            AgentListener listener = AnnotationUtils.findAnnotation(clazz, AgentListener.class);
            if (listener == null) {
                return;
            }

            if (!(bean instanceof AgentMessageHandler handler)) {
                throw new IllegalStateException(
                        "@AgentListener bean '" + beanName + "' (" + clazz.getName()
                                + ") must implement " + AgentMessageHandler.class.getSimpleName());
            }

            AgentType agentType = listener.value();
            String existing = beanNames.putIfAbsent(agentType, beanName);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate @AgentListener for " + agentType + ": beans '" + existing
                                + "' and '" + beanName + "'");
            }

            listeners.put(agentType, handler);
            log.info("Agent listener found → agentType={} bean={} {}",
                    agentType, beanName, listener.description());
        });

        return listeners;
    }
}
