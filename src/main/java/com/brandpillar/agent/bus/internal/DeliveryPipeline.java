package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.AgentMessageHandler;
import com.brandpillar.agent.bus.broker.BrokerChannel;
import com.brandpillar.agent.bus.broker.DeliveryListener;
import com.brandpillar.agent.bus.exception.MessageSerializationException;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handles each delivery of an agent queue.
 *
 * <p>Outcomes:
 * <ul>
 *     <li>handler succeeds: ack</li>
 *     <li>handler fails with attempts left: ack and schedule a redelivery with
 *     {@code retryCount + 1} after the backoff delay</li>
 *     <li>handler fails on the last attempt: reject without requeue, the queue's
 *     dead-letter exchange takes the message</li>
 *     <li>body is not an agent message: reject without requeue</li>
 * </ul>
 *
 * <p>A handler "fails" by throwing anything, errors included; a {@link VirtualMachineError}
 * is rethrown once the delivery is settled. Handlers run on the handler executor,
 * never on the broker client's thread.
 */
@Slf4j
@RequiredArgsConstructor
public class DeliveryPipeline {

    private final ConsumerRegistry registry;
    private final AgentMessageCodec codec;
    private final RetryPolicy retryPolicy;
    private final RetryScheduler retryScheduler;
    private final BusMetrics metrics;
    private final Executor handlerExecutor;

    public DeliveryListener listenerFor(AgentType agentType, BrokerChannel channel) {
        return message -> {
            try {
                handlerExecutor.execute(() -> process(agentType, channel, message));
            } catch (RejectedExecutionException e) {
                // left unacked, the broker redelivers it once the channel closes
                log.warn("Handler executor rejected delivery on {} (messageId={})",
                        agentType.queueName(), message.getMessageProperties().getMessageId());
            }
        };
    }

    // =====================================================================
    // PROCESSING
    // =====================================================================

    void process(AgentType agentType, BrokerChannel channel, Message message) {
        MessageContext ctx = MessageContext.of(channel, message);

        AgentMessage agentMessage;
        try {
            agentMessage = codec.decode(message);
        } catch (MessageSerializationException e) {
            log.error("Malformed message on {} → dead-lettering (messageId={})",
                    agentType.queueName(), ctx.messageId(), e);
            metrics.deadLettered(agentType, "malformed");
            settle(ctx::deadLetter);
            return;
        }

        Optional<AgentMessageHandler> handler = registry.handlerFor(agentType);
        if (handler.isEmpty()) {
            log.warn("No handler registered for {} → requeueing message {}", agentType, agentMessage.getId());
            settle(ctx::requeue);
            return;
        }

        long start = System.nanoTime();
        try {
            handler.get().handle(agentMessage);
        } catch (Throwable ex) {
            onHandlerFailure(agentType, ctx, agentMessage, ex);
            if (ex instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            return;
        }

        metrics.consumed(agentType, System.nanoTime() - start);
        settle(ctx::ack);
        log.debug("Message handled: id={} queue={} retryCount={}",
                agentMessage.getId(), agentType.queueName(), agentMessage.getRetryCount());
    }

    private void onHandlerFailure(AgentType agentType, MessageContext ctx, AgentMessage message, Throwable ex) {
        metrics.failed(agentType);
        int retryCount = message.getRetryCount();
        int attempt = retryCount + 1;
        RetryPolicy policy = retryPolicy.forMessage(message);

        if (policy.shouldRetry(retryCount)) {
            Duration delay = policy.delayFor(retryCount);
            log.warn("Handler failed for message {} on {} (attempt {}/{}), redelivering in {}",
                    message.getId(), agentType.queueName(), attempt, policy.getMaxAttempts(), delay, ex);

            retryScheduler.schedule(agentType, message.withRetryCount(attempt), delay);
            metrics.retried(agentType);
            settle(ctx::ack);
            return;
        }

        log.error("Handler failed for message {} on {} after {} attempts → dead-lettering",
                message.getId(), agentType.queueName(), attempt, ex);
        metrics.deadLettered(agentType, "exhausted");
        settle(ctx::deadLetter);
    }

    private void settle(Runnable settlement) {
        try {
            settlement.run();
        } catch (MessageContext.MessagingOperationException e) {
            log.warn("{}; the broker will redeliver it", e.getMessage(), e.getCause());
        }
    }
}
