package com.brandpillar.agent.bus.internal;

import com.brandpillar.agent.bus.exception.MessageBusNotConnectedException;
import com.brandpillar.agent.bus.exception.MessagePublishException;
import com.brandpillar.agent.bus.model.AgentMessage;
import com.brandpillar.agent.bus.model.AgentType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delayed redelivery of failed messages.
 *
 * <p>A redelivery that comes due while the bus is disconnected, or whose publish
 * fails, is re-armed after the reconnect delay. Pending redeliveries live in memory
 * only and are dropped by {@link #cancelAll()}.
 */
@Slf4j
public class RetryScheduler {

    private final ScheduledExecutorService scheduler;
    private final AgentMessagePublisher publisher;
    private final Duration rearmDelay;

    private final Set<PendingRedelivery> pending = ConcurrentHashMap.newKeySet();

    public RetryScheduler(ScheduledExecutorService scheduler, AgentMessagePublisher publisher, Duration rearmDelay) {
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.rearmDelay = rearmDelay;
    }

    /**
     * Schedules {@code message} for redelivery to the queue of {@code agentType}.
     * The message is sent as given, so its retry count must already be incremented.
     */
    public void schedule(AgentType agentType, AgentMessage message, Duration delay) {
        PendingRedelivery redelivery = new PendingRedelivery(agentType, message);
        pending.add(redelivery);
        redelivery.arm(delay);
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Cancels every pending redelivery.
     *
     * @return the number of redeliveries dropped
     */
    public int cancelAll() {
        int dropped = 0;
        for (PendingRedelivery redelivery : pending) {
            if (pending.remove(redelivery)) {
                redelivery.cancel();
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} pending redeliveries", dropped);
        }
        return dropped;
    }

    private final class PendingRedelivery implements Runnable {

        private final AgentType agentType;
        private final AgentMessage message;
        private volatile ScheduledFuture<?> future;

        private PendingRedelivery(AgentType agentType, AgentMessage message) {
            this.agentType = agentType;
            this.message = message;
        }

        private void arm(Duration delay) {
            try {
                future = scheduler.schedule(this, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                pending.remove(this);
                log.warn("Redelivery of message {} dropped, scheduler is shut down", message.getId());
            }
        }

        private void cancel() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }

        @Override
        public void run() {
            if (!pending.contains(this)) {
                return;
            }
            try {
                publisher.republish(agentType, message);
                pending.remove(this);
            } catch (MessageBusNotConnectedException | MessagePublishException e) {
                log.warn("Redelivery of message {} deferred by {}: {}", message.getId(), rearmDelay, e.getMessage());
                if (pending.contains(this)) {
                    arm(rearmDelay);
                }
            } catch (RuntimeException e) {
                pending.remove(this);
                log.error("Redelivery of message {} to {} failed", message.getId(), agentType.queueName(), e);
            }
        }
    }
}
