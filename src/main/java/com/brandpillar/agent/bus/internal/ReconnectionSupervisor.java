package com.brandpillar.agent.bus.internal;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Restores the bus after an unexpected connection loss.
 *
 * <p>At most one reconnect timer is pending. A failed attempt schedules the next one
 * after the same delay, without limit, until an attempt succeeds or {@link #cancel()}
 * is called.
 */
@Slf4j
public class ReconnectionSupervisor {

    private final ScheduledExecutorService scheduler;
    private final Duration delay;
    private final Runnable reconnectAction;
    private final BooleanSupplier connected;

    private final AtomicBoolean pending = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile ScheduledFuture<?> future;

    /**
     * @param reconnectAction connects and restores subscriptions, throwing on failure
     * @param connected       reports the live connection state after an attempt
     */
    public ReconnectionSupervisor(ScheduledExecutorService scheduler,
                                  Duration delay,
                                  Runnable reconnectAction,
                                  BooleanSupplier connected) {
        this.scheduler = scheduler;
        this.delay = delay;
        this.reconnectAction = reconnectAction;
        this.connected = connected;
    }

    /**
     * Arms the reconnect timer unless one is already pending or the supervisor is cancelled.
     */
    public void scheduleReconnect() {
        if (cancelled || !pending.compareAndSet(false, true)) {
            return;
        }
        log.info("Scheduling reconnect in {}", delay);
        arm();
    }

    public boolean isReconnectPending() {
        return pending.get();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Stops reconnecting; a pending timer is cancelled.
     */
    public void cancel() {
        cancelled = true;
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
        pending.set(false);
    }

    /**
     * Allows reconnects again after {@link #cancel()}.
     */
    public void resume() {
        cancelled = false;
    }

    void attemptReconnect() {
        if (cancelled) {
            pending.set(false);
            return;
        }

        try {
            reconnectAction.run();
        } catch (RuntimeException e) {
            log.error("Reconnect attempt failed, retrying in {}: {}", delay, e.getMessage());
            if (cancelled) {
                pending.set(false);
            } else {
                arm();
            }
            return;
        }

        pending.set(false);
        if (connected.getAsBoolean()) {
            log.info("Reconnected to message broker");
        } else {
            // lost again while restoring
            scheduleReconnect();
        }
    }

    private void arm() {
        try {
            future = scheduler.schedule(this::attemptReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.warn("Reconnect not scheduled, scheduler is shut down");
        }
    }
}
