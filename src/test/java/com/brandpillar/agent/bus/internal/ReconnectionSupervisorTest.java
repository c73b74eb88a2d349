package com.brandpillar.agent.bus.internal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ReconnectionSupervisorTest {

    private static final Duration DELAY = Duration.ofMillis(50);

    private final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1);
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicBoolean connected = new AtomicBoolean();

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void onlyOneTimerIsPendingAtATime() {
        ReconnectionSupervisor supervisor = supervisor(0);

        supervisor.scheduleReconnect();
        supervisor.scheduleReconnect();
        supervisor.scheduleReconnect();

        await().atMost(Duration.ofSeconds(2)).until(() -> !supervisor.isReconnectPending());
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(connected.get()).isTrue();
    }

    @Test
    void failedAttemptsAreRetriedUntilOneSucceeds() {
        ReconnectionSupervisor supervisor = supervisor(3);

        supervisor.scheduleReconnect();

        await().atMost(Duration.ofSeconds(3)).until(connected::get);
        await().atMost(Duration.ofSeconds(1)).until(() -> !supervisor.isReconnectPending());
        assertThat(attempts.get()).isEqualTo(4);
    }

    @Test
    void cancelStopsRetrying() throws InterruptedException {
        ReconnectionSupervisor supervisor = supervisor(Integer.MAX_VALUE);

        supervisor.scheduleReconnect();
        await().atMost(Duration.ofSeconds(2)).until(() -> attempts.get() >= 2);
        supervisor.cancel();
        int attemptsAtCancel = attempts.get();

        Thread.sleep(DELAY.toMillis() * 4);
        assertThat(attempts.get()).isLessThanOrEqualTo(attemptsAtCancel + 1);
        assertThat(supervisor.isReconnectPending()).isFalse();

        supervisor.scheduleReconnect();
        assertThat(supervisor.isReconnectPending()).isFalse();
    }

    @Test
    void resumeAllowsReconnectsAgain() {
        ReconnectionSupervisor supervisor = supervisor(0);
        supervisor.cancel();
        supervisor.resume();

        supervisor.scheduleReconnect();

        await().atMost(Duration.ofSeconds(2)).until(connected::get);
    }

    @Test
    void connectionLostWhileRestoringSchedulesAnotherAttempt() {
        AtomicInteger runs = new AtomicInteger();
        ReconnectionSupervisor supervisor = new ReconnectionSupervisor(executor, DELAY, () -> {
            if (runs.incrementAndGet() >= 2) {
                connected.set(true);
            }
        }, connected::get);

        supervisor.scheduleReconnect();

        await().atMost(Duration.ofSeconds(2)).until(connected::get);
        assertThat(runs.get()).isEqualTo(2);
    }

    private ReconnectionSupervisor supervisor(int failures) {
        return new ReconnectionSupervisor(executor, DELAY, () -> {
            if (attempts.incrementAndGet() <= failures) {
                throw new IllegalStateException("Connection refused");
            }
            connected.set(true);
        }, connected::get);
    }
}
