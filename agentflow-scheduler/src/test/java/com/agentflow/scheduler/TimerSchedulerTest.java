package com.agentflow.scheduler;

import com.agentflow.scheduler.TimerScheduler.ScheduledTimer;
import com.agentflow.scheduler.TimerScheduler.TimerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimerSchedulerTest {

    private TimerScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TimerScheduler();
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    @DisplayName("A timer fires once, not before its delay")
    void firesAfterDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicReference<Instant> firedAt = new AtomicReference<>();
        Instant scheduledAt = Instant.now();

        ScheduledTimer timer = scheduler.schedule(UUID.randomUUID(), "step-a#0", TimerType.ATTEMPT_DEADLINE,
            Duration.ofMillis(150), t -> {
                firedAt.set(Instant.now());
                fired.countDown();
            });

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(Duration.between(scheduledAt, firedAt.get())).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        assertThat(timer.type()).isEqualTo(TimerType.ATTEMPT_DEADLINE);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("A cancelled timer never fires")
    void cancelledTimerDoesNotFire() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        ScheduledTimer timer = scheduler.schedule(UUID.randomUUID(), "k", TimerType.RETRY_BACKOFF,
            Duration.ofMillis(100), t -> calls.incrementAndGet());

        assertThat(scheduler.cancelTimer(timer.timerId())).isTrue();
        assertThat(scheduler.cancelTimer(timer.timerId())).isFalse();

        Thread.sleep(300);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Cancelling an execution cancels only its timers")
    void cancelAllByExecution() throws InterruptedException {
        UUID cancelled = UUID.randomUUID();
        UUID kept = UUID.randomUUID();
        CountDownLatch keptFired = new CountDownLatch(1);
        AtomicInteger cancelledCalls = new AtomicInteger();

        scheduler.schedule(cancelled, "a", TimerType.ATTEMPT_DEADLINE, Duration.ofMillis(100),
            t -> cancelledCalls.incrementAndGet());
        scheduler.schedule(cancelled, "b", TimerType.RETRY_BACKOFF, Duration.ofMillis(100),
            t -> cancelledCalls.incrementAndGet());
        scheduler.schedule(kept, "c", TimerType.ATTEMPT_DEADLINE, Duration.ofMillis(100),
            t -> keptFired.countDown());

        assertThat(scheduler.cancelAll(cancelled)).isEqualTo(2);
        assertThat(keptFired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(cancelledCalls.get()).isZero();
    }

    @Test
    @DisplayName("A failing callback does not stop other timers")
    void callbackFailureIsIsolated() throws InterruptedException {
        CountDownLatch second = new CountDownLatch(1);
        scheduler.schedule(UUID.randomUUID(), "bad", TimerType.ATTEMPT_DEADLINE, Duration.ZERO, t -> {
            throw new IllegalStateException("boom");
        });
        scheduler.schedule(UUID.randomUUID(), "good", TimerType.ATTEMPT_DEADLINE, Duration.ofMillis(50),
            t -> second.countDown());

        assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Negative delays fire immediately")
    void negativeDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        scheduler.schedule(UUID.randomUUID(), "late", TimerType.ATTEMPT_DEADLINE, Duration.ofSeconds(-5),
            t -> fired.countDown());

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Scheduling on a stopped scheduler is rejected")
    void rejectsWhenStopped() {
        TimerScheduler stopped = new TimerScheduler(1);

        assertThatThrownBy(() -> stopped.schedule(UUID.randomUUID(), "k", TimerType.RETRY_BACKOFF,
            Duration.ofMillis(10), t -> { }))
            .isInstanceOf(IllegalStateException.class);
        stopped.stop();
    }
}
