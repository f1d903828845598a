package com.agentflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-based scheduler for attempt deadlines and retry backoff.
 *
 * Responsibilities:
 * - Fire a timer once its delay has elapsed, never before
 * - Cancel single timers, or every timer of an execution
 * - Isolate callbacks: a failing callback is logged and does not affect other timers
 *
 * Timers live in memory only. Anything a timer guards is persisted by its owner, so a lost timer
 * is recovered by the owner's startup pass or periodic sweep.
 */
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Map<UUID, Entry> timers = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    public TimerScheduler() {
        this(2);
    }

    public TimerScheduler(int threads) {
        this.scheduler = Executors.newScheduledThreadPool(threads, new TimerThreadFactory());
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Timer scheduler already running");
            return;
        }
        running = true;
        log.info("Timer scheduler started");
    }

    /**
     * Stop the scheduler. Pending timers are discarded.
     */
    public void stop() {
        running = false;
        timers.keySet().forEach(this::cancelTimer);
        timers.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Timer scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedule a timer to fire after a delay.
     *
     * @param executionId The execution the timer belongs to
     * @param key         What the timer guards, e.g. a step key
     * @param type        Timer type
     * @param delay       The delay before firing
     * @param callback    Invoked on a scheduler thread when the timer fires
     * @return The scheduled timer
     */
    public ScheduledTimer schedule(UUID executionId, String key, TimerType type, Duration delay,
                                   TimerCallback callback) {
        if (!running) {
            throw new IllegalStateException("Timer scheduler is not running");
        }
        Duration effectiveDelay = delay.isNegative() ? Duration.ZERO : delay;
        ScheduledTimer timer = new ScheduledTimer(
            UUID.randomUUID(),
            executionId,
            key,
            type,
            Instant.now().plus(effectiveDelay),
            Instant.now()
        );

        // registered before scheduling so a zero delay cannot fire ahead of registration
        timers.put(timer.timerId(), new Entry(timer, null));
        ScheduledFuture<?> future = scheduler.schedule(
            () -> fire(timer, callback),
            effectiveDelay.toNanos(),
            TimeUnit.NANOSECONDS
        );
        timers.computeIfPresent(timer.timerId(), (id, entry) -> new Entry(timer, future));

        log.debug("Scheduled {} timer {} for {}:{} in {}", type, timer.timerId(), executionId, key, effectiveDelay);
        return timer;
    }

    /**
     * Cancel a scheduled timer.
     *
     * @param timerId The timer ID
     * @return true if the timer was pending and is now cancelled
     */
    public boolean cancelTimer(UUID timerId) {
        Entry entry = timers.remove(timerId);
        if (entry == null) {
            return false;
        }
        if (entry.future() != null) {
            entry.future().cancel(false);
        }
        return true;
    }

    /**
     * Cancel every pending timer of an execution.
     *
     * @return Number of cancelled timers
     */
    public int cancelAll(UUID executionId) {
        int cancelled = 0;
        for (Entry entry : timers.values()) {
            if (entry.timer().executionId().equals(executionId) && cancelTimer(entry.timer().timerId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int pendingCount() {
        return timers.size();
    }

    private void fire(ScheduledTimer timer, TimerCallback callback) {
        if (timers.remove(timer.timerId()) == null || !running) {
            return;
        }
        try {
            callback.onTimerFired(timer);
        } catch (Exception e) {
            log.error("Timer callback failed: {} ({})", timer.timerId(), timer.type(), e);
        }
    }

    /**
     * Callback for timer events.
     */
    @FunctionalInterface
    public interface TimerCallback {
        void onTimerFired(ScheduledTimer timer);
    }

    /**
     * Timer type.
     */
    public enum TimerType {
        ATTEMPT_DEADLINE,   // Attempt must report back before this fires
        RETRY_BACKOFF       // Next attempt may be dispatched once this fires
    }

    /**
     * Scheduled timer record.
     */
    public record ScheduledTimer(
        UUID timerId,
        UUID executionId,
        String key,
        TimerType type,
        Instant fireAt,
        Instant createdAt
    ) {}

    private record Entry(ScheduledTimer timer, ScheduledFuture<?> future) {}

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentflow-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
