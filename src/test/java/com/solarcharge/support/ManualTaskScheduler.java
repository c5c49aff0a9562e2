package com.solarcharge.support;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

/**
 * Deterministic {@link TaskScheduler} driven by a {@link MutableClock}.
 *
 * <p>One-shot tasks execute ONLY when {@link #advance(Duration)} or {@link #runDueTasks()}
 * is called, on the calling thread. Periodic scheduling is not supported.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<ManualFuture> queue = new ArrayList<>();
    private long sequence;

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime, sequence++);
        queue.add(future);
        return future;
    }

    /** Moves the clock forward and runs every task that became due, in deadline order. */
    public void advance(Duration duration) {
        clock.advance(duration);
        runDueTasks();
    }

    public void runDueTasks() {
        ManualFuture next;
        while ((next = pollDue()) != null) {
            next.run();
        }
    }

    /** Number of scheduled tasks that are neither cancelled nor run yet. */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(f -> !f.isDone()).count();
    }

    private synchronized ManualFuture pollDue() {
        Instant now = clock.instant();
        ManualFuture due = queue.stream()
                .filter(f -> !f.isDone() && !f.startTime.isAfter(now))
                .min(Comparator.comparing((ManualFuture f) -> f.startTime).thenComparingLong(f -> f.sequence))
                .orElse(null);
        queue.removeIf(ManualFuture::isDone);
        if (due != null) {
            queue.remove(due);
        }
        return due;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("Periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("Periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("Periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("Periodic scheduling not supported");
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Instant startTime;
        private final long sequence;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ManualFuture(Runnable task, Instant startTime, long sequence) {
            this.task = task;
            this.startTime = startTime;
            this.sequence = sequence;
        }

        private void run() {
            if (cancelled || done) {
                return;
            }
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), startTime));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
