package com.solarcharge.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * One cancellable delayed task per tracked {@link SessionKey}.
 *
 * <p>Arming a key replaces (and cancels) any previous entry. When a task fires it first
 * removes its own entry from the map; if the entry is no longer there (cancelled or
 * replaced) the task does nothing. A cancelled timer therefore never reaches the
 * {@link DeadlineHandler}, even if its scheduled future already started running.
 *
 * <p>After {@link #close()} nothing can be armed and pending entries never fire.
 */
public class InactivityTimerManager {

    private static final Logger log = LoggerFactory.getLogger(InactivityTimerManager.class);

    @FunctionalInterface
    public interface DeadlineHandler {
        void onDeadline(SessionKey key);
    }

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final DeadlineHandler handler;
    private final ConcurrentMap<SessionKey, TimerEntry> timers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public InactivityTimerManager(TaskScheduler scheduler, Clock clock, DeadlineHandler handler) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.handler = handler;
    }

    /** Arms (or re-arms) the timer for {@code key} to fire after {@code delay}. */
    public void arm(SessionKey key, Duration delay) {
        if (closed) {
            log.warn("Inactivity timer not armed, coordinator stopped: key={}", key);
            return;
        }
        Instant now = Instant.now(clock);
        TimerEntry entry = new TimerEntry(key, now);
        TimerEntry previous = timers.put(key, entry);
        if (previous != null) {
            previous.cancel();
        }
        entry.future = scheduler.schedule(() -> fire(entry), now.plus(delay));
        log.debug("Inactivity timer armed: key={}, delay={}s", key, delay.toSeconds());
    }

    public boolean cancel(SessionKey key) {
        TimerEntry entry = timers.remove(key);
        if (entry == null) {
            return false;
        }
        entry.cancel();
        log.debug("Inactivity timer cancelled: key={}", key);
        return true;
    }

    public int cancelAll() {
        int cancelled = 0;
        for (SessionKey key : timers.keySet()) {
            if (cancel(key)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /** Cancels every timer and refuses further arming. */
    public int close() {
        closed = true;
        return cancelAll();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isArmed(SessionKey key) {
        return timers.containsKey(key);
    }

    public Optional<Instant> lastReset(SessionKey key) {
        return Optional.ofNullable(timers.get(key)).map(e -> e.armedAt);
    }

    public int armedCount() {
        return timers.size();
    }

    private void fire(TimerEntry entry) {
        if (closed || entry.cancelled || !timers.remove(entry.key, entry)) {
            return;
        }
        handler.onDeadline(entry.key);
    }

    private static final class TimerEntry {
        private final SessionKey key;
        private final Instant armedAt;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private TimerEntry(SessionKey key, Instant armedAt) {
            this.key = key;
            this.armedAt = armedAt;
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
