package com.solarcharge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarcharge.session.InactivityTimerManager;
import com.solarcharge.session.SessionKey;
import com.solarcharge.support.ManualTaskScheduler;
import com.solarcharge.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InactivityTimerManagerTest {

    private static final SessionKey KEY = SessionKey.of("ESP32_001", 1);

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private List<SessionKey> fired;
    private InactivityTimerManager timers;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        scheduler = new ManualTaskScheduler(clock);
        fired = new ArrayList<>();
        timers = new InactivityTimerManager(scheduler, clock, fired::add);
    }

    @Test
    @DisplayName("fires once after the delay and disarms")
    void firesAfterDelay() {
        timers.arm(KEY, Duration.ofSeconds(60));

        scheduler.advance(Duration.ofSeconds(59));
        assertThat(fired).isEmpty();

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(fired).containsExactly(KEY);
        assertThat(timers.isArmed(KEY)).isFalse();
    }

    @Test
    @DisplayName("re-arming replaces the pending timer")
    void rearmReplaces() {
        timers.arm(KEY, Duration.ofSeconds(60));
        scheduler.advance(Duration.ofSeconds(40));
        timers.arm(KEY, Duration.ofSeconds(60));

        scheduler.advance(Duration.ofSeconds(30));
        assertThat(fired).isEmpty();
        assertThat(timers.lastReset(KEY)).contains(Instant.parse("2024-05-01T10:00:40Z"));

        scheduler.advance(Duration.ofSeconds(30));
        assertThat(fired).containsExactly(KEY);
    }

    @Test
    @DisplayName("a cancelled timer never reaches the handler")
    void cancelledNeverFires() {
        timers.arm(KEY, Duration.ofSeconds(60));

        assertThat(timers.cancel(KEY)).isTrue();
        scheduler.advance(Duration.ofSeconds(120));

        assertThat(fired).isEmpty();
        assertThat(timers.cancel(KEY)).isFalse();
    }

    @Test
    @DisplayName("cancelAll disarms every key")
    void cancelAll() {
        timers.arm(KEY, Duration.ofSeconds(60));
        timers.arm(SessionKey.of("ESP32_001", 2), Duration.ofSeconds(60));

        assertThat(timers.armedCount()).isEqualTo(2);
        assertThat(timers.cancelAll()).isEqualTo(2);

        scheduler.advance(Duration.ofSeconds(60));
        assertThat(fired).isEmpty();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("after close nothing can be armed and nothing fires")
    void closedRefusesArming() {
        timers.arm(KEY, Duration.ofSeconds(60));

        assertThat(timers.close()).isEqualTo(1);
        timers.arm(SessionKey.of("ESP32_001", 2), Duration.ofSeconds(60));

        assertThat(timers.isClosed()).isTrue();
        assertThat(timers.armedCount()).isZero();
        assertThat(scheduler.pendingCount()).isZero();
        scheduler.advance(Duration.ofSeconds(120));
        assertThat(fired).isEmpty();
    }
}
