package com.solarcharge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarcharge.session.SessionKey;
import com.solarcharge.session.SessionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();
    private final SessionKey key = SessionKey.of("ESP32_001", 1);

    @Test
    @DisplayName("track returns the replaced session id")
    void trackReturnsPrevious() {
        assertThat(registry.track(key, "SES-1")).isEmpty();
        assertThat(registry.track(key, "SES-2")).contains("SES-1");
        assertThat(registry.sessionFor(key)).contains("SES-2");
        assertThat(registry.keyOf("SES-2")).contains(key);
    }

    @Test
    @DisplayName("conditional release only removes the matching session")
    void conditionalRelease() {
        registry.track(key, "SES-1");

        assertThat(registry.release(key, "SES-OTHER")).isFalse();
        assertThat(registry.sessionFor(key)).contains("SES-1");
        assertThat(registry.release(key, "SES-1")).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("keys differ by device and index")
    void keyIdentity() {
        assertThat(SessionKey.of("ESP32_001", 1)).isEqualTo(key);
        assertThat(SessionKey.of("ESP32_001", 2)).isNotEqualTo(key);
        assertThat(key.toString()).isEqualTo("ESP32_001_1");
    }
}
