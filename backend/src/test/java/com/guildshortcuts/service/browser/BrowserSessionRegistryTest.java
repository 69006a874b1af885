package com.guildshortcuts.service.browser;

import com.guildshortcuts.exception.BrowserExpiredException;
import com.guildshortcuts.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Browser session registry")
class BrowserSessionRegistryTest {

    private MutableClock clock;
    private BrowserSessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new BrowserSessionRegistry(clock, 300);
    }

    private BrowserState open(long guildId) {
        return registry.save(BrowserState.builder()
                .sessionId(registry.newSessionId())
                .guildId(guildId)
                .stage(BrowserStage.CATEGORY_SELECT)
                .lastInteraction(registry.now())
                .build());
    }

    @Test
    void claimReturnsLiveSession() {
        BrowserState state = open(1L);
        clock.advance(Duration.ofSeconds(299));

        assertThat(registry.claim(state.getSessionId(), 1L)).isSameAs(state);
    }

    @Test
    @DisplayName("a session idle for exactly the timeout is expired")
    void expiresAtTimeout() {
        BrowserState state = open(1L);
        clock.advance(Duration.ofSeconds(300));

        assertThatThrownBy(() -> registry.claim(state.getSessionId(), 1L))
                .isInstanceOf(BrowserExpiredException.class);
        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.claim(state.getSessionId(), 1L))
                .isInstanceOf(BrowserExpiredException.class);
    }

    @Test
    void sessionsAreBoundToTheirGuild() {
        BrowserState state = open(1L);

        assertThatThrownBy(() -> registry.claim(state.getSessionId(), 2L))
                .isInstanceOf(BrowserExpiredException.class);
        assertThat(registry.claim(state.getSessionId(), 1L)).isNotNull();
    }

    @Test
    void unknownSession() {
        assertThatThrownBy(() -> registry.claim("nope", 1L))
                .isInstanceOf(BrowserExpiredException.class)
                .hasMessageContaining("run list again");
    }

    @Test
    void sweepDropsOnlyIdleSessions() {
        BrowserState idle = open(1L);
        clock.advance(Duration.ofSeconds(200));
        BrowserState active = open(1L);
        clock.advance(Duration.ofSeconds(150));

        registry.sweepExpired();

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.claim(active.getSessionId(), 1L)).isSameAs(active);
        assertThatThrownBy(() -> registry.claim(idle.getSessionId(), 1L))
                .isInstanceOf(BrowserExpiredException.class);
    }
}
