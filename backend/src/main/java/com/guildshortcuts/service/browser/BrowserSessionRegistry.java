package com.guildshortcuts.service.browser;

import com.guildshortcuts.exception.BrowserExpiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the latest state of each open browser. Sessions are in-memory only and
 * are discarded once they have been idle for the configured timeout.
 */
@Component
@Slf4j
public class BrowserSessionRegistry {

    private final Map<String, BrowserState> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration timeout;

    public BrowserSessionRegistry(Clock clock,
                                  @Value("${app.browser.timeout-seconds:300}") long timeoutSeconds) {
        this.clock = clock;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public String newSessionId() {
        return UUID.randomUUID().toString();
    }

    public Instant now() {
        return clock.instant();
    }

    public BrowserState save(BrowserState state) {
        sessions.put(state.getSessionId(), state);
        return state;
    }

    /**
     * Returns the live state of a session, rejecting unknown, foreign and idle ones.
     */
    public BrowserState claim(String sessionId, long guildId) {
        BrowserState state = sessions.get(sessionId);
        if (state == null || state.getGuildId() != guildId) {
            throw new BrowserExpiredException("This shortcut browser has expired, run list again.");
        }
        if (isExpired(state, now())) {
            discard(state);
            throw new BrowserExpiredException("This shortcut browser has expired, run list again.");
        }
        return state;
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${app.browser.sweep-interval-ms:60000}")
    public void sweepExpired() {
        Instant now = now();
        sessions.values().stream()
                .filter(state -> isExpired(state, now))
                .toList()
                .forEach(this::discard);
    }

    boolean isExpired(BrowserState state, Instant now) {
        return !now.isBefore(state.getLastInteraction().plus(timeout));
    }

    private void discard(BrowserState state) {
        if (sessions.remove(state.getSessionId(), state)) {
            log.debug("Browser {} for guild {} expired", state.getSessionId(), state.getGuildId());
        }
    }
}
