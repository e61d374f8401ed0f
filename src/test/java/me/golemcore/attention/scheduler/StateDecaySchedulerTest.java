package me.golemcore.attention.scheduler;

import me.golemcore.attention.domain.model.PersistedSessionState;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.domain.service.SessionStateStore;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import me.golemcore.attention.port.outbound.SessionStatePort;
import me.golemcore.attention.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StateDecaySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final String SESSION_ID = "group-1";

    private SessionStatePort sessionStatePort;
    private AttentionProperties properties;
    private MutableClock clock;
    private SessionStateStore store;
    private StateDecayScheduler scheduler;

    @BeforeEach
    void setUp() {
        sessionStatePort = mock(SessionStatePort.class);
        when(sessionStatePort.load(anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(sessionStatePort.save(any())).thenReturn(CompletableFuture.completedFuture(null));
        properties = new AttentionProperties();
        properties.getMaintenance().setEnabled(false);
        clock = new MutableClock(NOW);
        store = new SessionStateStore(sessionStatePort, properties, clock);
        scheduler = new StateDecayScheduler(store, properties, clock);
    }

    @Test
    void shouldRecoverEnergyAfterLongSilence() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.3)
                .lastReplyTime(NOW.minus(Duration.ofMinutes(90)))
                .lastDailyResetDate(TODAY)
                .lastMoodChangeTime(NOW)
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();

        assertEquals(0.4, session.getEnergy(), 1e-9);
        verify(sessionStatePort, atLeastOnce()).save(any());
        assertFalse(session.isDirty());
    }

    @Test
    void shouldCapRecoveryAtCeiling() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.75)
                .lastReplyTime(NOW.minus(Duration.ofMinutes(90)))
                .lastDailyResetDate(TODAY)
                .lastMoodChangeTime(NOW)
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();
        scheduler.tick();

        assertEquals(0.8, session.getEnergy(), 1e-9);
    }

    @Test
    void shouldNotRecoverBeforeSilenceThreshold() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.3)
                .lastReplyTime(NOW.minus(Duration.ofMinutes(30)))
                .lastDailyResetDate(TODAY)
                .lastMoodChangeTime(NOW)
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();

        assertEquals(0.3, session.getEnergy(), 1e-9);
    }

    @Test
    void shouldMeasureSilenceFromLoadWhenNeverReplied() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.3)
                .lastDailyResetDate(TODAY)
                .lastMoodChangeTime(NOW)
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();
        assertEquals(0.3, session.getEnergy(), 1e-9);

        clock.advance(Duration.ofMinutes(61));
        store.get(SESSION_ID);
        scheduler.tick();
        assertEquals(0.4, session.getEnergy(), 1e-9);
    }

    @Test
    void shouldDecayMoodOncePerInterval() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.8)
                .mood(0.5)
                .lastDailyResetDate(TODAY)
                .lastMoodChangeTime(NOW.minus(Duration.ofMinutes(11)))
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();
        assertEquals(0.4, session.getMood(), 1e-9);

        clock.advance(Duration.ofMinutes(1));
        scheduler.tick();
        assertEquals(0.4, session.getMood(), 1e-9);

        clock.advance(Duration.ofMinutes(10));
        store.get(SESSION_ID);
        scheduler.tick();
        assertEquals(0.3, session.getMood(), 1e-9);
    }

    @Test
    void shouldApplyDailyResetOnNewDay() {
        persisted(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.5)
                .mood(-0.6)
                .lastReplyTime(NOW)
                .lastDailyResetDate(TODAY.minusDays(1))
                .lastMoodChangeTime(NOW)
                .build());
        SessionState session = store.get(SESSION_ID);

        scheduler.tick();

        assertEquals(0.7, session.getEnergy(), 1e-9);
        assertEquals(0.0, session.getMood(), 1e-9);
        assertEquals(TODAY, session.getLastDailyResetDate());
    }

    @Test
    void shouldFlushAndEvictIdleSessions() {
        store.get(SESSION_ID);
        clock.advance(Duration.ofMinutes(11));

        scheduler.tick();

        assertTrue(store.peek(SESSION_ID).isEmpty());
        verify(sessionStatePort, atLeastOnce()).save(any());
    }

    @Test
    void shouldKeepSessionsWhoseWriteBackFailed() {
        when(sessionStatePort.save(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        store.get(SESSION_ID);
        clock.advance(Duration.ofMinutes(11));

        scheduler.tick();

        assertTrue(store.peek(SESSION_ID).isPresent());
        assertTrue(store.peek(SESSION_ID).orElseThrow().isDirty());
    }

    @Test
    void shouldNotStartTimerWhenDisabled() {
        scheduler.init();
        scheduler.shutdown();

        assertEquals(0, store.size());
    }

    private void persisted(PersistedSessionState state) {
        when(sessionStatePort.load(SESSION_ID)).thenReturn(CompletableFuture.completedFuture(Optional.of(state)));
    }
}
