package me.golemcore.attention.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final String SESSION_ID = "group-1";
    private static final int CAPACITY = 20;

    private final Function<SessionState, GenerationCycle> factory = session -> new StubCycle("c");

    @Test
    void shouldOpenCycleForFirstAdmittedMessage() {
        SessionState state = fresh();

        SessionState.Routing routing = state.route(message("m1", "alice", 0), factory, CAPACITY);

        assertEquals(SessionState.RoutingOutcome.OPENED, routing.outcome());
        assertTrue(state.isLocked());
        assertEquals(Optional.of("alice"), state.getOwnerSenderId());
        assertSame(routing.cycle(), state.getActiveCycle().orElseThrow());
        assertEquals(List.of("m1"), ids(state.getAccumulationPool()));
    }

    @Test
    void shouldExtendWindowForOwnerAndDeferOthers() {
        SessionState state = fresh();
        state.route(message("m1", "alice", 0), factory, CAPACITY);

        SessionState.Routing owner = state.route(message("m2", "alice", 1), factory, CAPACITY);
        SessionState.Routing other = state.route(message("m3", "bob", 2), factory, CAPACITY);

        assertEquals(SessionState.RoutingOutcome.EXTENDED, owner.outcome());
        assertEquals(SessionState.RoutingOutcome.DEFERRED, other.outcome());
        assertEquals(List.of("m1", "m2"), ids(state.getAccumulationPool()));
        assertEquals(List.of("m3"), ids(state.getBackgroundPool()));
    }

    @Test
    void shouldDropOldestBackgroundMessageWhenFull() {
        SessionState state = fresh();
        state.route(message("m0", "alice", 0), factory, 2);

        state.route(message("b1", "bob", 1), factory, 2);
        state.route(message("b2", "carol", 2), factory, 2);
        SessionState.Routing routing = state.route(message("b3", "dave", 3), factory, 2);

        assertEquals("b1", routing.dropped().getId());
        assertEquals(List.of("b2", "b3"), ids(state.getBackgroundPool()));
    }

    @Test
    void shouldDeferOwnerMessagesAfterWindowClosed() {
        SessionState state = fresh();
        SessionState.Routing opened = state.route(message("m1", "alice", 0), factory, CAPACITY);

        List<InboundMessage> batch = state.drainForGeneration(opened.cycle());
        SessionState.Routing late = state.route(message("m2", "alice", 5), factory, CAPACITY);

        assertEquals(List.of("m1"), ids(batch));
        assertTrue(state.getAccumulationPool().isEmpty());
        assertEquals(SessionState.RoutingOutcome.DEFERRED, late.outcome());
        assertEquals(List.of("m2"), ids(state.getBackgroundPool()));
    }

    @Test
    void shouldIgnoreDrainAndReleaseFromForeignCycle() {
        SessionState state = fresh();
        state.route(message("m1", "alice", 0), factory, CAPACITY);
        StubCycle foreign = new StubCycle("foreign");

        assertTrue(state.drainForGeneration(foreign).isEmpty());
        assertTrue(state.releaseAndPromote(foreign, factory).isEmpty());
        assertTrue(state.isLocked());
    }

    @Test
    void shouldClearOwnerOnReleaseWhenNothingIsDeferred() {
        SessionState state = fresh();
        SessionState.Routing opened = state.route(message("m1", "alice", 0), factory, CAPACITY);
        state.drainForGeneration(opened.cycle());

        Optional<GenerationCycle> successor = state.releaseAndPromote(opened.cycle(), factory);

        assertTrue(successor.isEmpty());
        assertFalse(state.isLocked());
        assertTrue(state.getOwnerSenderId().isEmpty());
        assertTrue(state.getBackgroundPool().isEmpty());
    }

    @Test
    void shouldCarryUndrainedLeftoversIntoPromotedCycle() {
        SessionState state = fresh();
        SessionState.Routing opened = state.route(message("m1", "alice", 0), factory, CAPACITY);
        state.route(message("b1", "bob", 1), factory, CAPACITY);

        Optional<GenerationCycle> successor = state.releaseAndPromote(opened.cycle(), s -> new StubCycle("next"));

        assertTrue(successor.isPresent());
        assertSame(successor.get(), state.getActiveCycle().orElseThrow());
        assertEquals(Optional.of("alice"), state.getOwnerSenderId());
        assertEquals(List.of("m1", "b1"), ids(state.getAccumulationPool()));
        assertTrue(state.getBackgroundPool().isEmpty());
    }

    @Test
    void shouldPromoteBackgroundInArrivalOrderWithEarliestSenderAsOwner() {
        SessionState state = fresh();
        SessionState.Routing opened = state.route(message("m1", "alice", 0), factory, CAPACITY);
        state.route(message("late", "carol", 9), factory, CAPACITY);
        state.route(message("early", "bob", 3), factory, CAPACITY);
        state.drainForGeneration(opened.cycle());

        Optional<GenerationCycle> promoted = state.releaseAndPromote(opened.cycle(), s -> new StubCycle("next"));

        assertTrue(promoted.isPresent());
        assertEquals(Optional.of("bob"), state.getOwnerSenderId());
        assertEquals(List.of("early", "late"), ids(state.getAccumulationPool()));
        assertTrue(state.getBackgroundPool().isEmpty());
    }

    @Test
    void shouldDeferNewcomerBehindPromotedCycle() {
        SessionState state = fresh();
        SessionState.Routing opened = state.route(message("x1", "xavier", 0), factory, CAPACITY);
        state.route(message("y1", "yana", 1), factory, CAPACITY);
        state.drainForGeneration(opened.cycle());
        state.releaseAndPromote(opened.cycle(), s -> new StubCycle("next"));

        SessionState.Routing newcomer = state.route(message("z1", "zed", 2), factory, CAPACITY);

        assertEquals(SessionState.RoutingOutcome.DEFERRED, newcomer.outcome());
        assertEquals(Optional.of("yana"), state.getOwnerSenderId());
        assertEquals(List.of("y1"), ids(state.getAccumulationPool()));
        assertEquals(List.of("z1"), ids(state.getBackgroundPool()));
    }

    @Test
    void shouldKeepMostRecentAmbientMessages() {
        SessionState state = fresh();

        state.appendAmbient(message("a1", "x", 0), 2);
        state.appendAmbient(message("a2", "y", 1), 2);
        state.appendAmbient(message("a3", "z", 2), 2);

        assertEquals(List.of("a2", "a3"), ids(state.getAmbientContext()));
        assertEquals(List.of("a2", "a3"), ids(state.snapshot().getAmbientContext()));
    }

    @Test
    void shouldChargeEnergyAndApplySentimentOnSuccess() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.5, NOW, TODAY);

        state.applyCycleOutcome(0.05, 0.3, NOW.plusSeconds(10));

        assertEquals(0.45, state.getEnergy(), 1e-9);
        assertEquals(0.3, state.getMood(), 1e-9);
        assertEquals(NOW.plusSeconds(10), state.getLastReplyTime());
        assertEquals(1, state.getTotalReplies());
    }

    @Test
    void shouldChargeEnergyOnlyOnFailure() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.02, NOW, TODAY);

        state.applyCycleOutcome(0.05, null, NOW);

        assertEquals(0.0, state.getEnergy(), 1e-9);
        assertEquals(0.0, state.getMood(), 1e-9);
        assertNull(state.getLastReplyTime());
        assertEquals(0, state.getTotalReplies());
        assertTrue(state.isDirty());
    }

    @Test
    void shouldClampMoodToRange() {
        SessionState state = fresh();

        state.applyCycleOutcome(0.0, 0.8, NOW);
        state.applyCycleOutcome(0.0, 0.8, NOW);

        assertEquals(SessionState.MAX_MOOD, state.getMood(), 1e-9);
    }

    @Test
    void shouldNotRecoverEnergyWhileLocked() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.3, NOW, TODAY);
        state.route(message("m1", "alice", 0), factory, CAPACITY);

        assertFalse(state.recoverEnergy(0.1, 0.8));
        assertEquals(0.3, state.getEnergy(), 1e-9);
    }

    @Test
    void shouldCapRecoveryAtCeiling() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.75, NOW, TODAY);

        assertTrue(state.recoverEnergy(0.1, 0.8));
        assertEquals(0.8, state.getEnergy(), 1e-9);
        assertFalse(state.recoverEnergy(0.1, 0.8));
    }

    @Test
    void shouldDecayMoodTowardZeroWithoutCrossing() {
        SessionState state = fresh();
        state.applyCycleOutcome(0.0, -0.15, NOW);

        assertTrue(state.decayMood(0.1, NOW));
        assertEquals(-0.05, state.getMood(), 1e-9);
        assertTrue(state.decayMood(0.1, NOW));
        assertEquals(0.0, state.getMood(), 1e-9);
        assertFalse(state.decayMood(0.1, NOW));
    }

    @Test
    void shouldApplyDailyResetOncePerDay() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.5, NOW, TODAY.minusDays(1));
        state.applyCycleOutcome(0.0, 0.6, NOW);

        assertTrue(state.applyDailyReset(TODAY, 0.2, NOW));
        assertEquals(0.7, state.getEnergy(), 1e-9);
        assertEquals(0.0, state.getMood(), 1e-9);
        assertEquals(TODAY, state.getLastDailyResetDate());
        assertFalse(state.applyDailyReset(TODAY, 0.2, NOW));
    }

    @Test
    void shouldKeepDirtyWhenChangedAfterSnapshot() {
        SessionState state = fresh();
        long version = state.getVersion();

        state.markDirty();

        assertFalse(state.clearDirty(version));
        assertTrue(state.isDirty());
        assertTrue(state.clearDirty(state.getVersion()));
        assertFalse(state.isDirty());
    }

    @Test
    void shouldBeEvictableOnlyWhenIdleAndClean() {
        SessionState state = fresh();
        assertFalse(state.isEvictable());

        state.clearDirty(state.getVersion());
        assertTrue(state.isEvictable());

        SessionState.Routing routing = state.route(message("m1", "alice", 0), factory, CAPACITY);
        assertFalse(state.isEvictable());

        state.drainForGeneration(routing.cycle());
        state.releaseAndPromote(routing.cycle(), factory);
        state.clearDirty(state.getVersion());
        assertTrue(state.isEvictable());
    }

    @Test
    void shouldClampValuesOnRestore() {
        PersistedSessionState persisted = PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(1.7)
                .mood(-3.0)
                .totalReplies(4)
                .build();

        SessionState state = SessionState.restore(persisted, NOW);

        assertEquals(1.0, state.getEnergy(), 1e-9);
        assertEquals(-1.0, state.getMood(), 1e-9);
        assertEquals(4, state.getTotalReplies());
        assertEquals(NOW, state.getLastMoodChangeTime());
        assertNull(state.getLastReplyTime());
        assertFalse(state.isDirty());
    }

    @Test
    void shouldRoundTripPersistedFields() {
        SessionState state = SessionState.fresh(SESSION_ID, 0.6, NOW, TODAY);
        state.applyCycleOutcome(0.1, 0.2, NOW.plus(Duration.ofMinutes(1)));

        PersistedSessionState persisted = state.toPersisted(NOW.plus(Duration.ofMinutes(2)));

        assertEquals(SESSION_ID, persisted.getSessionId());
        assertEquals(0.5, persisted.getEnergy(), 1e-9);
        assertEquals(0.2, persisted.getMood(), 1e-9);
        assertEquals(TODAY, persisted.getLastDailyResetDate());
        assertEquals(1, persisted.getTotalReplies());
        assertEquals(NOW.plus(Duration.ofMinutes(2)), persisted.getUpdatedAt());
    }

    @Test
    void shouldStartUnverifiedStateCleanAndLetDurableRecordWin() {
        SessionState state = SessionState.unverified(SESSION_ID, 0.8, NOW, TODAY);
        assertFalse(state.isDirty());
        assertTrue(state.isLoadPending());

        state.applyCycleOutcome(0.05, 0.1, NOW);
        state.adoptDurable(PersistedSessionState.builder()
                .sessionId(SESSION_ID)
                .energy(0.2)
                .mood(-0.5)
                .lastDailyResetDate(TODAY.minusDays(1))
                .totalReplies(42)
                .build());

        assertEquals(0.2, state.getEnergy(), 1e-9);
        assertEquals(-0.5, state.getMood(), 1e-9);
        assertEquals(42, state.getTotalReplies());
        assertEquals(TODAY.minusDays(1), state.getLastDailyResetDate());
        assertFalse(state.isDirty());
        assertFalse(state.isLoadPending());
    }

    private static SessionState fresh() {
        return SessionState.fresh(SESSION_ID, 0.8, NOW, TODAY);
    }

    private static InboundMessage message(String id, String sender, long offsetSeconds) {
        return InboundMessage.builder()
                .id(id)
                .sessionId(SESSION_ID)
                .senderId(sender)
                .text("text " + id)
                .arrivalTime(NOW.plusSeconds(offsetSeconds))
                .build();
    }

    private static List<String> ids(List<InboundMessage> messages) {
        return messages.stream().map(InboundMessage::getId).toList();
    }

    private static final class StubCycle implements GenerationCycle {

        private final String id;

        private StubCycle(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public CycleState getState() {
            return CycleState.WAITING;
        }

        @Override
        public void rearm() {
            // not needed for state tests
        }
    }
}
