package me.golemcore.attention.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-session runtime state: the energy/mood budget, the generation lock with
 * its owner, and the accumulation, background and ambient pools.
 *
 * <p>
 * All mutable fields are guarded by a single per-session monitor, so ownership
 * and lock are always observed together: {@code ownerSenderId != null} if and
 * only if a cycle holds the lock. Persistence bookkeeping (dirty flag, version)
 * is driven by the session store; routing code only uses the pool operations.
 *
 * @since 1.0
 */
public class SessionState {

    public static final double MIN_ENERGY = 0.0;
    public static final double MAX_ENERGY = 1.0;
    public static final double MIN_MOOD = -1.0;
    public static final double MAX_MOOD = 1.0;

    private final String sessionId;
    private final Instant loadedAt;
    private final Object monitor = new Object();

    private final Deque<InboundMessage> accumulationPool = new ArrayDeque<>();
    private final Deque<InboundMessage> backgroundPool = new ArrayDeque<>();
    private final Deque<InboundMessage> ambientContext = new ArrayDeque<>();

    private double energy;
    private double mood;
    private Instant lastReplyTime;
    private LocalDate lastDailyResetDate;
    private Instant lastMoodChangeTime;
    private int totalReplies;

    private GenerationCycle activeCycle;
    private String ownerSenderId;
    private boolean windowOpen;

    private boolean dirty;
    private boolean loadPending;
    private long version;
    private volatile Instant lastAccessTime;

    private SessionState(String sessionId, Instant loadedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.loadedAt = loadedAt;
        this.lastAccessTime = loadedAt;
    }

    /**
     * Creates a brand-new session that has never been persisted.
     */
    public static SessionState fresh(String sessionId, double initialEnergy, Instant now, LocalDate today) {
        SessionState state = new SessionState(sessionId, now);
        state.energy = clampEnergy(initialEnergy);
        state.mood = 0.0;
        state.lastDailyResetDate = today;
        state.lastMoodChangeTime = now;
        state.dirty = true;
        state.version = 1;
        return state;
    }

    /**
     * Default state used when the durable record could not be read. It starts
     * clean, and the store must reconcile it with the record before writing it
     * back, so an unreachable store never gets its record reset to defaults.
     */
    public static SessionState unverified(String sessionId, double initialEnergy, Instant now, LocalDate today) {
        SessionState state = fresh(sessionId, initialEnergy, now, today);
        state.dirty = false;
        state.loadPending = true;
        return state;
    }

    /**
     * Rebuilds a session from its durable form; out-of-range values are clamped.
     */
    public static SessionState restore(PersistedSessionState persisted, Instant now) {
        SessionState state = new SessionState(persisted.getSessionId(), now);
        state.lastMoodChangeTime = now;
        state.applyPersistedLocked(persisted);
        return state;
    }

    // ==================== Routing ====================

    /**
     * Routes an admitted message atomically.
     *
     * <ul>
     * <li>No cycle: a new cycle is created by {@code cycleFactory}, the lock is
     * taken for the sender and the message seeds the accumulation pool.</li>
     * <li>Cycle with an open window and the message is from the owner: appended to
     * the accumulation pool.</li>
     * <li>Otherwise: appended to the background pool, dropping the oldest entry
     * past {@code backgroundCapacity}.</li>
     * </ul>
     */
    public Routing route(InboundMessage message, Function<SessionState, GenerationCycle> cycleFactory,
            int backgroundCapacity) {
        Objects.requireNonNull(message, "message");
        synchronized (monitor) {
            if (activeCycle == null) {
                GenerationCycle cycle = cycleFactory.apply(this);
                takeLockLocked(cycle, message.getSenderId());
                accumulationPool.addLast(message);
                return new Routing(RoutingOutcome.OPENED, cycle, null);
            }
            if (windowOpen && Objects.equals(ownerSenderId, message.getSenderId())) {
                accumulationPool.addLast(message);
                return new Routing(RoutingOutcome.EXTENDED, activeCycle, null);
            }
            InboundMessage dropped = appendBounded(backgroundPool, message, backgroundCapacity);
            return new Routing(RoutingOutcome.DEFERRED, activeCycle, dropped);
        }
    }

    /**
     * Snapshot-and-clear of the accumulation pool; closes the window so later
     * owner messages are deferred instead of stranded.
     */
    public List<InboundMessage> drainForGeneration(GenerationCycle cycle) {
        synchronized (monitor) {
            if (activeCycle != cycle) {
                return List.of();
            }
            windowOpen = false;
            List<InboundMessage> batch = new ArrayList<>(accumulationPool);
            accumulationPool.clear();
            return batch;
        }
    }

    /**
     * Releases the lock held by {@code cycle} and, in the same critical section,
     * promotes the background pool into a new cycle owned by the sender of the
     * earliest deferred message. Anything still in the accumulation pool goes to
     * the front of the deferred messages. The promoted cycle is returned unarmed;
     * a message arriving after this call finds the lock already taken.
     *
     * @return the promoted cycle, or empty if nothing was deferred or
     *         {@code cycle} does not hold the lock
     */
    public Optional<GenerationCycle> releaseAndPromote(GenerationCycle cycle,
            Function<SessionState, GenerationCycle> cycleFactory) {
        synchronized (monitor) {
            if (activeCycle != cycle) {
                return Optional.empty();
            }
            while (!accumulationPool.isEmpty()) {
                backgroundPool.addFirst(accumulationPool.removeLast());
            }
            activeCycle = null;
            ownerSenderId = null;
            windowOpen = false;
            if (backgroundPool.isEmpty()) {
                return Optional.empty();
            }

            List<InboundMessage> deferred = new ArrayList<>(backgroundPool);
            deferred.sort(Comparator.comparing(SessionState::arrivalOf));
            backgroundPool.clear();

            GenerationCycle next = cycleFactory.apply(this);
            takeLockLocked(next, deferred.get(0).getSenderId());
            accumulationPool.addAll(deferred);
            return Optional.of(next);
        }
    }

    /**
     * Remembers an ignored message as ambient context, keeping at most
     * {@code capacity} of the most recent ones.
     */
    public void appendAmbient(InboundMessage message, int capacity) {
        synchronized (monitor) {
            appendBounded(ambientContext, message, capacity);
        }
    }

    // ==================== Energy & mood ====================

    /**
     * Applies the deltas of a finished cycle. {@code sentimentDelta} is null when
     * generation failed, in which case only the energy cost is charged and the
     * reply bookkeeping is left alone.
     */
    public void applyCycleOutcome(double energyCost, Double sentimentDelta, Instant now) {
        synchronized (monitor) {
            energy = clampEnergy(energy - energyCost);
            if (sentimentDelta != null) {
                mood = clampMood(mood + sentimentDelta);
                lastMoodChangeTime = now;
                lastReplyTime = now;
                totalReplies++;
            }
            markDirtyLocked();
        }
    }

    /**
     * Passive recovery: raises energy by {@code increment}, never above
     * {@code ceiling}. No-op while a cycle holds the lock.
     */
    public boolean recoverEnergy(double increment, double ceiling) {
        synchronized (monitor) {
            if (activeCycle != null || energy >= ceiling) {
                return false;
            }
            energy = clampEnergy(Math.min(ceiling, energy + increment));
            markDirtyLocked();
            return true;
        }
    }

    /**
     * Moves mood one {@code step} toward zero without crossing it.
     */
    public boolean decayMood(double step, Instant now) {
        synchronized (monitor) {
            if (mood == 0.0) {
                return false;
            }
            mood = mood > 0 ? Math.max(0.0, mood - step) : Math.min(0.0, mood + step);
            lastMoodChangeTime = now;
            markDirtyLocked();
            return true;
        }
    }

    /**
     * Once per calendar day: energy bump and mood reset.
     */
    public boolean applyDailyReset(LocalDate today, double energyBump, Instant now) {
        synchronized (monitor) {
            if (today.equals(lastDailyResetDate)) {
                return false;
            }
            lastDailyResetDate = today;
            energy = clampEnergy(energy + energyBump);
            mood = 0.0;
            lastMoodChangeTime = now;
            markDirtyLocked();
            return true;
        }
    }

    // ==================== Persistence bookkeeping ====================

    public void markDirty() {
        synchronized (monitor) {
            markDirtyLocked();
        }
    }

    /**
     * True while the state was built from defaults after a failed load and has
     * not been reconciled with the durable record yet.
     */
    public boolean isLoadPending() {
        synchronized (monitor) {
            return loadPending;
        }
    }

    /**
     * Replaces the durable fields with {@code persisted}, which wins over any
     * change made to the default state since the failed load. Pools and the
     * lock are untouched; the session is clean afterwards.
     */
    public void adoptDurable(PersistedSessionState persisted) {
        synchronized (monitor) {
            applyPersistedLocked(persisted);
            loadPending = false;
            dirty = false;
            version++;
        }
    }

    /**
     * The retried load found no durable record, so the current state may be
     * written as is.
     */
    public void confirmNew() {
        synchronized (monitor) {
            loadPending = false;
        }
    }

    public boolean isDirty() {
        synchronized (monitor) {
            return dirty;
        }
    }

    /**
     * Version of the state; incremented on every mutation that sets the dirty
     * flag.
     */
    public long getVersion() {
        synchronized (monitor) {
            return version;
        }
    }

    /**
     * Clears the dirty flag if no mutation happened since {@code savedVersion}
     * was captured.
     */
    public boolean clearDirty(long savedVersion) {
        synchronized (monitor) {
            if (version != savedVersion) {
                return false;
            }
            dirty = false;
            return true;
        }
    }

    /**
     * Busy sessions (lock held, non-empty pool) and unsaved ones must stay in
     * memory.
     */
    public boolean isEvictable() {
        synchronized (monitor) {
            return activeCycle == null && accumulationPool.isEmpty() && backgroundPool.isEmpty() && !dirty;
        }
    }

    public PersistedSessionState toPersisted(Instant now) {
        synchronized (monitor) {
            return PersistedSessionState.builder()
                    .sessionId(sessionId)
                    .energy(energy)
                    .mood(mood)
                    .lastReplyTime(lastReplyTime)
                    .lastDailyResetDate(lastDailyResetDate)
                    .lastMoodChangeTime(lastMoodChangeTime)
                    .totalReplies(totalReplies)
                    .updatedAt(now)
                    .build();
        }
    }

    public SessionSnapshot snapshot() {
        synchronized (monitor) {
            return SessionSnapshot.builder()
                    .sessionId(sessionId)
                    .energy(energy)
                    .mood(mood)
                    .lastReplyTime(lastReplyTime)
                    .totalReplies(totalReplies)
                    .ambientContext(new ArrayList<>(ambientContext))
                    .build();
        }
    }

    public void touch(Instant now) {
        this.lastAccessTime = now;
    }

    // ==================== Accessors ====================

    public String getSessionId() {
        return sessionId;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public Instant getLastAccessTime() {
        return lastAccessTime;
    }

    public double getEnergy() {
        synchronized (monitor) {
            return energy;
        }
    }

    public double getMood() {
        synchronized (monitor) {
            return mood;
        }
    }

    public Instant getLastReplyTime() {
        synchronized (monitor) {
            return lastReplyTime;
        }
    }

    public LocalDate getLastDailyResetDate() {
        synchronized (monitor) {
            return lastDailyResetDate;
        }
    }

    public Instant getLastMoodChangeTime() {
        synchronized (monitor) {
            return lastMoodChangeTime;
        }
    }

    public int getTotalReplies() {
        synchronized (monitor) {
            return totalReplies;
        }
    }

    public boolean isLocked() {
        synchronized (monitor) {
            return activeCycle != null;
        }
    }

    public Optional<GenerationCycle> getActiveCycle() {
        synchronized (monitor) {
            return Optional.ofNullable(activeCycle);
        }
    }

    public Optional<String> getOwnerSenderId() {
        synchronized (monitor) {
            return Optional.ofNullable(ownerSenderId);
        }
    }

    public List<InboundMessage> getAccumulationPool() {
        synchronized (monitor) {
            return List.copyOf(accumulationPool);
        }
    }

    public List<InboundMessage> getBackgroundPool() {
        synchronized (monitor) {
            return List.copyOf(backgroundPool);
        }
    }

    public List<InboundMessage> getAmbientContext() {
        synchronized (monitor) {
            return List.copyOf(ambientContext);
        }
    }

    // ==================== Internals ====================

    private void takeLockLocked(GenerationCycle cycle, String owner) {
        activeCycle = Objects.requireNonNull(cycle, "cycle");
        ownerSenderId = Objects.requireNonNull(owner, "owner");
        windowOpen = true;
    }

    private void applyPersistedLocked(PersistedSessionState persisted) {
        energy = clampEnergy(persisted.getEnergy());
        mood = clampMood(persisted.getMood());
        lastReplyTime = persisted.getLastReplyTime();
        lastDailyResetDate = persisted.getLastDailyResetDate();
        if (persisted.getLastMoodChangeTime() != null) {
            lastMoodChangeTime = persisted.getLastMoodChangeTime();
        }
        totalReplies = persisted.getTotalReplies();
    }

    private void markDirtyLocked() {
        dirty = true;
        version++;
    }

    private static InboundMessage appendBounded(Deque<InboundMessage> pool, InboundMessage message, int capacity) {
        InboundMessage dropped = null;
        if (capacity <= 0) {
            return message;
        }
        if (pool.size() >= capacity) {
            dropped = pool.removeFirst();
        }
        pool.addLast(message);
        return dropped;
    }

    private static Instant arrivalOf(InboundMessage message) {
        return message.getArrivalTime() != null ? message.getArrivalTime() : Instant.EPOCH;
    }

    private static double clampEnergy(double value) {
        return Math.max(MIN_ENERGY, Math.min(MAX_ENERGY, value));
    }

    private static double clampMood(double value) {
        return Math.max(MIN_MOOD, Math.min(MAX_MOOD, value));
    }

    /**
     * How an admitted message was routed.
     */
    public enum RoutingOutcome {
        /** The message opened a new cycle and took the lock. */
        OPENED,
        /** The message extended the owner's open window. */
        EXTENDED,
        /** The message was deferred to the background pool. */
        DEFERRED
    }

    /**
     * Result of {@link #route}. {@code dropped} is the background message evicted
     * by the capacity bound, if any.
     */
    public record Routing(RoutingOutcome outcome, GenerationCycle cycle, InboundMessage dropped) {
    }
}
