package me.golemcore.attention.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.attention.domain.model.CycleState;
import me.golemcore.attention.domain.model.GenerationCycle;
import me.golemcore.attention.domain.model.GenerationResult;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import me.golemcore.attention.port.outbound.GeneratorPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Owns the sliding collection window of each generation cycle.
 *
 * <p>
 * A cycle moves through {@code OPEN -> WAITING -> CLOSING -> DONE}:
 * <ul>
 * <li>the quiet timer is re-armed on every owner message;</li>
 * <li>the window closes when the owner was quiet for the quiet period, or when
 * the window ceiling is reached regardless of resets;</li>
 * <li>on closing the accumulation pool is drained atomically and handed to the
 * generator in arrival order;</li>
 * <li>when the generator completes, successfully or not, energy is charged, mood
 * is updated on success only, and the lock is released. Releasing promotes the
 * background pool into the next cycle under the same session monitor, then the
 * {@link CycleListener} runs.</li>
 * </ul>
 *
 * <p>
 * The closing transition happens exactly once per cycle. The aggregator never
 * cancels a generation call.
 */
@Service
@Slf4j
public class DebounceAggregator {

    private final GeneratorPort generatorPort;
    private final AttentionProperties properties;
    private final ScheduledExecutorService debounceScheduler;
    private final Clock clock;
    private final AtomicLong cycleSequence = new AtomicLong();

    public DebounceAggregator(GeneratorPort generatorPort, AttentionProperties properties,
            @Qualifier("debounceScheduler") ScheduledExecutorService debounceScheduler, Clock clock) {
        this.generatorPort = generatorPort;
        this.properties = properties;
        this.debounceScheduler = debounceScheduler;
        this.clock = clock;
    }

    /**
     * Factory for new, not yet armed cycles. Cycles promoted from the background
     * pool are created by the same factory.
     */
    public Function<SessionState, GenerationCycle> cycleFactory(CycleListener listener) {
        return new CycleFactory(listener);
    }

    /**
     * Notified once per cycle, after its lock was released.
     */
    @FunctionalInterface
    public interface CycleListener {

        /**
         * @param successor
         *            the cycle promoted from the background pool, already holding
         *            the lock but not armed yet; null when nothing was deferred
         */
        void onCycleDone(SessionState session, GenerationCycle successor);
    }

    private final class CycleFactory implements Function<SessionState, GenerationCycle> {

        private final CycleListener listener;

        private CycleFactory(CycleListener listener) {
            this.listener = listener;
        }

        @Override
        public GenerationCycle apply(SessionState session) {
            return new DebounceCycle(session, this);
        }
    }

    private final class DebounceCycle implements GenerationCycle {

        private final String id;
        private final SessionState session;
        private final CycleFactory factory;
        private final long deadlineNanos;
        private final Duration quietPeriod;
        private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.OPEN);
        private final Object timerLock = new Object();

        private ScheduledFuture<?> quietTimer;
        private long armSequence;

        private DebounceCycle(SessionState session, CycleFactory factory) {
            this.id = session.getSessionId() + "#" + cycleSequence.incrementAndGet();
            this.session = session;
            this.factory = factory;
            this.quietPeriod = properties.getDebounce().getQuietPeriod();
            this.deadlineNanos = System.nanoTime() + properties.getDebounce().getMaxWindow().toNanos();
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public CycleState getState() {
            return state.get();
        }

        @Override
        public void rearm() {
            synchronized (timerLock) {
                CycleState current = state.get();
                if (current != CycleState.OPEN && current != CycleState.WAITING) {
                    return;
                }
                if (current == CycleState.OPEN) {
                    state.set(CycleState.WAITING);
                    log.info("[Debounce] window opened: sessionId={}, cycle={}, owner={}",
                            session.getSessionId(), id, session.getOwnerSenderId().orElse(null));
                }
                if (quietTimer != null) {
                    quietTimer.cancel(false);
                }
                long sequence = ++armSequence;
                long delayNanos = Math.min(quietPeriod.toNanos(), deadlineNanos - System.nanoTime());
                try {
                    quietTimer = debounceScheduler.schedule(() -> onTimer(sequence),
                            Math.max(0L, delayNanos), TimeUnit.NANOSECONDS);
                    return;
                } catch (RejectedExecutionException e) {
                    log.warn("[Debounce] timer rejected, closing window now: sessionId={}, cycle={}",
                            session.getSessionId(), id);
                }
            }
            close();
        }

        private void onTimer(long sequence) {
            synchronized (timerLock) {
                if (sequence != armSequence) {
                    return;
                }
            }
            try {
                close();
            } catch (RuntimeException e) { // NOSONAR - must not kill timer thread
                log.error("[Debounce] close failed: sessionId={}, cycle={}", session.getSessionId(), id, e);
                finish(null, e);
            }
        }

        private void close() {
            if (!state.compareAndSet(CycleState.WAITING, CycleState.CLOSING)) {
                return;
            }
            synchronized (timerLock) {
                if (quietTimer != null) {
                    quietTimer.cancel(false);
                    quietTimer = null;
                }
            }

            List<InboundMessage> batch = session.drainForGeneration(this);
            if (batch.isEmpty()) {
                log.debug("[Debounce] window closed empty: sessionId={}, cycle={}", session.getSessionId(), id);
                release();
                return;
            }

            log.info("[Debounce] window closed, {} messages -> generator: sessionId={}, cycle={}",
                    batch.size(), session.getSessionId(), id);
            CompletableFuture<GenerationResult> generation;
            try {
                generation = generatorPort.generate(session.getSessionId(), session.snapshot(), List.copyOf(batch));
                if (generation == null) {
                    generation = CompletableFuture.failedFuture(
                            new IllegalStateException("generator returned no result"));
                }
            } catch (RuntimeException e) { // NOSONAR - a throwing generator still completes the cycle
                generation = CompletableFuture.failedFuture(e);
            }
            generation.whenComplete(this::finish);
        }

        private void finish(GenerationResult result, Throwable error) {
            try {
                double cost = properties.getEnergy().getCostPerCycle();
                if (error != null) {
                    log.warn("[Debounce] generation failed: sessionId={}, cycle={}: {}",
                            session.getSessionId(), id, error.getMessage());
                    session.applyCycleOutcome(cost, null, clock.instant());
                } else {
                    double delta = result != null ? clampSentiment(result.getSentimentDelta()) : 0.0;
                    session.applyCycleOutcome(cost, delta, clock.instant());
                    log.debug("[Debounce] generation done: sessionId={}, cycle={}, energy={}, mood={}, moodTag={}",
                            session.getSessionId(), id, session.getEnergy(), session.getMood(),
                            result != null ? result.getMoodTag() : null);
                }
            } catch (RuntimeException e) { // NOSONAR - lock must still be released
                log.error("[Debounce] failed to apply cycle outcome: sessionId={}, cycle={}",
                        session.getSessionId(), id, e);
            } finally {
                release();
            }
        }

        private void release() {
            if (state.getAndSet(CycleState.DONE) == CycleState.DONE) {
                return;
            }
            GenerationCycle successor = session.releaseAndPromote(this, factory).orElse(null);
            log.debug("[Debounce] lock released: sessionId={}, cycle={}, successor={}",
                    session.getSessionId(), id, successor);
            try {
                factory.listener.onCycleDone(session, successor);
            } catch (RuntimeException e) { // NOSONAR - a promoted cycle must not keep the lock unarmed
                log.error("[Debounce] completion callback failed: sessionId={}, cycle={}",
                        session.getSessionId(), id, e);
                if (successor != null) {
                    successor.rearm();
                }
            }
        }

        @Override
        public String toString() {
            return id;
        }
    }

    private static double clampSentiment(double delta) {
        if (Double.isNaN(delta)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, delta));
    }
}
