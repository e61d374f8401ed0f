package me.golemcore.attention.scheduler;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.domain.service.SessionStateStore;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic maintenance of cached sessions.
 *
 * <p>
 * Each tick, for every cached session:
 * <ul>
 * <li>passive energy recovery after a long silence, up to the recovery
 * ceiling</li>
 * <li>mood decay toward neutral once per decay interval</li>
 * <li>the daily reset on the first tick of a new calendar day</li>
 * <li>write-back of dirty state, then eviction of sessions idle past the
 * TTL</li>
 * </ul>
 *
 * <p>
 * Ticks never overlap: if a tick is still running, the next one is skipped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class StateDecayScheduler {

    private final SessionStateStore sessionStateStore;
    private final AttentionProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public StateDecayScheduler(SessionStateStore sessionStateStore, AttentionProperties properties, Clock clock) {
        this.sessionStateStore = sessionStateStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        AttentionProperties.MaintenanceProperties maintenance = properties.getMaintenance();
        if (!maintenance.isEnabled()) {
            log.info("[DecayScheduler] Maintenance disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "state-decay-scheduler");
            t.setDaemon(true);
            return t;
        });

        long tickSeconds = Math.max(1, maintenance.getTickSeconds());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, tickSeconds, tickSeconds, TimeUnit.SECONDS);
        log.info("[DecayScheduler] Started with tick interval: {}s", tickSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[DecayScheduler] Shut down");
    }

    /**
     * Runs one maintenance pass over all cached sessions.
     */
    public void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[DecayScheduler] Previous tick still running, skipping");
            return;
        }
        try {
            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);
            Duration ttl = Duration.ofSeconds(properties.getEviction().getTtlSeconds());
            for (String sessionId : sessionStateStore.cachedSessionIds()) {
                try {
                    maintain(sessionId, now, today, ttl);
                } catch (RuntimeException e) { // NOSONAR - one session must not stall the pass
                    log.error("[DecayScheduler] maintenance failed: sessionId={}", sessionId, e);
                }
            }
        } finally {
            executing.set(false);
        }
    }

    private void maintain(String sessionId, Instant now, LocalDate today, Duration ttl) {
        Optional<SessionState> cached = sessionStateStore.peek(sessionId);
        if (cached.isEmpty()) {
            return;
        }
        SessionState session = cached.get();

        if (session.applyDailyReset(today, properties.getEnergy().getDailyRecovery(), now)) {
            log.info("[DecayScheduler] daily reset: sessionId={}, energy={}", sessionId, session.getEnergy());
        }
        recoverEnergy(session, now);
        decayMood(session, now);

        sessionStateStore.flush(sessionId)
                .whenComplete((clean, error) -> sessionStateStore.evictIfIdle(sessionId, ttl));
    }

    private void recoverEnergy(SessionState session, Instant now) {
        AttentionProperties.EnergyProperties energy = properties.getEnergy();
        Instant lastActivity = session.getLastReplyTime() != null ? session.getLastReplyTime() : session.getLoadedAt();
        Duration silence = Duration.between(lastActivity, now);
        if (silence.compareTo(Duration.ofMinutes(energy.getRecoverySilenceMinutes())) <= 0) {
            return;
        }
        if (session.recoverEnergy(energy.getRecoveryIncrement(), energy.getRecoveryCeiling())) {
            log.debug("[DecayScheduler] passive recovery: sessionId={}, energy={}",
                    session.getSessionId(), session.getEnergy());
        }
    }

    private void decayMood(SessionState session, Instant now) {
        AttentionProperties.MoodProperties mood = properties.getMood();
        Duration sinceChange = Duration.between(session.getLastMoodChangeTime(), now);
        if (sinceChange.compareTo(Duration.ofSeconds(mood.getDecayIntervalSeconds())) < 0) {
            return;
        }
        if (session.decayMood(mood.getDecayStep(), now)) {
            log.debug("[DecayScheduler] mood decay: sessionId={}, mood={}", session.getSessionId(), session.getMood());
        }
    }
}
