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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.attention.domain.model.PersistedSessionState;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import me.golemcore.attention.port.outbound.SessionStatePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lazy-loading, write-back cache of per-session state.
 *
 * <p>
 * Sessions are loaded from {@link SessionStatePort} on first touch (or created
 * with default energy/mood), mutated in memory, and written back by
 * {@link #flush(String)}. Loading happens outside the map; only installing the
 * loaded state and touching it run inside the per-key compute lock, so a
 * session that is being fetched can never be evicted at the same time. A
 * session is only evicted when it holds no lock, both pools are empty and it
 * has no unsaved changes.
 *
 * <p>
 * When the durable record cannot be read in time the session starts from
 * defaults, and the store reads the record again before its first write-back,
 * so a slow store never has its record replaced by defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStateStore {

    private final SessionStatePort sessionStatePort;
    private final AttentionProperties properties;
    private final Clock clock;

    private final Map<String, SessionState> cache = new ConcurrentHashMap<>();

    /**
     * Returns the cached session, loading or creating it if absent. Every call
     * refreshes the session's last access time.
     */
    public SessionState get(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        while (true) {
            SessionState loaded = cache.containsKey(sessionId) ? null : loadOrCreate(sessionId);
            SessionState state = cache.compute(sessionId, (id, existing) -> {
                SessionState chosen = existing != null ? existing : loaded;
                if (chosen != null) {
                    chosen.touch(clock.instant());
                }
                return chosen;
            });
            if (state != null) {
                return state;
            }
            // evicted between the check and the compute
        }
    }

    /**
     * Returns the cached session without loading or touching it.
     */
    public Optional<SessionState> peek(String sessionId) {
        return Optional.ofNullable(cache.get(sessionId));
    }

    public void markDirty(String sessionId) {
        SessionState state = cache.get(sessionId);
        if (state != null) {
            state.markDirty();
        }
    }

    /**
     * Persists the session if it is dirty. The dirty flag is cleared only when
     * the save succeeded and nothing changed while it was in flight; on failure
     * it stays set and the next maintenance pass retries.
     *
     * @return future completing with true when the session is clean afterwards
     */
    public CompletableFuture<Boolean> flush(String sessionId) {
        SessionState state = cache.get(sessionId);
        if (state == null || !state.isDirty()) {
            return CompletableFuture.completedFuture(true);
        }
        if (state.isLoadPending()) {
            return reconcile(sessionId, state)
                    .thenCompose(ready -> Boolean.TRUE.equals(ready)
                            ? persist(sessionId, state)
                            : CompletableFuture.completedFuture(false));
        }
        return persist(sessionId, state);
    }

    private CompletableFuture<Boolean> persist(String sessionId, SessionState state) {
        if (!state.isDirty()) {
            return CompletableFuture.completedFuture(true);
        }
        long version = state.getVersion();
        PersistedSessionState snapshot = state.toPersisted(clock.instant());
        CompletableFuture<Void> save;
        try {
            save = sessionStatePort.save(snapshot);
        } catch (RuntimeException e) { // NOSONAR - store failures are retried, never propagated
            save = CompletableFuture.failedFuture(e);
        }

        return save.handle((ignored, error) -> {
            if (error != null) {
                log.error("[StateStore] failed to persist session, will retry: sessionId={}: {}",
                        sessionId, rootMessage(error));
                return false;
            }
            boolean cleared = state.clearDirty(version);
            if (!cleared) {
                log.debug("[StateStore] session changed during flush, stays dirty: sessionId={}", sessionId);
            }
            return cleared;
        });
    }

    /**
     * Removes the session from the cache if it was not accessed within
     * {@code ttl} and is safe to drop. Refuses without effect otherwise.
     */
    public boolean evictIfIdle(String sessionId, Duration ttl) {
        Instant now = clock.instant();
        boolean[] evicted = new boolean[1];
        cache.computeIfPresent(sessionId, (id, state) -> {
            if (Duration.between(state.getLastAccessTime(), now).compareTo(ttl) < 0) {
                return state;
            }
            if (!state.isEvictable()) {
                log.debug("[StateStore] eviction refused, session busy or dirty: sessionId={}", id);
                return state;
            }
            evicted[0] = true;
            return null;
        });
        if (evicted[0]) {
            log.debug("[StateStore] evicted idle session: sessionId={}", sessionId);
        }
        return evicted[0];
    }

    public List<String> cachedSessionIds() {
        return new ArrayList<>(cache.keySet());
    }

    public int size() {
        return cache.size();
    }

    /**
     * Best-effort write-back of every dirty session, waiting at most the
     * configured flush timeout.
     */
    @PreDestroy
    public void flushAll() {
        List<CompletableFuture<Boolean>> pending = new ArrayList<>();
        for (String sessionId : cachedSessionIds()) {
            pending.add(flush(sessionId));
        }
        if (pending.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(properties.getMaintenance().getFlushTimeoutMs(), TimeUnit.MILLISECONDS);
            log.info("[StateStore] flushed {} sessions", pending.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[StateStore] flush interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[StateStore] flush did not complete: {}", e.getMessage());
        }
    }

    /**
     * Reads the durable record of a session that started from defaults. A found
     * record replaces the in-memory values; a confirmed absence lets the defaults
     * be written. Completes with false while the store stays unreachable.
     */
    private CompletableFuture<Boolean> reconcile(String sessionId, SessionState state) {
        CompletableFuture<Optional<PersistedSessionState>> load;
        try {
            load = sessionStatePort.load(sessionId);
        } catch (RuntimeException e) { // NOSONAR - store failures are retried, never propagated
            load = CompletableFuture.failedFuture(e);
        }
        return load.orTimeout(properties.getStorage().getLoadTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((persisted, error) -> {
                    if (error != null) {
                        log.warn("[StateStore] durable record still unreadable, not writing defaults: "
                                + "sessionId={}: {}", sessionId, rootMessage(error));
                        return false;
                    }
                    if (persisted.isPresent()) {
                        state.adoptDurable(persisted.get());
                        log.info("[StateStore] reconciled session with durable record: sessionId={}", sessionId);
                    } else {
                        state.confirmNew();
                    }
                    return true;
                });
    }

    private SessionState loadOrCreate(String sessionId) {
        Instant now = clock.instant();
        try {
            Optional<PersistedSessionState> persisted = sessionStatePort.load(sessionId)
                    .get(properties.getStorage().getLoadTimeoutMs(), TimeUnit.MILLISECONDS);
            if (persisted.isPresent()) {
                log.debug("[StateStore] loaded session: sessionId={}", sessionId);
                return SessionState.restore(persisted.get(), now);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[StateStore] load interrupted, using defaults: sessionId={}", sessionId);
            return unverified(sessionId, now);
        } catch (ExecutionException | TimeoutException | RuntimeException e) { // NOSONAR - fall back to defaults
            log.warn("[StateStore] load failed, using defaults: sessionId={}: {}", sessionId, rootMessage(e));
            return unverified(sessionId, now);
        }

        log.info("[StateStore] created new session: sessionId={}", sessionId);
        return SessionState.fresh(sessionId, properties.getEnergy().getInitial(), now, LocalDate.now(clock));
    }

    private SessionState unverified(String sessionId, Instant now) {
        return SessionState.unverified(sessionId, properties.getEnergy().getInitial(), now, LocalDate.now(clock));
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
