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
import me.golemcore.attention.domain.model.Decision;
import me.golemcore.attention.domain.model.GenerationCycle;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Entry point for sanitized inbound messages.
 *
 * <p>
 * Every message is judged by the {@link AdmissionPolicy}. Ignored messages
 * become ambient context. Admitted messages either open a new generation
 * cycle, extend the accumulation pool of the current owner, or are deferred to
 * the background pool. When a cycle finishes, the background pool is promoted
 * into a fresh cycle in the same step that releases the lock, so a newcomer
 * can never overtake deferred messages. Only arming the promoted cycle is
 * handed to the session-run executor.
 */
@Service
@Slf4j
public class DualPoolDispatcher {

    private final SessionStateStore sessionStateStore;
    private final AdmissionPolicy admissionPolicy;
    private final DebounceAggregator debounceAggregator;
    private final AttentionProperties properties;
    private final ExecutorService sessionRunExecutor;
    private final Function<SessionState, GenerationCycle> cycleFactory;

    public DualPoolDispatcher(SessionStateStore sessionStateStore, AdmissionPolicy admissionPolicy,
            DebounceAggregator debounceAggregator, AttentionProperties properties,
            @Qualifier("sessionRunExecutor") ExecutorService sessionRunExecutor) {
        this.sessionStateStore = sessionStateStore;
        this.admissionPolicy = admissionPolicy;
        this.debounceAggregator = debounceAggregator;
        this.properties = properties;
        this.sessionRunExecutor = sessionRunExecutor;
        this.cycleFactory = debounceAggregator.cycleFactory(this::onCycleDone);
    }

    /**
     * Handles one inbound message. Never throws; failures are logged and the
     * message is dropped.
     *
     * @return the admission decision, or empty if handling failed
     */
    public Optional<Decision> onMessage(InboundMessage message) {
        try {
            SessionState session = sessionStateStore.get(message.getSessionId());
            Decision decision = admissionPolicy.decide(session, message);
            if (!decision.isAdmitted()) {
                session.appendAmbient(message, properties.getPool().getAmbientCapacity());
                log.debug("[Dispatcher] ignored: sessionId={}, sender={}, reason={}",
                        message.getSessionId(), message.getSenderId(), decision.getReason());
                return Optional.of(decision);
            }

            SessionState.Routing routing = session.route(message, cycleFactory,
                    properties.getPool().getBackgroundCapacity());
            switch (routing.outcome()) {
            case OPENED -> {
                log.info("[Dispatcher] {} -> new cycle: sessionId={}, sender={}, cycle={}",
                        decision.getAction(), message.getSessionId(), message.getSenderId(), routing.cycle().getId());
                routing.cycle().rearm();
            }
            case EXTENDED -> {
                log.debug("[Dispatcher] owner message extends window: sessionId={}, cycle={}",
                        message.getSessionId(), routing.cycle().getId());
                routing.cycle().rearm();
            }
            case DEFERRED -> {
                log.debug("[Dispatcher] deferred to background: sessionId={}, sender={}, cycle={}",
                        message.getSessionId(), message.getSenderId(), routing.cycle().getId());
                if (routing.dropped() != null) {
                    log.warn("[Dispatcher] background pool full, dropped oldest: sessionId={}, messageId={}",
                            message.getSessionId(), routing.dropped().getId());
                }
            }
            default -> throw new IllegalStateException("Unknown routing outcome: " + routing.outcome());
            }
            return Optional.of(decision);
        } catch (RuntimeException e) { // NOSONAR - one bad message must not break ingestion
            log.error("[Dispatcher] failed to handle message: sessionId={}, messageId={}",
                    message.getSessionId(), message.getId(), e);
            return Optional.empty();
        }
    }

    private void onCycleDone(SessionState session, GenerationCycle successor) {
        if (successor == null) {
            return;
        }
        log.info("[Dispatcher] background promoted -> new cycle: sessionId={}, owner={}, cycle={}",
                session.getSessionId(), session.getOwnerSenderId().orElse(null), successor.getId());
        try {
            sessionRunExecutor.execute(successor::rearm);
        } catch (RejectedExecutionException e) {
            log.warn("[Dispatcher] executor rejected promoted cycle, arming inline: sessionId={}",
                    session.getSessionId());
            successor.rearm();
        }
    }
}
