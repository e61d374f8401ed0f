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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.attention.domain.model.Decision;
import me.golemcore.attention.domain.model.DecisionAction;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import me.golemcore.attention.port.outbound.ClassifierPort;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns local shortcuts plus a classifier call into the final decision for one
 * message.
 *
 * <p>
 * Rules, first match wins:
 * <ol>
 * <li>Energy below the floor and no wake signal - IGNORE without calling the
 * classifier.</li>
 * <li>Wake signal - REPLY with maximum priority.</li>
 * <li>Text starts with a configured shortcut phrase - REPLY.</li>
 * <li>Classifier verdict; on failure, timeout or an empty verdict the
 * configured failure default.</li>
 * </ol>
 *
 * <p>
 * The policy never mutates the session and never runs under the session lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionPolicy {

    private static final int SHORTCUT_NECESSITY = 9;

    private final ClassifierPort classifierPort;
    private final AttentionProperties properties;

    public Decision decide(SessionState session, InboundMessage message) {
        String sessionId = session.getSessionId();
        double energy = session.getEnergy();

        if (energy < properties.getEnergy().getFloor() && !message.isWakeSignal()) {
            log.debug("[Admission] energy below floor ({}), ignoring: sessionId={}",
                    String.format(Locale.ROOT, "%.2f", energy), sessionId);
            return Decision.ignore("energy exhausted");
        }

        if (message.isWakeSignal()) {
            log.debug("[Admission] wake signal, replying: sessionId={}", sessionId);
            return Decision.reply(Decision.MAX_PRIORITY, Decision.MAX_PRIORITY, "wake signal");
        }

        String shortcut = matchShortcut(message.getText());
        if (shortcut != null) {
            log.debug("[Admission] shortcut phrase [{}] matched: sessionId={}", shortcut, sessionId);
            return Decision.reply(Decision.MAX_PRIORITY, SHORTCUT_NECESSITY, "shortcut phrase: " + shortcut);
        }

        return classify(sessionId, session.getMood(), message.getText());
    }

    private Decision classify(String sessionId, double mood, String text) {
        long startMs = System.currentTimeMillis();
        try {
            Decision decision = classifierPort.classify(sessionId, mood, text)
                    .get(properties.getClassifier().getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (decision == null || decision.getAction() == null) {
                return failureDefault(sessionId, "empty verdict");
            }
            log.debug("[Admission] classifier verdict {} in {}ms: sessionId={}",
                    decision.getAction(), System.currentTimeMillis() - startMs, sessionId);
            return decision;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failureDefault(sessionId, "interrupted");
        } catch (TimeoutException e) {
            return failureDefault(sessionId, "timeout");
        } catch (ExecutionException | RuntimeException e) { // NOSONAR - classifier failures never propagate
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return failureDefault(sessionId, cause.getMessage());
        }
    }

    private Decision failureDefault(String sessionId, String cause) {
        DecisionAction fallback = properties.getClassifier().getFailureDefault();
        log.warn("[Admission] classifier failed ({}), applying default {}: sessionId={}", cause, fallback,
                sessionId);
        return Decision.of(fallback, "classifier failure");
    }

    private String matchShortcut(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        for (String phrase : properties.getClassifier().getShortcutPhrases()) {
            if (phrase != null && !phrase.isBlank()
                    && normalized.startsWith(phrase.strip().toLowerCase(Locale.ROOT))) {
                return phrase;
            }
        }
        return null;
    }
}
