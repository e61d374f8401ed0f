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
import me.golemcore.attention.domain.component.SanitizerComponent;
import me.golemcore.attention.domain.component.SanitizerComponent.FilterResult;
import me.golemcore.attention.domain.model.Decision;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.RawInboundEvent;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns raw channel events into {@link InboundMessage}s and hands them to the
 * {@link DualPoolDispatcher}.
 *
 * <p>
 * The arrival time is stamped here from the injected clock, so ordering inside
 * a session follows reception order rather than sender-side timestamps.
 */
@Service
@Slf4j
public class MessageIngressService {

    private final SanitizerComponent sanitizerComponent;
    private final DualPoolDispatcher dualPoolDispatcher;
    private final Clock clock;

    public MessageIngressService(SanitizerComponent sanitizerComponent, DualPoolDispatcher dualPoolDispatcher,
            Clock clock) {
        this.sanitizerComponent = sanitizerComponent;
        this.dualPoolDispatcher = dualPoolDispatcher;
        this.clock = clock;
    }

    public IngressResult ingest(RawInboundEvent event) {
        if (event == null || isBlank(event.getSessionId()) || isBlank(event.getSenderId())) {
            throw new IllegalArgumentException("sessionId and senderId are required");
        }

        FilterResult filtered = sanitizerComponent.isEnabled()
                ? sanitizerComponent.filter(event)
                : FilterResult.accept(event.getText() != null ? event.getText() : "", false);
        if (!filtered.accepted()) {
            log.debug("[Ingress] dropped: sessionId={}, sender={}, reason={}", event.getSessionId(),
                    event.getSenderId(), filtered.dropReason());
            return IngressResult.dropped(filtered.dropReason());
        }

        InboundMessage message = InboundMessage.builder()
                .id(isBlank(event.getId()) ? UUID.randomUUID().toString() : event.getId())
                .sessionId(event.getSessionId())
                .senderId(event.getSenderId())
                .senderName(event.getSenderName())
                .text(filtered.cleanText())
                .attachmentRefs(event.getAttachmentRefs() != null ? event.getAttachmentRefs() : List.of())
                .arrivalTime(clock.instant())
                .wakeSignal(filtered.wakeSignal())
                .build();

        Optional<Decision> decision = dualPoolDispatcher.onMessage(message);
        return decision
                .map(d -> IngressResult.dispatched(message.getId(), d))
                .orElseGet(() -> IngressResult.dropped("dispatch_failed"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Outcome of ingesting one raw event.
     *
     * @param dispatched
     *            true if the message reached the dispatcher
     * @param messageId
     *            id of the dispatched message
     * @param decision
     *            admission decision, null when dropped
     * @param dropReason
     *            reason the message was dropped, null when dispatched
     */
    public record IngressResult(boolean dispatched, String messageId, Decision decision, String dropReason) {

        static IngressResult dispatched(String messageId, Decision decision) {
            return new IngressResult(true, messageId, decision, null);
        }

        static IngressResult dropped(String reason) {
            return new IngressResult(false, null, null, reason);
        }
    }
}
