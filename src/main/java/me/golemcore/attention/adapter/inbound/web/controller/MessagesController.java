package me.golemcore.attention.adapter.inbound.web.controller;

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
import me.golemcore.attention.adapter.inbound.web.dto.InboundMessageRequest;
import me.golemcore.attention.adapter.inbound.web.dto.IngestResponse;
import me.golemcore.attention.adapter.inbound.web.dto.SessionStateDto;
import me.golemcore.attention.domain.model.GenerationCycle;
import me.golemcore.attention.domain.model.RawInboundEvent;
import me.golemcore.attention.domain.model.SessionState;
import me.golemcore.attention.domain.service.MessageIngressService;
import me.golemcore.attention.domain.service.MessageIngressService.IngressResult;
import me.golemcore.attention.domain.service.SessionStateStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Message ingestion and session state inspection endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class MessagesController {

    private final MessageIngressService messageIngressService;
    private final SessionStateStore sessionStateStore;
    private final Clock clock;

    @PostMapping("/{sessionId}/messages")
    public Mono<ResponseEntity<IngestResponse>> postMessage(@PathVariable String sessionId,
            @RequestBody InboundMessageRequest request) {
        return Mono.fromCallable(() -> messageIngressService.ingest(toEvent(sessionId, request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponse);
    }

    @GetMapping("/{sessionId}/state")
    public Mono<ResponseEntity<SessionStateDto>> getState(@PathVariable String sessionId) {
        return Mono.just(sessionStateStore.peek(sessionId)
                .map(state -> ResponseEntity.ok(toDto(state)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    private RawInboundEvent toEvent(String sessionId, InboundMessageRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return RawInboundEvent.builder()
                .id(request.getId())
                .sessionId(sessionId)
                .senderId(request.getSenderId())
                .senderName(request.getSenderName())
                .selfId(request.getSelfId())
                .text(request.getText())
                .mentions(request.getMentions())
                .attachmentRefs(request.getAttachmentRefs())
                .timestamp(clock.instant())
                .build();
    }

    private ResponseEntity<IngestResponse> toResponse(IngressResult result) {
        if (!result.dispatched()) {
            return ResponseEntity.ok(IngestResponse.builder()
                    .dropped(true)
                    .dropReason(result.dropReason())
                    .build());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestResponse.builder()
                .messageId(result.messageId())
                .dropped(false)
                .action(result.decision().getAction() != null ? result.decision().getAction().name() : null)
                .reason(result.decision().getReason())
                .build());
    }

    private SessionStateDto toDto(SessionState state) {
        return SessionStateDto.builder()
                .sessionId(state.getSessionId())
                .energy(state.getEnergy())
                .mood(state.getMood())
                .locked(state.isLocked())
                .ownerSenderId(state.getOwnerSenderId().orElse(null))
                .cycleState(state.getActiveCycle().map(GenerationCycle::getState).map(Enum::name).orElse(null))
                .accumulationSize(state.getAccumulationPool().size())
                .backgroundSize(state.getBackgroundPool().size())
                .ambientSize(state.getAmbientContext().size())
                .lastReplyTime(state.getLastReplyTime() != null ? state.getLastReplyTime().toString() : null)
                .totalReplies(state.getTotalReplies())
                .dirty(state.isDirty())
                .build();
    }
}
