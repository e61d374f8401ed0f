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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Raw event as delivered by a chat channel, before sanitization.
 *
 * <p>
 * {@code mentions} lists the ids addressed in the message; when it contains
 * {@code selfId} the message is a direct address of the bot.
 */
@Data
@Builder
public class RawInboundEvent {

    private String id;
    private String sessionId;
    private String senderId;
    private String senderName;
    private String selfId;
    private String text;
    private List<String> mentions;
    private List<String> attachmentRefs;
    private Instant timestamp;
}
