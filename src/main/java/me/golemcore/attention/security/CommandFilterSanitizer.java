package me.golemcore.attention.security;

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
import me.golemcore.attention.domain.component.SanitizerComponent;
import me.golemcore.attention.domain.model.RawInboundEvent;
import me.golemcore.attention.infrastructure.config.AttentionProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Default {@link SanitizerComponent}.
 *
 * <p>
 * Filtering order:
 * <ol>
 * <li>messages sent by the bot itself are dropped</li>
 * <li>text is cleaned by {@link InputSanitizer}</li>
 * <li>messages starting with a command prefix, or whose first word is a
 * configured command word, are dropped</li>
 * <li>messages with neither text nor attachments are dropped</li>
 * <li>a mention of the bot's own id or a configured nickname marks the message
 * as a wake signal</li>
 * </ol>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandFilterSanitizer implements SanitizerComponent {

    private final InputSanitizer inputSanitizer;
    private final AttentionProperties properties;

    @Override
    public FilterResult filter(RawInboundEvent event) {
        if (event.getSelfId() != null && Objects.equals(event.getSenderId(), event.getSelfId())) {
            return FilterResult.drop("self");
        }

        String cleanText = inputSanitizer.clean(event.getText());
        if (isCommand(cleanText)) {
            log.debug("[Sanitizer] command filtered: sessionId={}, sender={}", event.getSessionId(),
                    event.getSenderId());
            return FilterResult.drop("command");
        }

        boolean hasAttachments = event.getAttachmentRefs() != null && !event.getAttachmentRefs().isEmpty();
        if (cleanText.isEmpty() && !hasAttachments) {
            return FilterResult.drop("empty");
        }

        return FilterResult.accept(cleanText, isWakeSignal(event, cleanText));
    }

    /**
     * Whether the cleaned text is addressed to a command handler rather than to
     * the conversation.
     */
    public boolean isCommand(String cleanText) {
        if (cleanText == null || cleanText.isEmpty()) {
            return false;
        }
        AttentionProperties.SanitizerProperties config = properties.getSanitizer();
        for (String prefix : config.getCommandPrefixes()) {
            if (prefix != null && !prefix.isEmpty() && cleanText.startsWith(prefix)) {
                return true;
            }
        }
        String firstWord = cleanText.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        return config.getCommandWords().stream()
                .filter(Objects::nonNull)
                .anyMatch(word -> word.toLowerCase(Locale.ROOT).equals(firstWord));
    }

    private boolean isWakeSignal(RawInboundEvent event, String cleanText) {
        List<String> mentions = event.getMentions();
        if (event.getSelfId() != null && mentions != null && mentions.contains(event.getSelfId())) {
            return true;
        }
        for (String nickname : properties.getSanitizer().getBotNicknames()) {
            if (nickname != null && !nickname.isBlank() && cleanText.contains(nickname)) {
                log.debug("[Sanitizer] nickname mention: sessionId={}, nickname={}", event.getSessionId(), nickname);
                return true;
            }
        }
        return false;
    }
}
