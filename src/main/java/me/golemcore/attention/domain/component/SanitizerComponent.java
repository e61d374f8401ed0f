package me.golemcore.attention.domain.component;

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

import me.golemcore.attention.domain.model.RawInboundEvent;

/**
 * Component that cleans raw platform events before they reach the dispatcher.
 * Drops the bot's own messages, commands meant for other handlers and empty
 * messages, and detects explicit wake signals (an @-mention of the bot or one
 * of its nicknames).
 */
public interface SanitizerComponent extends Component {

    @Override
    default String getComponentType() {
        return "sanitizer";
    }

    /**
     * Filters one raw event.
     *
     * @param event
     *            the raw inbound event
     * @return the filter verdict with the cleaned text when accepted
     */
    FilterResult filter(RawInboundEvent event);

    /**
     * Result of filtering a raw event.
     *
     * @param accepted
     *            true if the message should be dispatched
     * @param cleanText
     *            normalized message text, empty when dropped
     * @param wakeSignal
     *            true if the bot was explicitly addressed
     * @param dropReason
     *            why the message was dropped (e.g., "self", "command", "empty"),
     *            null when accepted
     */
    record FilterResult(boolean accepted, String cleanText, boolean wakeSignal, String dropReason) {

        public static FilterResult accept(String cleanText, boolean wakeSignal) {
            return new FilterResult(true, cleanText, wakeSignal, null);
        }

        public static FilterResult drop(String reason) {
            return new FilterResult(false, "", false, reason);
        }
    }
}
