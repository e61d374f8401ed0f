package me.golemcore.attention.port.outbound;

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

import me.golemcore.attention.domain.model.Decision;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the intent classifier that decides whether a message deserves a
 * reply. Implementations may be slow and may fail; callers bound the wait and
 * fall back to a configured default.
 */
public interface ClassifierPort {

    /**
     * Classify a message.
     *
     * @param sessionId
     *            session the message belongs to
     * @param mood
     *            current session mood in [-1, 1]
     * @param text
     *            cleaned message text
     * @return decision with action REPLY, WAIT or IGNORE
     */
    CompletableFuture<Decision> classify(String sessionId, double mood, String text);
}
