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

import me.golemcore.attention.domain.model.GenerationResult;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.SessionSnapshot;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the response generator. Called at most once at a time per session
 * with the drained batch of one debounce window.
 *
 * <p>
 * Latency ceilings are the implementation's responsibility: the dispatcher
 * never cancels a generation call, it only waits for the future to complete
 * normally or exceptionally.
 */
public interface GeneratorPort {

    /**
     * Generate a reply for an aggregated batch.
     *
     * @param sessionId
     *            session id
     * @param state
     *            snapshot of the session state, including ambient context
     * @param batch
     *            messages of the window, in arrival order
     * @return reply text and the sentiment delta to apply to the session mood
     */
    CompletableFuture<GenerationResult> generate(String sessionId, SessionSnapshot state, List<InboundMessage> batch);
}
