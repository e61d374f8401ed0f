package me.golemcore.attention.adapter.outbound.generator;

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
import me.golemcore.attention.domain.model.GenerationResult;
import me.golemcore.attention.domain.model.InboundMessage;
import me.golemcore.attention.domain.model.SessionSnapshot;
import me.golemcore.attention.port.outbound.GeneratorPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op generator for testing and when no response generator is configured.
 *
 * <p>
 * Always completes immediately with an empty reply and a neutral
 * sentiment delta, so the dispatch pipeline (energy cost, lock release,
 * background promotion) runs end to end without an external model.
 */
@Component
@Slf4j
public class NoOpGeneratorAdapter implements GeneratorPort {

    @Override
    public CompletableFuture<GenerationResult> generate(String sessionId, SessionSnapshot state,
            List<InboundMessage> batch) {
        log.warn("NoOpGeneratorAdapter: generate() called for session {} with {} messages - no generator configured",
                sessionId, batch.size());
        return CompletableFuture.completedFuture(GenerationResult.empty());
    }
}
