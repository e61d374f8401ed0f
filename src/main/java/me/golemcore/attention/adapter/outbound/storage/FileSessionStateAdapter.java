package me.golemcore.attention.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.attention.domain.model.PersistedSessionState;
import me.golemcore.attention.port.outbound.SessionStatePort;
import me.golemcore.attention.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Session state store backed by {@link StoragePort}: one JSON document per
 * session under {@code sessions/}, written atomically.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileSessionStateAdapter implements SessionStatePort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Optional<PersistedSessionState>> load(String sessionId) {
        return storagePort.getText(LocalStorageAdapter.SESSIONS_DIR, fileName(sessionId))
                .thenApply(json -> {
                    if (json == null || json.isBlank()) {
                        return Optional.empty();
                    }
                    try {
                        return Optional.of(objectMapper.readValue(json, PersistedSessionState.class));
                    } catch (JsonProcessingException e) {
                        throw new StorageException("Corrupted session state: " + sessionId, e);
                    }
                });
    }

    @Override
    public CompletableFuture<Void> save(PersistedSessionState state) {
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new StorageException("Failed to serialize session state: " + state.getSessionId(), e));
        }
        log.trace("[Storage] Saving session state: sessionId={}", state.getSessionId());
        return storagePort.putTextAtomic(LocalStorageAdapter.SESSIONS_DIR, fileName(state.getSessionId()), json,
                false);
    }

    static String fileName(String sessionId) {
        return URLEncoder.encode(sessionId, StandardCharsets.UTF_8) + JSON_EXTENSION;
    }
}
