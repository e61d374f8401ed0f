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

/**
 * Output of one generation call.
 *
 * <p>
 * {@code sentimentDelta} is the change the reply applies to the session mood,
 * in the range [-1, 1].
 */
@Data
@Builder
public class GenerationResult {

    private String replyText;
    private double sentimentDelta;
    private String moodTag;

    public static GenerationResult empty() {
        return GenerationResult.builder()
                .replyText("")
                .sentimentDelta(0.0)
                .moodTag("neutral")
                .build();
    }
}
