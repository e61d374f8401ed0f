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
 * Admission decision produced once per inbound message and never persisted.
 *
 * <p>
 * Carries the {@link DecisionAction} plus optional priority scores in the
 * range 0-10 ({@code relevance}, {@code necessity}) and a short reason for
 * logging.
 *
 * @since 1.0
 */
@Data
@Builder
public class Decision {

    public static final int MAX_PRIORITY = 10;

    private DecisionAction action;
    private int relevance;
    private int necessity;
    private String reason;

    public boolean isAdmitted() {
        return action != null && action.isAdmitted();
    }

    public static Decision of(DecisionAction action, String reason) {
        return Decision.builder()
                .action(action)
                .reason(reason)
                .build();
    }

    public static Decision ignore(String reason) {
        return of(DecisionAction.IGNORE, reason);
    }

    public static Decision reply(int relevance, int necessity, String reason) {
        return Decision.builder()
                .action(DecisionAction.REPLY)
                .relevance(relevance)
                .necessity(necessity)
                .reason(reason)
                .build();
    }
}
