package me.golemcore.attention;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore attention dispatcher.
 *
 * <p>
 * The dispatcher sits between chat channels and a slow response generator. For
 * every inbound message it decides whether, and when, exactly one generation
 * cycle should run for the message's session.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Single-flight cycles</b> - at most one generation per session at a
 * time</li>
 * <li><b>Debounce aggregation</b> - rapid messages from the same sender are
 * coalesced into one batch</li>
 * <li><b>Dual pools</b> - other senders are deferred to a background pool and
 * drained one cycle at a time</li>
 * <li><b>Energy and mood</b> - a per-session budget that gates replies and
 * recovers over time</li>
 * <li><b>Write-back cache</b> - session state is persisted lazily and evicted
 * when idle</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → MessagesController, MessageIngressService
 * Domain Layer       → AdmissionPolicy, DualPoolDispatcher, DebounceAggregator
 * Infrastructure     → Classifier/Generator/Storage adapters, StateDecayScheduler
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code attention.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AttentionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttentionApplication.class, args);
    }

}
