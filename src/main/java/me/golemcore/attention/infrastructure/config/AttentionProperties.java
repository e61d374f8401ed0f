package me.golemcore.attention.infrastructure.config;

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

import lombok.Data;
import me.golemcore.attention.domain.model.DecisionAction;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the attention dispatcher, bound
 * from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code attention.*} prefix:
 * <ul>
 * <li>{@link EnergyProperties} - energy floor, per-cycle cost and recovery</li>
 * <li>{@link MoodProperties} - mood decay cadence</li>
 * <li>{@link DebounceProperties} - quiet period and window ceiling</li>
 * <li>{@link PoolProperties} - background and ambient pool bounds</li>
 * <li>{@link ClassifierProperties} - shortcut phrases and failure default</li>
 * <li>{@link MaintenanceProperties} - decay tick and write-back settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "attention")
@Data
public class AttentionProperties {

    private EnergyProperties energy = new EnergyProperties();
    private MoodProperties mood = new MoodProperties();
    private DebounceProperties debounce = new DebounceProperties();
    private PoolProperties pool = new PoolProperties();
    private EvictionProperties eviction = new EvictionProperties();
    private ClassifierProperties classifier = new ClassifierProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();
    private SanitizerProperties sanitizer = new SanitizerProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class EnergyProperties {
        private double initial = 0.8;
        private double floor = 0.1;
        private double costPerCycle = 0.05;
        private double dailyRecovery = 0.2;
        private int recoverySilenceMinutes = 60;
        private double recoveryIncrement = 0.1;
        private double recoveryCeiling = 0.8;
    }

    @Data
    public static class MoodProperties {
        private int decayIntervalSeconds = 600;
        private double decayStep = 0.1;
    }

    @Data
    public static class DebounceProperties {
        private double quietPeriodSeconds = 2.0;
        private double maxWindowSeconds = 15.0;

        public Duration getQuietPeriod() {
            return toDuration(quietPeriodSeconds);
        }

        public Duration getMaxWindow() {
            return toDuration(maxWindowSeconds);
        }
    }

    @Data
    public static class PoolProperties {
        private int backgroundCapacity = 20;
        private int ambientCapacity = 10;
    }

    @Data
    public static class EvictionProperties {
        private int ttlSeconds = 600;
    }

    @Data
    public static class ClassifierProperties {
        private DecisionAction failureDefault = DecisionAction.IGNORE;
        private long timeoutMs = 5000;
        private List<String> shortcutPhrases = new ArrayList<>();
    }

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = true;
        private int tickSeconds = 60;
        private long flushTimeoutMs = 5000;
    }

    @Data
    public static class SanitizerProperties {
        private List<String> commandPrefixes = new ArrayList<>(List.of("/", "!", "！"));
        private List<String> commandWords = new ArrayList<>();
        private List<String> botNicknames = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private long loadTimeoutMs = 2000;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/attention";
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofMillis(Math.max(0L, Math.round(seconds * 1000.0)));
    }
}
