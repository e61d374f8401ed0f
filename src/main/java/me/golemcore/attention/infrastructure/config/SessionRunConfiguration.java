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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors shared by the dispatch core.
 *
 * <p>
 * {@code sessionRunExecutor} runs cycle re-triggers and other short session
 * tasks; {@code debounceScheduler} owns the quiet-period timers of open
 * debounce windows. Both use daemon threads so a stuck generator can never
 * keep the JVM alive.
 */
@Configuration
@Slf4j
public class SessionRunConfiguration {

    private static final int DEBOUNCE_TIMER_THREADS = 2;

    private ExecutorService sessionRunExecutor;
    private ScheduledExecutorService debounceScheduler;

    @Bean
    public ExecutorService sessionRunExecutor() {
        if (sessionRunExecutor == null) {
            sessionRunExecutor = Executors.newCachedThreadPool(daemonFactory("session-run", false));
        }
        return sessionRunExecutor;
    }

    @Bean
    public ScheduledExecutorService debounceScheduler() {
        if (debounceScheduler == null) {
            debounceScheduler = Executors.newScheduledThreadPool(DEBOUNCE_TIMER_THREADS,
                    daemonFactory("debounce-timer", true));
        }
        return debounceScheduler;
    }

    @PreDestroy
    public void shutdown() {
        shutdownQuietly(debounceScheduler, "debounce-timer");
        shutdownQuietly(sessionRunExecutor, "session-run");
    }

    private void shutdownQuietly(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("[SessionRun] {} executor shut down", name);
    }

    private static ThreadFactory daemonFactory(String name, boolean numbered) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String threadName = numbered ? name + "-" + counter.incrementAndGet() : name;
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        };
    }
}
