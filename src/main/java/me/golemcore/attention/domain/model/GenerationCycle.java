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

/**
 * Handle of the generation cycle that currently holds a session's lock.
 */
public interface GenerationCycle {

    String getId();

    CycleState getState();

    /**
     * Arms the quiet-period timer, or re-arms it after a message from the owner
     * was appended to the accumulation pool. No-op once the window is closing.
     */
    void rearm();
}
