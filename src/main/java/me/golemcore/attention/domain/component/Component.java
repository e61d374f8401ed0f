package me.golemcore.attention.domain.component;

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
 * Base interface for pluggable components of the attention pipeline. Each
 * component type extends it with its own operations while sharing the same
 * identification and enablement contract.
 */
public interface Component {

    /**
     * Returns the unique type identifier for this component.
     *
     * @return the component type (e.g., "sanitizer")
     */
    String getComponentType();

    /**
     * Whether the component is active. Disabled components are bypassed by
     * their callers.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
