package me.golemcore.attention.security;

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
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes message text: canonical Unicode form, no invisible or control
 * characters, collapsed whitespace.
 *
 * <p>
 * Zero-width characters are a common way to hide a command prefix or a
 * nickname from naive matching, so they are removed before any other check
 * runs.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InputSanitizer {

    private static final Pattern INVISIBLE = Pattern
            .compile("[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[ \\t]+");

    /**
     * Converts to NFC and strips zero-width, BiDi and control characters.
     * Newlines and tabs survive.
     */
    public String normalizeUnicode(String input) {
        if (input == null) {
            return "";
        }
        String normalized = Normalizer.normalize(input, Normalizer.Form.NFC);
        normalized = INVISIBLE.matcher(normalized).replaceAll("");
        return CONTROL.matcher(normalized).replaceAll("");
    }

    /**
     * Full cleaning pipeline: Unicode normalization, then whitespace collapsing
     * and trimming.
     */
    public String clean(String input) {
        if (input == null) {
            return "";
        }
        int originalLength = input.length();
        String cleaned = WHITESPACE_RUN.matcher(normalizeUnicode(input)).replaceAll(" ").strip();
        if (cleaned.length() != originalLength) {
            log.trace("[Security] Input cleaned: {} -> {} chars", originalLength, cleaned.length());
        }
        return cleaned;
    }
}
