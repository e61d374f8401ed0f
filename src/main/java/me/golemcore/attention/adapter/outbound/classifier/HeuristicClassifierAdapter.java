package me.golemcore.attention.adapter.outbound.classifier;

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
import me.golemcore.attention.domain.model.Decision;
import me.golemcore.attention.domain.model.DecisionAction;
import me.golemcore.attention.port.outbound.ClassifierPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Local rule-based classifier used when no model-backed classifier is wired.
 *
 * <p>
 * Signals:
 * <ul>
 * <li>Questions - "?" anywhere in the text</li>
 * <li>Direct address - second-person pronouns</li>
 * <li>Greetings</li>
 * <li>Fragments - a leading continuation marker, or "...", ":", "-", "," at the
 * end, meaning the sender is still typing</li>
 * <li>Very short messages without a question</li>
 * </ul>
 *
 * <p>
 * A fragment yields WAIT. Otherwise the signal score is compared to a
 * threshold that rises as the mood gets worse.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class HeuristicClassifierAdapter implements ClassifierPort {

    private static final int BASE_THRESHOLD = 4;
    private static final int MIN_WORDS_FOR_STANDALONE = 3;
    private static final int WAIT_NECESSITY = 5;

    private static final Pattern QUESTION_PATTERN = Pattern.compile("[?？]");

    private static final Pattern DIRECT_ADDRESS_PATTERN = Pattern.compile(
            "\\b(ты|вы|тебя|вас|тебе|вам|you|your|u)\\b|你",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern GREETING_PATTERN = Pattern.compile(
            "^\\s*(привет|здравствуй|здравствуйте|добрый день|hi|hello|hey|good morning|你好)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern CONTINUATION_START_PATTERN = Pattern.compile(
            "^\\s*(и\\s|а также|плюс|ещё|еще|кстати|потом|затем|and\\s|also|plus|btw|then)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern INCOMPLETE_ENDING_PATTERN = Pattern.compile(
            "(\\.\\.\\.|…|—|--|:|-|,)\\s*$");

    @Override
    public CompletableFuture<Decision> classify(String sessionId, double mood, String text) {
        return CompletableFuture.completedFuture(evaluate(mood, text));
    }

    Decision evaluate(double mood, String text) {
        if (text == null || text.isBlank()) {
            return Decision.ignore("no text");
        }

        if (INCOMPLETE_ENDING_PATTERN.matcher(text).find() || CONTINUATION_START_PATTERN.matcher(text).find()) {
            return Decision.builder()
                    .action(DecisionAction.WAIT)
                    .relevance(WAIT_NECESSITY)
                    .necessity(WAIT_NECESSITY)
                    .reason("fragment")
                    .build();
        }

        int score = 0;
        boolean question = QUESTION_PATTERN.matcher(text).find();
        if (question) {
            score += 4;
        }
        if (DIRECT_ADDRESS_PATTERN.matcher(text).find()) {
            score += 2;
        }
        if (GREETING_PATTERN.matcher(text).find()) {
            score += 2;
        }
        if (!question && countWords(text) < MIN_WORDS_FOR_STANDALONE) {
            score -= 1;
        }

        int threshold = BASE_THRESHOLD - (int) Math.round(mood * 2);
        log.trace("[Classifier] score={}, threshold={}, mood={}", score, threshold, mood);
        if (score >= threshold) {
            int priority = Math.min(Decision.MAX_PRIORITY, Math.max(0, score + 3));
            return Decision.reply(priority, priority, "heuristic score " + score);
        }
        return Decision.ignore("heuristic score " + score + " below " + threshold);
    }

    private static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
