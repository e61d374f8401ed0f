package me.golemcore.attention.adapter.outbound.classifier;

import me.golemcore.attention.domain.model.Decision;
import me.golemcore.attention.domain.model.DecisionAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicClassifierAdapterTest {

    private HeuristicClassifierAdapter classifier;

    @BeforeEach
    void setUp() {
        classifier = new HeuristicClassifierAdapter();
    }

    @Test
    void shouldReplyToQuestion() {
        Decision decision = classifier.classify("s1", 0.0, "what time is the meeting?").join();

        assertEquals(DecisionAction.REPLY, decision.getAction());
        assertTrue(decision.getRelevance() > 0);
    }

    @Test
    void shouldWaitForFragments() {
        assertEquals(DecisionAction.WAIT, classifier.evaluate(0.0, "so the thing is...").getAction());
        assertEquals(DecisionAction.WAIT, classifier.evaluate(0.0, "here is my list:").getAction());
        assertEquals(DecisionAction.WAIT, classifier.evaluate(0.0, "and another thing").getAction());
    }

    @Test
    void shouldIgnoreShortStatements() {
        assertEquals(DecisionAction.IGNORE, classifier.evaluate(0.0, "lol").getAction());
    }

    @Test
    void shouldIgnoreEmptyText() {
        assertEquals(DecisionAction.IGNORE, classifier.evaluate(0.0, "  ").getAction());
    }

    @Test
    void shouldBeMoreTalkativeInGoodMood() {
        String text = "hello everyone and welcome back";

        assertEquals(DecisionAction.IGNORE, classifier.evaluate(0.0, text).getAction());
        assertEquals(DecisionAction.REPLY, classifier.evaluate(1.0, text).getAction());
    }

    @Test
    void shouldBeLessTalkativeInBadMood() {
        String text = "is it raining?";

        assertEquals(DecisionAction.REPLY, classifier.evaluate(0.0, text).getAction());
        assertEquals(DecisionAction.IGNORE, classifier.evaluate(-1.0, text).getAction());
    }
}
