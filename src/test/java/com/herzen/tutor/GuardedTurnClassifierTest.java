package com.herzen.tutor;

import com.herzen.tutor.classification.GuardedTurnClassifier;
import com.herzen.tutor.classification.KeywordTurnClassifier;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GuardedTurnClassifierTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final TimeLimiterRegistry registry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(200))
            .cancelRunningFuture(true)
            .build());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void passesThroughLabelsOfAHealthyStrategy() {
        GuardedTurnClassifier guarded = new GuardedTurnClassifier(new KeywordTurnClassifier(new TutorProperties()), registry, executor);
        Labels labels = guarded.classify("What is a fraction?", TurnRole.STUDENT);
        assertEquals("math", labels.topic());
        assertEquals(QuestionType.FACTUAL, labels.questionType());
        assertFalse(labels.degraded());
    }

    @Test
    void degradesWhenTheStrategyThrows() {
        GuardedTurnClassifier guarded = new GuardedTurnClassifier((text, role) -> {
            throw new IllegalStateException("model unavailable");
        }, registry, executor);
        assertDegraded(guarded.classify("anything", TurnRole.STUDENT));
    }

    @Test
    void degradesWhenTheStrategyIsTooSlow() {
        GuardedTurnClassifier guarded = new GuardedTurnClassifier((text, role) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new Labels("math", Sentiment.POSITIVE, QuestionType.FACTUAL, "slow", false);
        }, registry, executor);
        long started = System.nanoTime();
        assertDegraded(guarded.classify("anything", TurnRole.STUDENT));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);
    }

    @Test
    void degradesIncompleteLabels() {
        GuardedTurnClassifier guarded = new GuardedTurnClassifier(
                (text, role) -> new Labels(null, Sentiment.NEUTRAL, QuestionType.OTHER, "broken", false), registry, executor);
        assertDegraded(guarded.classify("anything", TurnRole.TUTOR));
    }

    private static void assertDegraded(Labels labels) {
        assertEquals("unknown", labels.topic());
        assertEquals(Sentiment.NEUTRAL, labels.sentiment());
        assertEquals(QuestionType.OTHER, labels.questionType());
        assertTrue(labels.degraded());
    }
}
