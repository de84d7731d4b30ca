package com.herzen.tutor.classification;

import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Component
@Primary
@Slf4j
public class GuardedTurnClassifier implements TurnClassifier {
    public static final String DEGRADED_TOPIC = "unknown";
    public static final String DEGRADED_VERSION = "degraded";

    private final TurnClassifier delegate;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public GuardedTurnClassifier(@Qualifier("keywordTurnClassifier") TurnClassifier delegate,
                                 TimeLimiterRegistry timeLimiterRegistry,
                                 @Qualifier("classificationExecutor") ExecutorService executor) {
        this.delegate = delegate;
        this.timeLimiter = timeLimiterRegistry.timeLimiter("classification");
        this.executor = executor;
    }

    @Override
    public Labels classify(String text, TurnRole role) {
        Callable<Labels> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(() -> delegate.classify(text, role), executor));
        try {
            Labels labels = timed.call();
            if (labels == null || labels.topic() == null || labels.sentiment() == null
                    || (role == TurnRole.STUDENT && labels.questionType() == null)) {
                log.warn("Classification degraded: strategy returned incomplete labels {}", labels);
                return degraded();
            }
            return labels;
        } catch (Exception e) {
            log.warn("Classification degraded [role={}, length={}]: {}", role, text == null ? 0 : text.length(), e.toString());
            return degraded();
        }
    }

    public static Labels degraded() {
        return new Labels(DEGRADED_TOPIC, Sentiment.NEUTRAL, QuestionType.OTHER, DEGRADED_VERSION, true);
    }
}
