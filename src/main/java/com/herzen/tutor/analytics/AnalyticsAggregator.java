package com.herzen.tutor.analytics;

import com.herzen.tutor.analytics.AnalyticsModels.AnalyticsSummary;
import com.herzen.tutor.analytics.AnalyticsModels.RecomputeResult;
import com.herzen.tutor.analytics.AnalyticsModels.TimeWindow;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.error.AggregationFailureException;
import com.herzen.tutor.repository.AnalyticsJdbcRepository;
import com.herzen.tutor.repository.AnalyticsJdbcRepository.TurnFacts;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class AnalyticsAggregator {
    private final AnalyticsJdbcRepository repository;
    private final TutorProperties.Analytics props;
    private final Retry aggregationRetry;
    private final Clock clock;

    public AnalyticsAggregator(AnalyticsJdbcRepository repository, TutorProperties properties,
                               RetryRegistry retryRegistry, Clock clock) {
        this.repository = repository;
        this.props = properties.getAnalytics();
        this.aggregationRetry = retryRegistry.retry("aggregation");
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tutor.analytics.fixed-delay-ms:300000}", initialDelayString = "${tutor.analytics.fixed-delay-ms:300000}")
    public void scheduledRecompute() {
        TimeWindow window = currentWindow();
        for (int i = 0; i < Math.max(props.getLookbackWindows(), 1); i++) {
            TimeWindow target = window;
            try {
                Retry.decorateSupplier(aggregationRetry, () -> recompute(target)).get();
            } catch (AggregationFailureException e) {
                log.error("Scheduled recompute failed for {}; previous summaries kept", target, e);
            }
            window = window.previous();
        }
    }

    public TimeWindow currentWindow() {
        return TimeWindow.aligned(clock.instant(), props.getWindow());
    }

    public RecomputeResult recompute(TimeWindow window) {
        List<TurnFacts> turns = repository.loadTurns(window);
        List<AnalyticsSummary> rows = new ArrayList<>();
        rows.add(summarize(window, AnalyticsModels.GLOBAL_KEY, turns));
        group(turns, TurnFacts::topic).forEach((topic, topicTurns) ->
                rows.add(summarize(window, AnalyticsModels.topicKey(topic), topicTurns)));
        if (props.isPerStudentRollups()) {
            group(turns, TurnFacts::studentId).forEach((studentId, studentTurns) ->
                    rows.add(summarize(window, AnalyticsModels.studentKey(studentId), studentTurns)));
        }
        repository.replaceWindow(window, rows);
        log.info("Recomputed {} summaries for {} .. {} from {} turns", rows.size(), window.start(), window.end(), turns.size());
        return new RecomputeResult(window, rows.size());
    }

    public RecomputeResult recomputeStudent(String studentId, TimeWindow window) {
        if (studentId == null || studentId.isBlank()) throw new IllegalArgumentException("studentId is required");
        List<TurnFacts> turns = repository.loadStudentTurns(studentId, window);
        String key = AnalyticsModels.studentKey(studentId);
        AnalyticsSummary summary = turns.isEmpty() ? null : summarize(window, key, turns);
        repository.replaceGroup(window, key, summary);
        log.info("Recomputed summary {} for {} .. {} from {} turns", key, window.start(), window.end(), turns.size());
        return new RecomputeResult(window, summary == null ? 0 : 1);
    }

    static AnalyticsSummary summarize(TimeWindow window, String key, List<TurnFacts> turns) {
        long total = turns.size();
        long sessions = turns.stream().map(TurnFacts::sessionId).distinct().count();
        long students = turns.stream().map(TurnFacts::studentId).distinct().count();
        long flagged = turns.stream().filter(TurnFacts::flagged).count();
        double avg = sessions == 0 ? 0.0 : (double) total / sessions;
        return new AnalyticsSummary(window.start(), window.end(), key, total, sessions, avg, students, flagged,
                count(turns, TurnFacts::sentiment),
                count(turns.stream().filter(t -> t.questionType() != null).toList(), TurnFacts::questionType),
                count(turns, TurnFacts::topic));
    }

    private static Map<String, Long> count(List<TurnFacts> turns, Function<TurnFacts, String> field) {
        return turns.stream().collect(Collectors.groupingBy(field, TreeMap::new, Collectors.counting()));
    }

    private static Map<String, List<TurnFacts>> group(List<TurnFacts> turns, Function<TurnFacts, String> field) {
        return turns.stream().collect(Collectors.groupingBy(field, TreeMap::new, Collectors.toList()));
    }
}
