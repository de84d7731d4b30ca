package com.herzen.tutor;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.analytics.AnalyticsAggregator;
import com.herzen.tutor.analytics.AnalyticsModels;
import com.herzen.tutor.analytics.AnalyticsModels.AnalyticsSummary;
import com.herzen.tutor.analytics.AnalyticsModels.TimeWindow;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.error.AggregationFailureException;
import com.herzen.tutor.ingestion.IngestionPipeline;
import com.herzen.tutor.repository.AnalyticsJdbcRepository;
import com.herzen.tutor.support.MutableClock;
import com.herzen.tutor.support.TestEngineConfig;
import com.herzen.tutor.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import(TestEngineConfig.class)
@ExtendWith(OutputCaptureExtension.class)
class AggregationFailureTest {
    @Autowired
    private AnalyticsAggregator aggregator;
    @Autowired
    private IngestionPipeline pipeline;
    @Autowired
    private AccessGate accessGate;
    @Autowired
    private MutableClock clock;
    @SpyBean
    private AnalyticsJdbcRepository repository;

    @BeforeEach
    void setUp() {
        reset(repository);
    }

    @Test
    void failedLoadKeepsPreviousSummariesAndSchedulerCarriesOn(CapturedOutput output) {
        clock.set(Instant.parse("2036-02-02T10:20:00Z"));
        Identity student = accessGate.authenticate(TestTokens.student(clock, "aggfail-load"));
        pipeline.ingest(student, "aggfail-1", TurnRole.STUDENT, "What is a prime number?");
        pipeline.ingest(student, "aggfail-1", TurnRole.STUDENT, "Is 7 prime?");
        TimeWindow window = aggregator.currentWindow();
        aggregator.recompute(window);
        List<AnalyticsSummary> before = repository.querySummaries(window.start(), window.end(), null);

        pipeline.ingest(student, "aggfail-1", TurnRole.STUDENT, "And 9?");
        doThrow(new AggregationFailureException("store down", new DataAccessResourceFailureException("down")))
                .when(repository).loadTurns(any());

        assertThrows(AggregationFailureException.class, () -> aggregator.recompute(window));
        assertEquals(before, repository.querySummaries(window.start(), window.end(), null));

        assertDoesNotThrow(() -> aggregator.scheduledRecompute());
        // one success, one direct failure, two scheduled attempts
        verify(repository, times(4)).loadTurns(window);
        assertTrue(output.getOut().contains("Scheduled recompute failed"));
        List<AnalyticsSummary> after = repository.querySummaries(window.start(), window.end(), null);
        assertEquals(before, after);
        assertEquals(2, find(after, AnalyticsModels.GLOBAL_KEY).totalTurns());
    }

    @Test
    void failedInsertRollsBackTheWholeWindow() {
        clock.set(Instant.parse("2036-03-03T07:05:00Z"));
        Identity student = accessGate.authenticate(TestTokens.student(clock, "aggfail-write"));
        pipeline.ingest(student, "aggfail-2", TurnRole.STUDENT, "How do volcanoes form?");
        TimeWindow window = aggregator.currentWindow();
        aggregator.recompute(window);
        List<AnalyticsSummary> before = repository.querySummaries(window.start(), window.end(), null);
        assertFalse(before.isEmpty());

        AnalyticsSummary valid = new AnalyticsSummary(window.start(), window.end(), AnalyticsModels.GLOBAL_KEY,
                9, 9, 1.0, 9, 0, Map.of(), Map.of(), Map.of());
        AnalyticsSummary oversized = new AnalyticsSummary(window.start(), window.end(), "topic:" + "x".repeat(300),
                1, 1, 1.0, 1, 0, Map.of(), Map.of(), Map.of());

        assertThrows(AggregationFailureException.class, () -> repository.replaceWindow(window, List.of(valid, oversized)));
        assertEquals(before, repository.querySummaries(window.start(), window.end(), null));
    }

    private static AnalyticsSummary find(List<AnalyticsSummary> rows, String key) {
        return rows.stream().filter(r -> key.equals(r.groupingKey())).findFirst()
                .orElseThrow(() -> new AssertionError("no summary for " + key));
    }
}
