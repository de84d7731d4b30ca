package com.herzen.tutor.repository;

import com.herzen.tutor.analytics.AnalyticsModels.AnalyticsSummary;
import com.herzen.tutor.analytics.AnalyticsModels.TimeWindow;
import com.herzen.tutor.error.AggregationFailureException;
import com.herzen.tutor.error.PersistenceFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.herzen.tutor.repository.SqlTime.instant;
import static com.herzen.tutor.repository.SqlTime.utc;

@Repository
public class AnalyticsJdbcRepository {
    private static final String SUMMARY_COLUMNS =
            "window_start, window_end, grouping_key, total_turns, total_sessions, avg_turns_per_session, unique_students, "
                    + "flagged_turns, sentiment_counts, question_type_counts, topic_counts";

    // tombstones and the turns they hide never reach analytics
    private static final String COUNTED_TURNS =
            "FROM conversation_turns t WHERE t.created_at >= ? AND t.created_at < ? AND t.redacts_turn_id IS NULL "
                    + "AND NOT EXISTS (SELECT 1 FROM conversation_turns r WHERE r.redacts_turn_id = t.turn_id)";

    private static final RowMapper<TurnFacts> FACTS_MAPPER = (rs, n) -> new TurnFacts(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6),
            rs.getBoolean(7));

    private static final RowMapper<AnalyticsSummary> SUMMARY_MAPPER = (rs, n) -> new AnalyticsSummary(
            instant(rs, "window_start"), instant(rs, "window_end"), rs.getString("grouping_key"),
            rs.getLong("total_turns"), rs.getLong("total_sessions"), rs.getDouble("avg_turns_per_session"),
            rs.getLong("unique_students"), rs.getLong("flagged_turns"),
            parseCounters(rs.getString("sentiment_counts")), parseCounters(rs.getString("question_type_counts")),
            parseCounters(rs.getString("topic_counts")));

    private final JdbcTemplate jdbcTemplate;

    public AnalyticsJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<TurnFacts> loadTurns(TimeWindow window) {
        try {
            return jdbcTemplate.query(
                    "SELECT t.student_id, t.session_id, t.role, t.topic, t.sentiment, t.question_type, t.safety_flagged "
                            + COUNTED_TURNS + " ORDER BY t.turn_id",
                    FACTS_MAPPER, utc(window.start()), utc(window.end()));
        } catch (DataAccessException e) {
            throw new AggregationFailureException("Failed to load turns for " + window, e);
        }
    }

    public List<TurnFacts> loadStudentTurns(String studentId, TimeWindow window) {
        try {
            return jdbcTemplate.query(
                    "SELECT t.student_id, t.session_id, t.role, t.topic, t.sentiment, t.question_type, t.safety_flagged "
                            + COUNTED_TURNS + " AND t.student_id = ? ORDER BY t.turn_id",
                    FACTS_MAPPER, utc(window.start()), utc(window.end()), studentId);
        } catch (DataAccessException e) {
            throw new AggregationFailureException("Failed to load turns of " + studentId + " for " + window, e);
        }
    }

    /**
     * Replaces every summary row of the window in one transaction; on failure the previous rows stay.
     */
    @Transactional
    public void replaceWindow(TimeWindow window, List<AnalyticsSummary> summaries) {
        try {
            jdbcTemplate.update("DELETE FROM analytics_summaries WHERE window_start = ? AND window_end = ?",
                    utc(window.start()), utc(window.end()));
            summaries.forEach(this::insert);
        } catch (DataAccessException e) {
            throw new AggregationFailureException("Failed to write summaries for " + window, e);
        }
    }

    /** Replaces one grouping key of the window; a null summary only removes the old row. */
    @Transactional
    public void replaceGroup(TimeWindow window, String groupingKey, AnalyticsSummary summary) {
        try {
            jdbcTemplate.update("DELETE FROM analytics_summaries WHERE window_start = ? AND window_end = ? AND grouping_key = ?",
                    utc(window.start()), utc(window.end()), groupingKey);
            if (summary != null) insert(summary);
        } catch (DataAccessException e) {
            throw new AggregationFailureException("Failed to write summary " + groupingKey + " for " + window, e);
        }
    }

    public List<AnalyticsSummary> querySummaries(Instant from, Instant to, String groupingKey) {
        try {
            return jdbcTemplate.query(
                    "SELECT " + SUMMARY_COLUMNS + " FROM analytics_summaries WHERE window_start >= ? AND window_end <= ? "
                            + "AND (CAST(? AS VARCHAR(200)) IS NULL OR grouping_key = ?) ORDER BY window_start, grouping_key",
                    SUMMARY_MAPPER, utc(from), utc(to), groupingKey, groupingKey);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Summary store unavailable", e);
        }
    }

    private void insert(AnalyticsSummary s) {
        jdbcTemplate.update(
                "INSERT INTO analytics_summaries(" + SUMMARY_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                utc(s.windowStart()), utc(s.windowEnd()), s.groupingKey(), s.totalTurns(), s.totalSessions(),
                s.avgTurnsPerSession(), s.uniqueStudents(), s.flaggedTurns(),
                toCountersString(s.sentimentCounts()), toCountersString(s.questionTypeCounts()),
                toCountersString(s.topicCounts()));
    }

    private static String toCountersString(Map<String, Long> counters) {
        return new TreeMap<>(counters).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(";"));
    }

    private static Map<String, Long> parseCounters(String value) {
        if (value == null || value.isBlank()) return Map.of();
        return Arrays.stream(value.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty() && s.contains("="))
                .map(s -> s.split("=", 2))
                .collect(Collectors.toMap(p -> p[0], p -> Long.parseLong(p[1]), (a, b) -> b, TreeMap::new));
    }

    public record TurnFacts(String studentId, String sessionId, String role, String topic, String sentiment,
                            String questionType, boolean flagged) {}
}
