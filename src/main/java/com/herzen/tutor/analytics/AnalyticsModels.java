package com.herzen.tutor.analytics;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public class AnalyticsModels {
    public static final String GLOBAL_KEY = "global";
    public static final String TOPIC_PREFIX = "topic:";
    public static final String STUDENT_PREFIX = "student:";

    /** Half-open interval [start, end). */
    public record TimeWindow(Instant start, Instant end) {
        public TimeWindow {
            if (start == null || end == null) throw new IllegalArgumentException("window start and end are required");
            if (!start.isBefore(end)) throw new IllegalArgumentException("window start must be before end");
        }

        public static TimeWindow aligned(Instant instant, Duration length) {
            long size = length.toMillis();
            if (size <= 0) throw new IllegalArgumentException("window length must be positive");
            long start = Math.floorDiv(instant.toEpochMilli(), size) * size;
            return new TimeWindow(Instant.ofEpochMilli(start), Instant.ofEpochMilli(start + size));
        }

        public TimeWindow previous() {
            Duration length = Duration.between(start, end);
            return new TimeWindow(start.minus(length), start);
        }
    }

    /**
     * Rollup of the turns in one window for one grouping key ({@code global}, {@code topic:<t>} or
     * {@code student:<id>}). Counter maps are sorted by key.
     */
    public record AnalyticsSummary(Instant windowStart,
                                   Instant windowEnd,
                                   String groupingKey,
                                   long totalTurns,
                                   long totalSessions,
                                   double avgTurnsPerSession,
                                   long uniqueStudents,
                                   long flaggedTurns,
                                   Map<String, Long> sentimentCounts,
                                   Map<String, Long> questionTypeCounts,
                                   Map<String, Long> topicCounts) {}

    public record RecomputeResult(TimeWindow window, int summariesWritten) {}

    public static String topicKey(String topic) {
        return TOPIC_PREFIX + topic;
    }

    public static String studentKey(String studentId) {
        return STUDENT_PREFIX + studentId;
    }
}
