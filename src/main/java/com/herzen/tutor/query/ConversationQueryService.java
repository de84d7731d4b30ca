package com.herzen.tutor.query;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.analytics.AnalyticsAggregator;
import com.herzen.tutor.analytics.AnalyticsModels;
import com.herzen.tutor.analytics.AnalyticsModels.AnalyticsSummary;
import com.herzen.tutor.analytics.AnalyticsModels.RecomputeResult;
import com.herzen.tutor.analytics.AnalyticsModels.TimeWindow;
import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.ReviewStatus;
import com.herzen.tutor.domain.DomainModels.SafetySignal;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.Student;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.error.NotFoundException;
import com.herzen.tutor.repository.AnalyticsJdbcRepository;
import com.herzen.tutor.repository.ConversationJdbcRepository;
import com.herzen.tutor.repository.ModerationJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

@Service
@Slf4j
public class ConversationQueryService {
    static final int MAX_PAGE = 500;
    static final String TOMBSTONE_VERSION = "redaction";
    static final int ACTIVITY_DAYS = 30;
    static final int TOP_STUDENTS = 10;

    private final AccessGate accessGate;
    private final ConversationJdbcRepository conversations;
    private final ModerationJdbcRepository moderation;
    private final AnalyticsJdbcRepository analytics;
    private final AnalyticsAggregator aggregator;
    private final Clock clock;

    public ConversationQueryService(AccessGate accessGate,
                                    ConversationJdbcRepository conversations,
                                    ModerationJdbcRepository moderation,
                                    AnalyticsJdbcRepository analytics,
                                    AnalyticsAggregator aggregator,
                                    Clock clock) {
        this.accessGate = accessGate;
        this.conversations = conversations;
        this.moderation = moderation;
        this.analytics = analytics;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    /**
     * Stored rollups inside [from, to). A studentId filter selects the per-student rollup, a topic
     * filter the per-topic one; with neither, the global rows.
     */
    public List<AnalyticsSummary> getSummary(Identity identity, Instant from, Instant to, String topic, String studentId) {
        accessGate.requireAdmin(identity);
        TimeWindow range = new TimeWindow(from, to);
        String key = AnalyticsModels.GLOBAL_KEY;
        if (studentId != null && !studentId.isBlank()) key = AnalyticsModels.studentKey(studentId.trim());
        else if (topic != null && !topic.isBlank()) key = AnalyticsModels.topicKey(topic.trim());
        return analytics.querySummaries(range.start(), range.end(), key);
    }

    public RecomputeResult recompute(Identity identity, TimeWindow window, String studentId) {
        accessGate.requireAdmin(identity);
        TimeWindow target = window == null ? aggregator.currentWindow() : window;
        if (studentId != null && !studentId.isBlank()) return aggregator.recomputeStudent(studentId.trim(), target);
        return aggregator.recompute(target);
    }

    public List<FlaggedItem> listFlagged(Identity identity, ReviewStatus status, int limit) {
        accessGate.requireAdmin(identity);
        return moderation.findFlags(status, page(limit));
    }

    public FlaggedItem setFlagReviewStatus(Identity identity, long flagId, ReviewStatus status) {
        accessGate.requireAdmin(identity);
        if (status == null) throw new IllegalArgumentException("status is required");
        Instant now = clock.instant();
        if (!moderation.updateStatus(flagId, status, identity.email(), now)) {
            throw new NotFoundException("Flag " + flagId + " not found");
        }
        log.info("Flag reviewed [flagId={}, status={}, reviewer={}]", flagId, status.code(), identity.email());
        return moderation.findFlag(flagId).orElseThrow(() -> new NotFoundException("Flag " + flagId + " not found"));
    }

    public List<TurnRecord> getStudentHistory(Identity identity, String studentId, int limit) {
        accessGate.requireSelfOrAdmin(identity, studentId);
        return conversations.findHistory(studentId, page(limit));
    }

    public List<Student> listStudents(Identity identity, int limit, int offset) {
        accessGate.requireAdmin(identity);
        return conversations.listStudents(page(limit), Math.max(offset, 0));
    }

    public QueryModels.PlatformStats platformStats(Identity identity) {
        accessGate.requireAdmin(identity);
        Instant now = clock.instant();
        Instant startOfDay = now.atOffset(ZoneOffset.UTC).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        long totalTurns = conversations.countTurns();
        long activeWeek = conversations.countStudentsActiveSince(now.minus(Duration.ofDays(7)));
        long totalStudents = conversations.countStudents();
        double avg = totalStudents == 0 ? 0.0 : Math.round((double) totalTurns / totalStudents * 10.0) / 10.0;
        Instant weekAgo = now.minus(Duration.ofDays(7));
        return new QueryModels.PlatformStats(totalStudents, totalTurns,
                conversations.countStudentsActiveSince(startOfDay), activeWeek,
                moderation.countByStatus(ReviewStatus.UNREVIEWED), avg,
                conversations.dailyTurnCounts(startOfDay.minus(Duration.ofDays(ACTIVITY_DAYS)), startOfDay.plus(Duration.ofDays(1))),
                conversations.mostActiveStudents(weekAgo, now, TOP_STUDENTS));
    }

    public List<TurnRecord> searchTurns(Identity identity, String query, int limit) {
        accessGate.requireAdmin(identity);
        if (query == null || query.isBlank()) throw new IllegalArgumentException("query is required");
        return conversations.searchTurns(query.trim(), page(limit));
    }

    public List<TurnRecord> listConversations(Identity identity, int limit, int offset) {
        accessGate.requireAdmin(identity);
        return conversations.listRecentTurns(page(limit), Math.max(offset, 0));
    }

    /**
     * Hides a turn by appending a tombstone to its session. The original row is left untouched.
     */
    @Transactional
    public TurnRecord redactTurn(Identity identity, long turnId, String reason) {
        accessGate.requireAdmin(identity);
        TurnRecord target = conversations.findTurn(turnId)
                .orElseThrow(() -> new NotFoundException("Turn " + turnId + " not found"));
        if (target.tombstone()) throw new IllegalArgumentException("Turn " + turnId + " is itself a redaction");
        if (conversations.isRedacted(turnId)) throw new IllegalArgumentException("Turn " + turnId + " is already redacted");
        QuestionType questionType = target.role() == TurnRole.STUDENT ? QuestionType.OTHER : null;
        TurnRecord tombstone = conversations.insertTurn(new TurnRecord(0L, target.studentId(), target.sessionId(),
                target.role(), ConversationJdbcRepository.REDACTED_MARKER, clock.instant(),
                new Labels("general", Sentiment.NEUTRAL, questionType, TOMBSTONE_VERSION, false),
                SafetySignal.clear(), turnId));
        log.info("Turn redacted [turnId={}, tombstoneId={}, by={}, reason={}]", turnId, tombstone.turnId(), identity.email(), reason);
        return tombstone;
    }

    private static int page(int limit) {
        if (limit <= 0) return 50;
        return Math.min(limit, MAX_PAGE);
    }
}
