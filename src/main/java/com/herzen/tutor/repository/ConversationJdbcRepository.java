package com.herzen.tutor.repository;

import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.SafetySignal;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.Severity;
import com.herzen.tutor.domain.DomainModels.Student;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.error.PersistenceFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

import static com.herzen.tutor.repository.SqlTime.instant;
import static com.herzen.tutor.repository.SqlTime.utc;

/**
 * Students and the append-only turn log. Rows in conversation_turns are never updated; a redaction
 * is an extra row whose redacts_turn_id points at the hidden turn.
 */
@Repository
public class ConversationJdbcRepository {
    public static final String REDACTED_MARKER = "[message redacted by a moderator]";

    public record DailyActivity(LocalDate date, long turns) {}

    public record ActiveStudent(String studentId, String displayName, String email, long turnCount) {}

    private static final String TURN_COLUMNS =
            "t.turn_id, t.student_id, t.session_id, t.role, t.message_text, t.created_at, t.topic, t.sentiment, "
                    + "t.question_type, t.classifier_version, t.labels_degraded, t.safety_flagged, t.safety_reason, "
                    + "t.safety_severity, t.redacts_turn_id, "
                    + "EXISTS (SELECT 1 FROM conversation_turns r WHERE r.redacts_turn_id = t.turn_id) AS redacted";

    private static final RowMapper<TurnRecord> TURN_MAPPER = (rs, n) -> {
        String reason = rs.getString("safety_reason");
        long redacts = rs.getLong("redacts_turn_id");
        Long redactsTurnId = rs.wasNull() ? null : redacts;
        String text = rs.getBoolean("redacted") ? REDACTED_MARKER : rs.getString("message_text");
        return new TurnRecord(
                rs.getLong("turn_id"), rs.getString("student_id"), rs.getString("session_id"),
                TurnRole.fromCode(rs.getString("role")), text, instant(rs, "created_at"),
                new Labels(rs.getString("topic"), Sentiment.fromCode(rs.getString("sentiment")),
                        QuestionType.fromCode(rs.getString("question_type")), rs.getString("classifier_version"),
                        rs.getBoolean("labels_degraded")),
                new SafetySignal(rs.getBoolean("safety_flagged"), reason == null ? null : SafetyReason.valueOf(reason),
                        Severity.valueOf(rs.getString("safety_severity"))),
                redactsTurnId);
    };

    private static final RowMapper<Student> STUDENT_MAPPER = (rs, n) -> new Student(
            rs.getString("student_id"), rs.getString("display_name"), rs.getString("email"),
            instant(rs, "enrolled_at"), instant(rs, "last_active_at"), rs.getLong("total_turns"));

    private final JdbcTemplate jdbcTemplate;

    public ConversationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the student on first contact; afterwards bumps activity and the turn counter.
     * enrolled_at is written once.
     */
    public void recordStudentActivity(String studentId, String displayName, String email, Instant at) {
        try {
            jdbcTemplate.update(
                    "MERGE INTO students s USING (VALUES (CAST(? AS VARCHAR(128)), CAST(? AS VARCHAR(255)), CAST(? AS VARCHAR(320)), CAST(? AS TIMESTAMP WITH TIME ZONE))) "
                            + "AS v(student_id, display_name, email, ts) ON s.student_id = v.student_id "
                            + "WHEN MATCHED THEN UPDATE SET last_active_at = v.ts, total_turns = s.total_turns + 1, "
                            + "display_name = COALESCE(s.display_name, v.display_name), email = COALESCE(s.email, v.email) "
                            + "WHEN NOT MATCHED THEN INSERT (student_id, display_name, email, enrolled_at, last_active_at, total_turns) "
                            + "VALUES (v.student_id, v.display_name, v.email, v.ts, v.ts, 1)",
                    studentId, displayName, email, utc(at));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to record student " + studentId, e);
        }
    }

    public TurnRecord insertTurn(TurnRecord turn) {
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(
                        "INSERT INTO conversation_turns(student_id, session_id, role, message_text, created_at, topic, sentiment, question_type, "
                                + "classifier_version, labels_degraded, safety_flagged, safety_reason, safety_severity, redacts_turn_id) "
                                + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                        new String[]{"TURN_ID"});
                Labels labels = turn.labels();
                SafetySignal safety = turn.safety();
                ps.setString(1, turn.studentId());
                ps.setString(2, turn.sessionId());
                ps.setString(3, turn.role().code());
                ps.setString(4, turn.text());
                ps.setObject(5, utc(turn.createdAt()));
                ps.setString(6, labels.topic());
                ps.setString(7, labels.sentiment().code());
                ps.setString(8, labels.questionType() == null ? null : labels.questionType().code());
                ps.setString(9, labels.classifierVersion());
                ps.setBoolean(10, labels.degraded());
                ps.setBoolean(11, safety.flagged());
                ps.setString(12, safety.reason() == null ? null : safety.reason().name());
                ps.setString(13, safety.severity().name());
                if (turn.redactsTurnId() == null) ps.setNull(14, Types.BIGINT);
                else ps.setLong(14, turn.redactsTurnId());
                return ps;
            }, keys);
        } catch (DuplicateKeyException e) {
            // only redacts_turn_id is unique among the inserted columns
            throw new IllegalArgumentException("Turn " + turn.redactsTurnId() + " is already redacted", e);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to store turn for student " + turn.studentId(), e);
        }
        Number id = keys.getKey();
        if (id == null) throw new PersistenceFailureException("No turn id generated", null);
        return new TurnRecord(id.longValue(), turn.studentId(), turn.sessionId(), turn.role(), turn.text(),
                turn.createdAt(), turn.labels(), turn.safety(), turn.redactsTurnId());
    }

    public Optional<TurnRecord> findTurn(long turnId) {
        return read(() -> jdbcTemplate.query(
                "SELECT " + TURN_COLUMNS + " FROM conversation_turns t WHERE t.turn_id = ?", TURN_MAPPER, turnId)
                .stream().findFirst());
    }

    public boolean isRedacted(long turnId) {
        Integer count = read(() -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM conversation_turns WHERE redacts_turn_id = ?", Integer.class, turnId));
        return count != null && count > 0;
    }

    /** Newest {@code limit} visible turns of one student, returned oldest first. */
    public List<TurnRecord> findHistory(String studentId, int limit) {
        List<TurnRecord> newest = read(() -> jdbcTemplate.query(
                "SELECT " + TURN_COLUMNS + " FROM conversation_turns t WHERE t.student_id = ? AND t.redacts_turn_id IS NULL "
                        + "ORDER BY t.created_at DESC, t.turn_id DESC LIMIT ?",
                TURN_MAPPER, studentId, limit));
        List<TurnRecord> ordered = new ArrayList<>(newest);
        Collections.reverse(ordered);
        return ordered;
    }

    public List<TurnRecord> listRecentTurns(int limit, int offset) {
        return read(() -> jdbcTemplate.query(
                "SELECT " + TURN_COLUMNS + " FROM conversation_turns t WHERE t.redacts_turn_id IS NULL "
                        + "ORDER BY t.created_at DESC, t.turn_id DESC LIMIT ? OFFSET ?",
                TURN_MAPPER, limit, offset));
    }

    /** Case-insensitive substring match; redacted turns are not searchable. */
    public List<TurnRecord> searchTurns(String query, int limit) {
        String pattern = "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%";
        return read(() -> jdbcTemplate.query(
                "SELECT " + TURN_COLUMNS + " FROM conversation_turns t WHERE t.redacts_turn_id IS NULL "
                        + "AND NOT EXISTS (SELECT 1 FROM conversation_turns r WHERE r.redacts_turn_id = t.turn_id) "
                        + "AND LOWER(t.message_text) LIKE ? ESCAPE '\\' ORDER BY t.created_at DESC, t.turn_id DESC LIMIT ?",
                TURN_MAPPER, pattern, limit));
    }

    public Optional<Student> findStudent(String studentId) {
        return read(() -> jdbcTemplate.query(
                "SELECT student_id, display_name, email, enrolled_at, last_active_at, total_turns FROM students WHERE student_id = ?",
                STUDENT_MAPPER, studentId).stream().findFirst());
    }

    public List<Student> listStudents(int limit, int offset) {
        return read(() -> jdbcTemplate.query(
                "SELECT student_id, display_name, email, enrolled_at, last_active_at, total_turns FROM students "
                        + "ORDER BY last_active_at DESC, student_id LIMIT ? OFFSET ?",
                STUDENT_MAPPER, limit, offset));
    }

    public long countStudents() {
        return count("SELECT COUNT(*) FROM students");
    }

    public long countTurns() {
        return count("SELECT COUNT(*) FROM conversation_turns WHERE redacts_turn_id IS NULL");
    }

    public long countStudentsActiveSince(Instant since) {
        return count("SELECT COUNT(*) FROM students WHERE last_active_at >= ?", utc(since));
    }

    /** Visible turns per UTC day in [from, to), newest day first. */
    public List<DailyActivity> dailyTurnCounts(Instant from, Instant to) {
        return read(() -> jdbcTemplate.query(
                "SELECT CAST(FLOOR(EXTRACT(EPOCH FROM created_at) / 86400) AS BIGINT) AS epoch_day, COUNT(*) AS turns "
                        + "FROM conversation_turns WHERE redacts_turn_id IS NULL AND created_at >= ? AND created_at < ? "
                        + "GROUP BY CAST(FLOOR(EXTRACT(EPOCH FROM created_at) / 86400) AS BIGINT) ORDER BY epoch_day DESC",
                (rs, n) -> new DailyActivity(LocalDate.ofEpochDay(rs.getLong("epoch_day")), rs.getLong("turns")),
                utc(from), utc(to)));
    }

    /** Students with the most visible turns in [from, to]. */
    public List<ActiveStudent> mostActiveStudents(Instant from, Instant to, int limit) {
        return read(() -> jdbcTemplate.query(
                "SELECT s.student_id, s.display_name, s.email, COUNT(t.turn_id) AS turn_count "
                        + "FROM students s JOIN conversation_turns t ON t.student_id = s.student_id "
                        + "WHERE t.redacts_turn_id IS NULL AND t.created_at >= ? AND t.created_at <= ? "
                        + "GROUP BY s.student_id, s.display_name, s.email "
                        + "ORDER BY turn_count DESC, s.student_id LIMIT ?",
                (rs, n) -> new ActiveStudent(rs.getString("student_id"), rs.getString("display_name"),
                        rs.getString("email"), rs.getLong("turn_count")),
                utc(from), utc(to), limit));
    }

    private long count(String sql, Object... args) {
        Long value = read(() -> jdbcTemplate.queryForObject(sql, Long.class, args));
        return value == null ? 0 : value;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static <T> T read(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Conversation store unavailable", e);
        }
    }
}
