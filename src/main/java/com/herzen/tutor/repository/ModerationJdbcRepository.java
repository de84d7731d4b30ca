package com.herzen.tutor.repository;

import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.ReviewStatus;
import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.Severity;
import com.herzen.tutor.error.PersistenceFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.herzen.tutor.repository.SqlTime.instant;
import static com.herzen.tutor.repository.SqlTime.utc;

@Repository
public class ModerationJdbcRepository {
    private static final String FLAG_COLUMNS =
            "flag_id, turn_id, student_id, flagged_at, reason, severity, status, reviewed_by, reviewed_at";

    private static final RowMapper<FlaggedItem> FLAG_MAPPER = (rs, n) -> new FlaggedItem(
            rs.getLong("flag_id"), rs.getLong("turn_id"), rs.getString("student_id"), instant(rs, "flagged_at"),
            SafetyReason.valueOf(rs.getString("reason")), Severity.valueOf(rs.getString("severity")),
            ReviewStatus.fromCode(rs.getString("status")), rs.getString("reviewed_by"), instant(rs, "reviewed_at"));

    private final JdbcTemplate jdbcTemplate;

    public ModerationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public FlaggedItem insertFlag(long turnId, String studentId, Instant flaggedAt, SafetyReason reason, Severity severity) {
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(
                        "INSERT INTO flagged_items(turn_id, student_id, flagged_at, reason, severity, status) VALUES (?,?,?,?,?,?)",
                        new String[]{"FLAG_ID"});
                ps.setLong(1, turnId);
                ps.setString(2, studentId);
                ps.setObject(3, utc(flaggedAt));
                ps.setString(4, reason.name());
                ps.setString(5, severity.name());
                ps.setString(6, ReviewStatus.UNREVIEWED.code());
                return ps;
            }, keys);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to store flag for turn " + turnId, e);
        }
        Number id = keys.getKey();
        if (id == null) throw new PersistenceFailureException("No flag id generated", null);
        return new FlaggedItem(id.longValue(), turnId, studentId, flaggedAt, reason, severity, ReviewStatus.UNREVIEWED, null, null);
    }

    public Optional<FlaggedItem> findFlag(long flagId) {
        try {
            return jdbcTemplate.query("SELECT " + FLAG_COLUMNS + " FROM flagged_items WHERE flag_id = ?", FLAG_MAPPER, flagId)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Flag store unavailable", e);
        }
    }

    /** Newest first; {@code status == null} lists every status. */
    public List<FlaggedItem> findFlags(ReviewStatus status, int limit) {
        String code = status == null ? null : status.code();
        try {
            return jdbcTemplate.query(
                    "SELECT " + FLAG_COLUMNS + " FROM flagged_items WHERE (CAST(? AS VARCHAR(32)) IS NULL OR status = ?) "
                            + "ORDER BY flagged_at DESC, flag_id DESC LIMIT ?",
                    FLAG_MAPPER, code, code, limit);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Flag store unavailable", e);
        }
    }

    public boolean updateStatus(long flagId, ReviewStatus status, String reviewedBy, Instant reviewedAt) {
        try {
            return jdbcTemplate.update(
                    "UPDATE flagged_items SET status = ?, reviewed_by = ?, reviewed_at = ? WHERE flag_id = ?",
                    status.code(), reviewedBy, utc(reviewedAt), flagId) == 1;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to update flag " + flagId, e);
        }
    }

    public long countByStatus(ReviewStatus status) {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM flagged_items WHERE status = ?", Long.class, status.code());
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Flag store unavailable", e);
        }
    }
}
