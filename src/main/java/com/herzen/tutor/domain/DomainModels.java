package com.herzen.tutor.domain;

import java.time.Instant;
import java.util.Locale;

public class DomainModels {
    public record Student(String studentId,
                          String displayName,
                          String email,
                          Instant enrolledAt,
                          Instant lastActiveAt,
                          long totalTurns) {}

    public record Labels(String topic,
                         Sentiment sentiment,
                         QuestionType questionType,
                         String classifierVersion,
                         boolean degraded) {}

    public record SafetySignal(boolean flagged, SafetyReason reason, Severity severity) {
        public static SafetySignal clear() {
            return new SafetySignal(false, null, Severity.NONE);
        }

        public static SafetySignal of(SafetyReason reason, Severity severity) {
            return new SafetySignal(true, reason, severity);
        }
    }

    /**
     * One persisted conversation turn. Rows are append-only; a redaction is a new tombstone
     * turn whose {@code redactsTurnId} points at the hidden one.
     */
    public record TurnRecord(long turnId,
                             String studentId,
                             String sessionId,
                             TurnRole role,
                             String text,
                             Instant createdAt,
                             Labels labels,
                             SafetySignal safety,
                             Long redactsTurnId) {
        public boolean tombstone() {
            return redactsTurnId != null;
        }
    }

    public record FlaggedItem(long flagId,
                              long turnId,
                              String studentId,
                              Instant flaggedAt,
                              SafetyReason reason,
                              Severity severity,
                              ReviewStatus status,
                              String reviewedBy,
                              Instant reviewedAt) {}

    public enum TurnRole {
        STUDENT, TUTOR;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static TurnRole fromCode(String code) {
            if (code == null) throw new IllegalArgumentException("role is required");
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            if ("student".equals(normalized)) return STUDENT;
            if ("tutor".equals(normalized)) return TUTOR;
            throw new IllegalArgumentException("unknown role: " + code);
        }
    }

    public enum Sentiment {
        POSITIVE, NEUTRAL, NEGATIVE;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Sentiment fromCode(String code) {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum QuestionType {
        FACTUAL("factual"),
        OPEN_ENDED("open-ended"),
        OTHER("other");

        private final String code;

        QuestionType(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        public static QuestionType fromCode(String code) {
            if (code == null) return null;
            for (QuestionType q : values()) {
                if (q.code.equalsIgnoreCase(code) || q.name().equalsIgnoreCase(code)) return q;
            }
            throw new IllegalArgumentException("unknown question type: " + code);
        }
    }

    public enum Severity { NONE, LOW, MEDIUM, HIGH, CRITICAL }

    public enum SafetyReason {
        SELF_HARM,
        MESSAGE_TOO_LONG,
        VIOLENCE,
        HATE_SPEECH,
        DRUGS,
        SEXUAL_CONTENT,
        ACADEMIC_DISHONESTY,
        PERSONAL_DATA,
        HARASSMENT,
        PROFANITY,
        SPAM,
        OFF_TOPIC,
        SUSPICIOUS_PATTERN,
        CUSTOM
    }

    public enum ReviewStatus {
        UNREVIEWED("unreviewed"),
        REVIEWED_OK("reviewed-ok"),
        REVIEWED_ACTION_TAKEN("reviewed-action-taken");

        private final String code;

        ReviewStatus(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        public static ReviewStatus fromCode(String code) {
            for (ReviewStatus s : values()) {
                if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) return s;
            }
            throw new IllegalArgumentException("unknown review status: " + code);
        }
    }
}
