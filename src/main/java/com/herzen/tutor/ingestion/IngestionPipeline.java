package com.herzen.tutor.ingestion;

import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.classification.TurnClassifier;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.error.PersistenceFailureException;
import com.herzen.tutor.ingestion.IngestionModels.IngestOutcome;
import com.herzen.tutor.ingestion.IngestionModels.WrittenTurn;
import com.herzen.tutor.moderation.ModerationFilter;
import com.herzen.tutor.moderation.ModerationFilter.ModerationDecision;
import com.herzen.tutor.moderation.SafetyAlertListener;
import com.herzen.tutor.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

@Service
@Slf4j
public class IngestionPipeline {
    private static final int PREVIEW_LENGTH = 80;

    private final RateLimiter rateLimiter;
    private final TurnClassifier classifier;
    private final ModerationFilter moderationFilter;
    private final TurnWriter writer;
    private final ObjectProvider<SafetyAlertListener> alertListeners;
    private final Retry persistenceRetry;
    private final TutorProperties.RateLimit rateLimitProps;
    private final Clock clock;

    public IngestionPipeline(RateLimiter rateLimiter,
                             TurnClassifier classifier,
                             ModerationFilter moderationFilter,
                             TurnWriter writer,
                             ObjectProvider<SafetyAlertListener> alertListeners,
                             RetryRegistry retryRegistry,
                             TutorProperties properties,
                             Clock clock) {
        this.rateLimiter = rateLimiter;
        this.classifier = classifier;
        this.moderationFilter = moderationFilter;
        this.writer = writer;
        this.alertListeners = alertListeners;
        this.persistenceRetry = retryRegistry.retry("persistence");
        this.rateLimitProps = properties.getRateLimit();
        this.clock = clock;
    }

    public IngestOutcome ingest(Identity identity, String sessionId, TurnRole role, String text) {
        Objects.requireNonNull(identity, "identity");
        if (sessionId == null || sessionId.isBlank()) throw new IllegalArgumentException("sessionId is required");
        if (role == null) throw new IllegalArgumentException("role is required");
        String body = text == null ? "" : text;
        String studentId = identity.subjectId();
        trace(IngestionStage.RECEIVED, studentId, sessionId);

        boolean counted = countsAgainstQuota(identity, role);
        if (counted && !rateLimiter.admit(studentId)) {
            trace(IngestionStage.REJECTED, studentId, sessionId);
            return IngestOutcome.rateLimited(rateLimiter.retryAfter(studentId));
        }
        trace(IngestionStage.RATE_CHECKED, studentId, sessionId);

        Labels labels = classifier.classify(body, role);
        trace(IngestionStage.CLASSIFIED, studentId, sessionId);

        ModerationDecision decision = moderationFilter.decide(body);
        trace(IngestionStage.MODERATION_CHECKED, studentId, sessionId);

        TurnRecord draft = new TurnRecord(0L, studentId, sessionId.trim(), role, body, clock.instant(), labels,
                decision.signal(), null);
        WrittenTurn written;
        try {
            written = Retry.decorateSupplier(persistenceRetry, () -> writer.write(identity, draft, decision.createFlag())).get();
        } catch (PersistenceFailureException e) {
            if (counted) rateLimiter.release(studentId);
            log.error("Turn not persisted after retries [studentId={}, sessionId={}]: {}", studentId, sessionId, e.getMessage());
            throw e;
        }
        TurnRecord turn = written.turn();
        trace(IngestionStage.PERSISTED, studentId, sessionId);
        log.info("Turn persisted [turnId={}, studentId={}, role={}, topic={}, sentiment={}, flagged={}]",
                turn.turnId(), studentId, role.code(), labels.topic(), labels.sentiment().code(), decision.createFlag());

        if (written.flag() != null) {
            log.warn("Turn flagged [turnId={}, reason={}, severity={}, preview=\"{}\"]", turn.turnId(),
                    written.flag().reason(), written.flag().severity(), preview(body));
            if (decision.alert()) notifyListeners(written.flag(), preview(body));
        }
        String reply = role == TurnRole.STUDENT ? decision.interventionReply() : null;
        return IngestOutcome.persisted(turn, written.flag(), reply);
    }

    // the role comes from the caller, so only an admin caller may post uncounted tutor turns
    private boolean countsAgainstQuota(Identity identity, TurnRole role) {
        return !identity.isAdmin() || role == TurnRole.STUDENT || rateLimitProps.isCountTutorTurns();
    }

    private void notifyListeners(FlaggedItem flag, String preview) {
        alertListeners.orderedStream().forEach(listener -> {
            try {
                listener.onFlag(flag, preview);
            } catch (RuntimeException e) {
                log.warn("Safety alert listener {} failed for flag {}", listener.getClass().getSimpleName(), flag.flagId(), e);
            }
        });
    }

    private static void trace(IngestionStage stage, String studentId, String sessionId) {
        log.debug("Ingest {} [studentId={}, sessionId={}]", stage, studentId, sessionId);
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= PREVIEW_LENGTH ? flat : flat.substring(0, PREVIEW_LENGTH) + "...";
    }
}
