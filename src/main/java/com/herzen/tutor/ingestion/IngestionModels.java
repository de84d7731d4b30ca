package com.herzen.tutor.ingestion;

import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.TurnRecord;

import java.time.Duration;

public class IngestionModels {
    /**
     * Result of {@code ingest}: either the persisted turn (with its flag, if any) or a rate-limit
     * rejection carrying how long the caller should wait.
     */
    public record IngestOutcome(IngestionStage stage,
                                TurnRecord turn,
                                FlaggedItem flag,
                                Duration retryAfter,
                                String interventionReply) {
        public static IngestOutcome persisted(TurnRecord turn, FlaggedItem flag, String interventionReply) {
            return new IngestOutcome(IngestionStage.PERSISTED, turn, flag, null, interventionReply);
        }

        public static IngestOutcome rateLimited(Duration retryAfter) {
            return new IngestOutcome(IngestionStage.REJECTED, null, null, retryAfter, null);
        }

        public boolean accepted() {
            return stage == IngestionStage.PERSISTED;
        }

        public boolean flagged() {
            return flag != null;
        }
    }

    public record WrittenTurn(TurnRecord turn, FlaggedItem flag) {}
}
