package com.herzen.tutor.ingestion;

public enum IngestionStage {
    RECEIVED,
    RATE_CHECKED,
    CLASSIFIED,
    MODERATION_CHECKED,
    PERSISTED,
    REJECTED
}
