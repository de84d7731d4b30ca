package com.herzen.tutor.ingestion;

import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.domain.DomainModels.SafetySignal;
import com.herzen.tutor.domain.DomainModels.TurnRecord;
import com.herzen.tutor.repository.ConversationJdbcRepository;
import com.herzen.tutor.repository.ModerationJdbcRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the student row, the turn and its optional flag in one transaction.
 */
@Component
public class TurnWriter {
    private final ConversationJdbcRepository conversations;
    private final ModerationJdbcRepository moderation;

    public TurnWriter(ConversationJdbcRepository conversations, ModerationJdbcRepository moderation) {
        this.conversations = conversations;
        this.moderation = moderation;
    }

    @Transactional
    public IngestionModels.WrittenTurn write(Identity author, TurnRecord draft, boolean createFlag) {
        conversations.recordStudentActivity(draft.studentId(), author.displayName(), author.email(), draft.createdAt());
        TurnRecord turn = conversations.insertTurn(draft);
        FlaggedItem flag = null;
        if (createFlag) {
            SafetySignal safety = turn.safety();
            flag = moderation.insertFlag(turn.turnId(), turn.studentId(), turn.createdAt(), safety.reason(), safety.severity());
        }
        return new IngestionModels.WrittenTurn(turn, flag);
    }
}
