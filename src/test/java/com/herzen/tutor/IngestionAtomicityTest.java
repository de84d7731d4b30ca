package com.herzen.tutor;

import com.herzen.tutor.access.AccessGate;
import com.herzen.tutor.access.AccessModels.Identity;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import com.herzen.tutor.error.PersistenceFailureException;
import com.herzen.tutor.ingestion.IngestionPipeline;
import com.herzen.tutor.ratelimit.RateLimiter;
import com.herzen.tutor.repository.ConversationJdbcRepository;
import com.herzen.tutor.repository.ModerationJdbcRepository;
import com.herzen.tutor.support.MutableClock;
import com.herzen.tutor.support.TestEngineConfig;
import com.herzen.tutor.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import(TestEngineConfig.class)
class IngestionAtomicityTest {
    @Autowired
    private IngestionPipeline pipeline;
    @Autowired
    private AccessGate accessGate;
    @Autowired
    private ConversationJdbcRepository conversations;
    @Autowired
    private RateLimiter rateLimiter;
    @Autowired
    private MutableClock clock;
    @SpyBean
    private ModerationJdbcRepository moderation;

    @BeforeEach
    void setUp() {
        clock.set(Instant.parse("2030-01-08T09:00:00Z"));
        reset(moderation);
    }

    @Test
    void failedFlagWriteLeavesNoTurnBehindAndRefundsQuota() {
        doThrow(new PersistenceFailureException("flag store down", new DataAccessResourceFailureException("down")))
                .when(moderation).insertFlag(anyLong(), anyString(), any(), any(), any());
        Identity student = accessGate.authenticate(TestTokens.student(clock, "atomic-1"));

        assertThrows(PersistenceFailureException.class,
                () -> pipeline.ingest(student, "sess-a", TurnRole.STUDENT, "I feel hopeless"));

        // three attempts, each rolled back
        verify(moderation, times(3)).insertFlag(anyLong(), anyString(), any(), any(), any());
        assertTrue(conversations.findHistory("atomic-1", 10).isEmpty());
        assertTrue(conversations.findStudent("atomic-1").isEmpty());
        assertEquals(5, rateLimiter.remaining("atomic-1"));
    }

    @Test
    void transientFailureIsRetried() {
        doThrow(new PersistenceFailureException("blip", new DataAccessResourceFailureException("blip")))
                .doCallRealMethod()
                .when(moderation).insertFlag(anyLong(), anyString(), any(), any(), any());
        Identity student = accessGate.authenticate(TestTokens.student(clock, "atomic-2"));

        var outcome = pipeline.ingest(student, "sess-b", TurnRole.STUDENT, "I feel hopeless");

        assertTrue(outcome.accepted());
        assertNotNull(outcome.flag());
        assertEquals(1, conversations.findHistory("atomic-2", 10).size());
        assertEquals(1, conversations.findStudent("atomic-2").orElseThrow().totalTurns());
    }
}
