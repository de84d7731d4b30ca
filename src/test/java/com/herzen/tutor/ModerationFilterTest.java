package com.herzen.tutor;

import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.SafetySignal;
import com.herzen.tutor.domain.DomainModels.Severity;
import com.herzen.tutor.moderation.ModerationFilter;
import com.herzen.tutor.moderation.ModerationFilter.ModerationDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModerationFilterTest {
    private final ModerationFilter filter = new ModerationFilter(new TutorProperties());

    @Test
    void hopelessIsFlaggedAsSelfHarm() {
        SafetySignal signal = filter.evaluate("I feel hopeless");
        assertTrue(signal.flagged());
        assertEquals(SafetyReason.SELF_HARM, signal.reason());
        assertEquals(Severity.CRITICAL, signal.severity());
    }

    @Test
    void ordinaryStudyQuestionsPass() {
        assertFalse(filter.evaluate("Can you explain how fractions work?").flagged());
        assertFalse(filter.evaluate("").flagged());
        assertFalse(filter.evaluate("What is 3.14159265358979 rounded to two places?").flagged());
    }

    @Test
    void firstMatchingRuleWins() {
        // also matches the violence and all-caps rules, self-harm has the highest priority
        SafetySignal signal = filter.evaluate("I WANT TO DIE AND HURT SOMEONE");
        assertEquals(SafetyReason.SELF_HARM, signal.reason());
    }

    @Test
    void detectsPersonalDataAndProfanity() {
        assertEquals(SafetyReason.PERSONAL_DATA, filter.evaluate("you can email me at kid@example.com").reason());
        assertEquals(SafetyReason.PERSONAL_DATA, filter.evaluate("call me on 555-123-4567").reason());
        assertEquals(SafetyReason.PROFANITY, filter.evaluate("this damn shit homework").reason());
        assertFalse(filter.evaluate("what the hell is photosynthesis").flagged());
    }

    @Test
    void flagsOverlongMessages() {
        SafetySignal signal = filter.evaluate("word ".repeat(500));
        assertEquals(SafetyReason.MESSAGE_TOO_LONG, signal.reason());
        assertEquals(Severity.MEDIUM, signal.severity());
    }

    @Test
    void decisionCarriesInterventionReplyAndAlertThreshold() {
        ModerationDecision critical = filter.decide("I want to kill myself");
        assertTrue(critical.createFlag());
        assertTrue(critical.alert());
        assertTrue(critical.interventionReply().contains("988"));

        ModerationDecision low = filter.decide("helloooooo tutor");
        assertTrue(low.createFlag());
        assertEquals(Severity.LOW, low.signal().severity());
        assertFalse(low.alert());

        ModerationDecision clear = filter.decide("What is gravity?");
        assertFalse(clear.createFlag());
        assertNull(clear.interventionReply());
    }

    @Test
    void customRulesRunInPriorityOrder() {
        TutorProperties properties = new TutorProperties();
        TutorProperties.Moderation.CustomRule early = new TutorProperties.Moderation.CustomRule();
        early.setPattern("\\bsecret\\s+club\\b");
        early.setSeverity(Severity.HIGH);
        early.setPriority(5);
        TutorProperties.Moderation.CustomRule late = new TutorProperties.Moderation.CustomRule();
        late.setPattern("homework");
        properties.getModeration().setCustomRules(List.of(early, late));
        ModerationFilter custom = new ModerationFilter(properties);

        SafetySignal signal = custom.evaluate("join my secret club, I feel hopeless");
        assertEquals(SafetyReason.CUSTOM, signal.reason());
        assertEquals(Severity.HIGH, signal.severity());
        assertEquals(SafetyReason.CUSTOM, custom.evaluate("I did my homework").reason());
        assertEquals(Severity.MEDIUM, custom.evaluate("I did my homework").severity());
    }
}
