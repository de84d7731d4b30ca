package com.herzen.tutor.moderation;

import com.herzen.tutor.domain.DomainModels.Severity;

public final class InterventionReplies {
    private InterventionReplies() {}

    public static String forSeverity(Severity severity) {
        if (severity == null || severity == Severity.NONE) return null;
        if (severity == Severity.CRITICAL) return critical();
        if (severity == Severity.HIGH) return high();
        if (severity == Severity.MEDIUM) return medium();
        return low();
    }

    public static String critical() {
        return "I'm really concerned about what you've shared. Your safety is the most important thing.\n\n"
                + "Please talk to a trusted adult right away, like a parent, teacher, or school counselor.\n"
                + "- Call or text 988 (Suicide & Crisis Lifeline, 24/7)\n"
                + "- Text HELLO to 741741 (Crisis Text Line)\n"
                + "- Call 911 if you're in immediate danger\n\n"
                + "You don't have to face difficult feelings alone.";
    }

    public static String high() {
        return "I understand you're feeling strong emotions right now. It's okay to feel frustrated, but let's keep "
                + "things respectful. How about we explore a topic you're curious about today?";
    }

    public static String medium() {
        return "I'm here to help with your learning! Let's keep our conversation positive and educational. "
                + "What subject interests you most today?";
    }

    public static String low() {
        return "Let's keep our conversation focused on learning! What would you like to explore today?";
    }
}
