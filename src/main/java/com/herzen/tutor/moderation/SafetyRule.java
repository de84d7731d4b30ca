package com.herzen.tutor.moderation;

import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.Severity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

public record SafetyRule(int priority, SafetyReason reason, Severity severity, Predicate<TurnText> check) {

    public boolean matches(TurnText text) {
        return check.test(text);
    }

    static SafetyRule anyPattern(int priority, SafetyReason reason, Severity severity, String... regexes) {
        List<Pattern> patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
        return new SafetyRule(priority, reason, severity,
                t -> patterns.stream().anyMatch(p -> p.matcher(t.lower()).find()));
    }

    /** Raw text plus its trimmed lower-case form, computed once per evaluation. */
    public record TurnText(String raw, String lower) {
        public static TurnText of(String raw) {
            String r = raw == null ? "" : raw.strip();
            return new TurnText(r, r.toLowerCase(Locale.ROOT));
        }
    }
}
