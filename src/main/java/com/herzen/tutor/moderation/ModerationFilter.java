package com.herzen.tutor.moderation;

import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.SafetySignal;
import com.herzen.tutor.domain.DomainModels.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

@Component
@Slf4j
public class ModerationFilter {
    private final List<SafetyRule> rules;
    private final Severity alertSeverity;

    public ModerationFilter(TutorProperties properties) {
        TutorProperties.Moderation props = properties.getModeration();
        List<SafetyRule> all = new ArrayList<>(SafetyRules.builtIn(props.getMaxMessageLength()));
        for (TutorProperties.Moderation.CustomRule custom : props.getCustomRules()) {
            if (custom.getPattern() == null || custom.getPattern().isBlank()) continue;
            Pattern pattern = Pattern.compile(custom.getPattern(), Pattern.CASE_INSENSITIVE);
            all.add(new SafetyRule(custom.getPriority(), custom.getReason(), custom.getSeverity(),
                    t -> pattern.matcher(t.raw()).find()));
        }
        // stable: a custom rule sharing a built-in priority runs after it
        all.sort(Comparator.comparingInt(SafetyRule::priority));
        this.rules = List.copyOf(all);
        this.alertSeverity = props.getAlertSeverity();
        log.info("Moderation filter loaded {} rules ({} custom)", rules.size(), props.getCustomRules().size());
    }

    public SafetySignal evaluate(String text) {
        SafetyRule.TurnText turnText = SafetyRule.TurnText.of(text);
        if (turnText.lower().length() < 2) return SafetySignal.clear();
        for (SafetyRule rule : rules) {
            if (rule.matches(turnText)) {
                return SafetySignal.of(rule.reason(), rule.severity());
            }
        }
        return SafetySignal.clear();
    }

    public ModerationDecision decide(String text) {
        SafetySignal signal = evaluate(text);
        if (!signal.flagged()) return ModerationDecision.pass(signal);
        return new ModerationDecision(signal, true, InterventionReplies.forSeverity(signal.severity()),
                signal.severity().compareTo(alertSeverity) >= 0);
    }

    /**
     * What the ingestion pipeline must do with a turn: persist it always, attach a flag when
     * {@code createFlag}, optionally surface an intervention reply, and alert when {@code alert}.
     */
    public record ModerationDecision(SafetySignal signal, boolean createFlag, String interventionReply, boolean alert) {
        static ModerationDecision pass(SafetySignal signal) {
            return new ModerationDecision(signal, false, null, false);
        }
    }
}
