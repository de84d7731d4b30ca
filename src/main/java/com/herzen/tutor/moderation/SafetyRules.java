package com.herzen.tutor.moderation;

import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class SafetyRules {
    private static final List<Pattern> PROFANITY = Stream.of("fuck", "shit", "damn", "hell", "ass",
                    "bitch", "bastard", "crap", "piss", "dick", "pussy", "whore", "slut", "fag", "retard")
            .map(w -> Pattern.compile("\\b" + w + "\\b"))
            .toList();

    private static final Pattern EMAIL = Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("(?<!\\d)(?:\\(\\d{3}\\)\\s?|\\d{3}-)\\d{3}-\\d{4}(?!\\d)");
    private static final Pattern SSN = Pattern.compile("(?<!\\d)\\d{3}-\\d{2}-\\d{4}(?!\\d)");
    private static final Pattern SHARED_DETAIL = Pattern.compile(
            "\\bmy\\s+(phone\\s+number|home\\s+address|address|password|social\\s+security(\\s+number)?|credit\\s+card|bank\\s+account)\\s+is\\b");
    private static final Pattern PERSONAL_INFO_REQUEST = Pattern.compile(
            "\\b(personal\\s+information|private\\s+details)\\b.*\\b(share|give|tell)\\b");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{4,}");

    private SafetyRules() {}

    public static List<SafetyRule> builtIn(int maxMessageLength) {
        List<SafetyRule> rules = new ArrayList<>();
        rules.add(SafetyRule.anyPattern(10, SafetyReason.SELF_HARM, Severity.CRITICAL,
                "\\b(kill\\s+myself|hurt\\s+myself|end\\s+my\\s+life|suicide|suicidal|want\\s+to\\s+die|better\\s+off\\s+dead|self\\s*-?harm|cut\\s+myself|harm\\s+myself|take\\s+my\\s+life)\\b",
                "\\b(planning\\s+to\\s+die|going\\s+to\\s+kill\\s+myself|ending\\s+it\\s+all|not\\s+worth\\s+living|no\\s+reason\\s+to\\s+live)\\b",
                "\\b(overdose|poison\\s+myself|jump\\s+off|hang\\s+myself)\\b",
                "\\b(i\\s+feel|i'm|i\\s+am|feeling|everything\\s+is|life\\s+is)\\s+(so\\s+|really\\s+|completely\\s+)?hopeless\\b"));
        rules.add(new SafetyRule(20, SafetyReason.MESSAGE_TOO_LONG, Severity.MEDIUM,
                t -> t.raw().length() > maxMessageLength));
        rules.add(SafetyRule.anyPattern(30, SafetyReason.VIOLENCE, Severity.HIGH,
                "\\b(kill\\s+someone|hurt\\s+someone|shoot\\s+someone|stab\\s+someone|attack\\s+someone|bomb\\s+someone)\\b",
                "\\b(threaten\\s+to\\s+kill|going\\s+to\\s+shoot|planning\\s+to\\s+hurt|revenge\\s+violence)\\b",
                "\\b(weapon|gun|knife|bomb|explosive|poison)\\b.*\\b(school|teacher|student|classmate)\\b",
                "\\b(violence|fight|beat\\s+up|punch|hit)\\b.*\\b(someone|people|them)\\b"));
        rules.add(SafetyRule.anyPattern(40, SafetyReason.HATE_SPEECH, Severity.HIGH,
                "\\b(hate|despise|loathe)\\b.*\\b(people|group|religion|race|gender|community|minority)\\b",
                "\\b(racist|sexist|homophobic|transphobic|discriminate)\\b",
                "\\b(kill\\s+all|destroy\\s+all|eliminate\\s+all)\\b.*\\b(people|group|race|religion)\\b",
                "\\b(inferior|superior)\\b.*\\b(race|people|group)\\b"));
        rules.add(SafetyRule.anyPattern(50, SafetyReason.DRUGS, Severity.MEDIUM,
                "\\b(buy\\s+drugs|sell\\s+drugs|get\\s+high|smoke\\s+weed|do\\s+drugs)\\b",
                "\\b(marijuana|cocaine|heroin|meth|ecstasy|lsd|pills)\\b.*\\b(buy|sell|use|take)\\b",
                "\\b(drug\\s+dealer|drug\\s+dealing)\\b",
                "\\b(alcohol|beer|wine|drunk|drinking)\\b.*\\b(underage|minor|teen)\\b"));
        rules.add(SafetyRule.anyPattern(60, SafetyReason.SEXUAL_CONTENT, Severity.HIGH,
                "\\b(porn|pornography|nude|naked|sex|sexual)\\b.*\\b(video|photo|image|picture)\\b",
                "\\b(sexting|nude\\s+photo|sexual\\s+content)\\b",
                "\\b(inappropriate\\s+relationship|adult\\s+content)\\b"));
        rules.add(SafetyRule.anyPattern(70, SafetyReason.ACADEMIC_DISHONESTY, Severity.MEDIUM,
                "\\b(cheat\\s+on\\s+(the\\s+|my\\s+)?test|copy\\s+homework|plagiarize|steal\\s+answers)\\b",
                "\\b(essay\\s+service|homework\\s+help\\s+for\\s+money|buy\\s+(an\\s+)?essay)\\b",
                "\\b(cheating\\s+website|test\\s+answers\\s+online)\\b",
                "\\b(help\\s+me\\s+cheat|let\\s+me\\s+cheat|cheat\\s+on\\s+this)\\b"));
        rules.add(new SafetyRule(80, SafetyReason.PERSONAL_DATA, Severity.MEDIUM, SafetyRules::exposesPersonalData));
        rules.add(SafetyRule.anyPattern(90, SafetyReason.HARASSMENT, Severity.HIGH,
                "\\b(bully|harass|intimidate|threaten)\\b.*\\b(someone|student|classmate|him|her|them)\\b",
                "\\b(spread\\s+rumors|gossip\\s+about|make\\s+fun\\s+of)\\b",
                "\\b(exclude|ostracize)\\b.*\\b(someone|student|classmate)\\b"));
        rules.add(new SafetyRule(100, SafetyReason.PROFANITY, Severity.MEDIUM, t -> profanityCount(t.lower()) >= 2));
        rules.add(new SafetyRule(110, SafetyReason.SPAM, Severity.LOW,
                t -> t.lower().length() > 20 && Arrays.stream(t.lower().split("\\s+")).distinct().count() < 3));
        rules.add(SafetyRule.anyPattern(120, SafetyReason.OFF_TOPIC, Severity.MEDIUM,
                "\\b(gambling|casino|betting|lottery)\\b",
                "\\b(illegal\\s+activities|criminal\\s+behavior)\\b",
                "\\b(mature\\s+content)\\b"));
        rules.add(new SafetyRule(130, SafetyReason.SUSPICIOUS_PATTERN, Severity.LOW, SafetyRules::suspicious));
        return rules;
    }

    static int profanityCount(String lower) {
        return (int) PROFANITY.stream().filter(p -> p.matcher(lower).find()).count();
    }

    private static boolean exposesPersonalData(SafetyRule.TurnText t) {
        String s = t.lower();
        if (EMAIL.matcher(s).find() || SSN.matcher(s).find() || PHONE.matcher(s).find()) return true;
        return SHARED_DETAIL.matcher(s).find() || PERSONAL_INFO_REQUEST.matcher(s).find();
    }

    private static boolean suspicious(SafetyRule.TurnText t) {
        String raw = t.raw();
        if (raw.chars().filter(c -> c == '?').count() > 5) return true;
        boolean hasLetters = raw.chars().anyMatch(Character::isLetter);
        if (raw.length() > 10 && hasLetters && raw.equals(raw.toUpperCase(Locale.ROOT))) return true;
        return REPEATED_CHAR.matcher(raw).find();
    }
}
