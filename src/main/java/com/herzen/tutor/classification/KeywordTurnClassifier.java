package com.herzen.tutor.classification;

import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class KeywordTurnClassifier implements TurnClassifier {
    public static final String GENERAL_TOPIC = "general";

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}'\\s]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private static final List<String> OPEN_ENDED_CUES = List.of(
            "why", "how come", "what if", "what do you think", "what would", "how do", "how does", "how can",
            "how could", "how would", "how should", "how is it", "explain", "describe", "should i", "could you explain",
            "can you explain", "tell me about", "what are some ideas", "what happens if");
    private static final List<String> FACTUAL_CUES = List.of(
            "what", "what's", "whats", "when", "where", "who", "whom", "whose", "which", "how many", "how much",
            "how old", "how long", "how far", "is", "are", "was", "were", "do", "does", "did", "can", "define",
            "name", "list");

    private final String version;
    private final double confidenceThreshold;
    private final Map<String, List<String>> topics;
    private final Set<String> positive;
    private final Set<String> negative;
    private final Set<String> negations = Set.copyOf(ClassifierVocabulary.NEGATIONS);

    public KeywordTurnClassifier(TutorProperties properties) {
        TutorProperties.Classification props = properties.getClassification();
        this.version = props.getVersion();
        this.confidenceThreshold = props.getConfidenceThreshold();
        Map<String, List<String>> configured = props.getTopics().isEmpty() ? ClassifierVocabulary.TOPICS : props.getTopics();
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        configured.forEach((topic, words) -> normalized.put(topic.trim().toLowerCase(Locale.ROOT),
                words.stream().map(KeywordTurnClassifier::normalize).filter(w -> !w.isBlank()).distinct().toList()));
        this.topics = normalized;
        this.positive = lexicon(props.getPositiveWords(), ClassifierVocabulary.POSITIVE);
        this.negative = lexicon(props.getNegativeWords(), ClassifierVocabulary.NEGATIVE);
    }

    @Override
    public Labels classify(String text, TurnRole role) {
        String normalized = normalize(text);
        QuestionType questionType = role == TurnRole.STUDENT ? questionType(text) : null;
        return new Labels(topic(normalized), sentiment(normalized), questionType, version, false);
    }

    String topic(String normalized) {
        if (normalized.isBlank()) return GENERAL_TOPIC;
        String padded = " " + normalized + " ";
        String best = null;
        long bestHits = 0;
        long totalHits = 0;
        for (var entry : topics.entrySet()) {
            long hits = entry.getValue().stream().filter(k -> padded.contains(" " + k + " ")).count();
            totalHits += hits;
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        if (best == null || (double) bestHits / totalHits < confidenceThreshold) return GENERAL_TOPIC;
        return best;
    }

    Sentiment sentiment(String normalized) {
        if (normalized.isBlank()) return Sentiment.NEUTRAL;
        String[] tokens = normalized.split(" ");
        int score = 0;
        for (int i = 0; i < tokens.length; i++) {
            int polarity = positive.contains(tokens[i]) ? 1 : negative.contains(tokens[i]) ? -1 : 0;
            if (polarity != 0 && negated(tokens, i)) polarity = -polarity;
            score += polarity;
        }
        String padded = " " + normalized + " ";
        for (String phrase : positive) if (phrase.contains(" ") && padded.contains(" " + phrase + " ")) score++;
        for (String phrase : negative) if (phrase.contains(" ") && padded.contains(" " + phrase + " ")) score--;
        if (score > 0) return Sentiment.POSITIVE;
        if (score < 0) return Sentiment.NEGATIVE;
        return Sentiment.NEUTRAL;
    }

    QuestionType questionType(String raw) {
        if (raw == null || raw.isBlank()) return QuestionType.OTHER;
        // the first cue-bearing sentence decides
        for (String sentence : SENTENCE_END.split(raw.trim())) {
            String s = normalize(sentence);
            if (s.isBlank()) continue;
            boolean asked = sentence.trim().endsWith("?");
            if (startsWithAny(s, OPEN_ENDED_CUES)) return QuestionType.OPEN_ENDED;
            if (asked && startsWithAny(s, FACTUAL_CUES)) return QuestionType.FACTUAL;
            if (s.startsWith("define ") || s.startsWith("what is ") || s.startsWith("who was ")) return QuestionType.FACTUAL;
            if (asked && (" " + s + " ").contains(" why ")) return QuestionType.OPEN_ENDED;
        }
        return QuestionType.OTHER;
    }

    private boolean negated(String[] tokens, int i) {
        for (int j = Math.max(0, i - 2); j < i; j++) {
            if (negations.contains(tokens[j])) return true;
        }
        return false;
    }

    private static boolean startsWithAny(String s, List<String> cues) {
        for (String cue : cues) {
            if (s.equals(cue) || s.startsWith(cue + " ")) return true;
        }
        return false;
    }

    private static Set<String> lexicon(List<String> configured, List<String> defaults) {
        List<String> source = configured == null || configured.isEmpty() ? defaults : configured;
        return source.stream().map(KeywordTurnClassifier::normalize).filter(w -> !w.isBlank()).collect(Collectors.toUnmodifiableSet());
    }

    static String normalize(String text) {
        if (text == null) return "";
        String lower = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        return SPACES.matcher(NON_WORD.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
    }
}
