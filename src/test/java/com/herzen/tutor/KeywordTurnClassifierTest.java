package com.herzen.tutor;

import com.herzen.tutor.classification.KeywordTurnClassifier;
import com.herzen.tutor.config.TutorProperties;
import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.QuestionType;
import com.herzen.tutor.domain.DomainModels.Sentiment;
import com.herzen.tutor.domain.DomainModels.TurnRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeywordTurnClassifierTest {
    private final KeywordTurnClassifier classifier = new KeywordTurnClassifier(new TutorProperties());

    @Test
    void emptyTextIsNeutralAndGeneral() {
        Labels labels = classifier.classify("", TurnRole.STUDENT);
        assertEquals(Sentiment.NEUTRAL, labels.sentiment());
        assertEquals(KeywordTurnClassifier.GENERAL_TOPIC, labels.topic());
        assertEquals(QuestionType.OTHER, labels.questionType());
        assertFalse(labels.degraded());

        Labels blank = classifier.classify("   \n\t ", TurnRole.STUDENT);
        assertEquals(Sentiment.NEUTRAL, blank.sentiment());
        assertEquals(KeywordTurnClassifier.GENERAL_TOPIC, blank.topic());
    }

    @Test
    void assignsTopicFromKeywords() {
        assertEquals("math", classifier.classify("Can you help me with this algebra equation?", TurnRole.STUDENT).topic());
        assertEquals("science", classifier.classify("How does photosynthesis work in a plant cell?", TurnRole.STUDENT).topic());
        assertEquals("general", classifier.classify("Hello there", TurnRole.STUDENT).topic());
    }

    @Test
    void classifiesSentimentWithNegation() {
        assertEquals(Sentiment.POSITIVE, classifier.classify("This is awesome, thanks!", TurnRole.STUDENT).sentiment());
        assertEquals(Sentiment.NEGATIVE, classifier.classify("I am so confused and frustrated", TurnRole.STUDENT).sentiment());
        assertEquals(Sentiment.NEGATIVE, classifier.classify("I am not happy with this", TurnRole.STUDENT).sentiment());
        assertEquals(Sentiment.NEUTRAL, classifier.classify("The lesson starts at noon", TurnRole.STUDENT).sentiment());
    }

    @Test
    void classifiesQuestionTypeForStudentTurnsOnly() {
        assertEquals(QuestionType.FACTUAL, classifier.classify("When did World War 2 end?", TurnRole.STUDENT).questionType());
        assertEquals(QuestionType.OPEN_ENDED, classifier.classify("Why is the sky blue?", TurnRole.STUDENT).questionType());
        assertEquals(QuestionType.OPEN_ENDED, classifier.classify("Explain how volcanoes form.", TurnRole.STUDENT).questionType());
        assertEquals(QuestionType.OTHER, classifier.classify("I finished my homework.", TurnRole.STUDENT).questionType());
        assertNull(classifier.classify("Why do you think that is?", TurnRole.TUTOR).questionType());
    }

    @Test
    void isDeterministic() {
        String text = "I love coding in python but debugging this loop is hard. What is a function?";
        assertEquals(classifier.classify(text, TurnRole.STUDENT), classifier.classify(text, TurnRole.STUDENT));
    }

    @Test
    void usesConfiguredVocabularyAndThreshold() {
        TutorProperties properties = new TutorProperties();
        properties.getClassification().setTopics(Map.of("astronomy", List.of("star", "galaxy", "telescope")));
        properties.getClassification().setVersion("custom-v2");
        KeywordTurnClassifier custom = new KeywordTurnClassifier(properties);

        Labels labels = custom.classify("I looked at a galaxy through my telescope", TurnRole.STUDENT);
        assertEquals("astronomy", labels.topic());
        assertEquals("custom-v2", labels.classifierVersion());
        assertEquals("general", custom.classify("algebra equation", TurnRole.STUDENT).topic());
    }
}
