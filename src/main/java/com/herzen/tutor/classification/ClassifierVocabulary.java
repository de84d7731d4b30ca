package com.herzen.tutor.classification;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ClassifierVocabulary {
    static final Map<String, List<String>> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("math", List.of("math", "algebra", "geometry", "equation", "fraction", "fractions", "multiply",
                "multiplication", "divide", "division", "calculus", "number", "numbers", "percent", "graph", "triangle"));
        TOPICS.put("science", List.of("science", "biology", "chemistry", "physics", "atom", "cell", "cells", "energy",
                "gravity", "photosynthesis", "planet", "planets", "experiment", "molecule", "ecosystem", "evolution"));
        TOPICS.put("language arts", List.of("essay", "grammar", "reading", "writing", "story", "poem", "poetry", "novel",
                "spelling", "vocabulary", "paragraph", "book", "author", "sentence"));
        TOPICS.put("history", List.of("history", "war", "ancient", "civilization", "president", "revolution", "empire",
                "century", "historical", "constitution", "world war"));
        TOPICS.put("coding", List.of("code", "coding", "programming", "python", "java", "javascript", "algorithm",
                "computer", "app", "website", "debug", "function", "loop"));
        TOPICS.put("arts", List.of("art", "drawing", "painting", "music", "song", "guitar", "piano", "design", "dance",
                "theater", "creative"));
        TOPICS.put("career", List.of("career", "job", "jobs", "college", "university", "internship", "resume",
                "profession", "future", "business", "entrepreneur"));
        TOPICS.put("money", List.of("money", "budget", "save", "saving", "savings", "invest", "investing", "bank",
                "spend", "allowance", "earn"));
        TOPICS.put("health", List.of("health", "exercise", "sleep", "nutrition", "food", "sport", "sports", "fitness",
                "stress", "healthy"));
        TOPICS.put("relationships", List.of("friend", "friends", "friendship", "family", "parents", "sibling", "team",
                "teamwork", "kindness", "conflict"));
    }

    static final List<String> POSITIVE = List.of("good", "great", "awesome", "amazing", "love", "like", "happy", "fun",
            "cool", "thanks", "thank", "excited", "interesting", "helpful", "understand", "got it", "nice", "enjoy",
            "glad", "wonderful", "excellent", "yay", "proud");

    static final List<String> NEGATIVE = List.of("bad", "hate", "boring", "sad", "angry", "confused", "confusing",
            "hard", "difficult", "stupid", "annoying", "frustrated", "frustrating", "worried", "scared", "upset",
            "terrible", "awful", "tired", "stuck", "hopeless", "lonely", "ugh");

    static final List<String> NEGATIONS = List.of("not", "no", "never", "don't", "dont", "isn't", "isnt", "wasn't",
            "wasnt", "didn't", "didnt", "can't", "cant");

    private ClassifierVocabulary() {}
}
