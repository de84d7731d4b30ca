package com.herzen.tutor.config;

import com.herzen.tutor.domain.DomainModels.SafetyReason;
import com.herzen.tutor.domain.DomainModels.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@ConfigurationProperties(prefix = "tutor")
@Data
public class TutorProperties {

    private Access access = new Access();
    private RateLimit rateLimit = new RateLimit();
    private Classification classification = new Classification();
    private Moderation moderation = new Moderation();
    private Analytics analytics = new Analytics();

    @Data
    public static class Access {
        /** HS256 secret shared with the learning platform's token issuer */
        private String jwtSecret = "";
        private String adminEmails = "";
        private Duration clockSkew = Duration.ofSeconds(30);
        private Duration maxTokenAge = Duration.ofHours(24);
        private Duration verificationCacheTtl = Duration.ofSeconds(60);
        private long verificationCacheSize = 10_000;
        private long revocationCacheSize = 100_000;

        public Set<String> getAdminEmailSet() {
            if (adminEmails == null || adminEmails.isBlank()) return Set.of();
            return Arrays.stream(adminEmails.split(","))
                    .map(s -> s.trim().toLowerCase(Locale.ROOT))
                    .filter(s -> !s.isBlank())
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(60);
        private int maxRequests = 5;
        // applies to tutor turns posted by admin callers; student callers are always counted
        private boolean countTutorTurns = false;
        private long idleEvictionIntervalMs = 300_000;
    }

    @Data
    public static class Classification {
        private String version = "keyword-v1";
        /** Share of keyword hits the best topic must hold, otherwise "general" */
        private double confidenceThreshold = 0.4;
        // iteration order breaks ties
        private Map<String, List<String>> topics = new LinkedHashMap<>();
        private List<String> positiveWords = new ArrayList<>();
        private List<String> negativeWords = new ArrayList<>();
    }

    @Data
    public static class Moderation {
        private int maxMessageLength = 2000;
        /** Lowest severity that triggers the alert listeners */
        private Severity alertSeverity = Severity.HIGH;
        private List<CustomRule> customRules = new ArrayList<>();

        @Data
        public static class CustomRule {
            private SafetyReason reason = SafetyReason.CUSTOM;
            private Severity severity = Severity.MEDIUM;
            private String pattern;
            private int priority = 1000;
        }
    }

    @Data
    public static class Analytics {
        private Duration window = Duration.ofHours(1);
        private int lookbackWindows = 2;
        private long fixedDelayMs = 300_000;
        private boolean perStudentRollups = true;
    }
}
