package com.herzen.tutor.support;

import com.herzen.tutor.domain.DomainModels.FlaggedItem;
import com.herzen.tutor.moderation.SafetyAlertListener;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@TestConfiguration
public class TestEngineConfig {
    public static final Instant START = Instant.parse("2030-01-07T09:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START);
    }

    @Bean
    public RecordingAlertListener recordingAlertListener() {
        return new RecordingAlertListener();
    }

    public static class RecordingAlertListener implements SafetyAlertListener {
        private final List<FlaggedItem> alerts = new CopyOnWriteArrayList<>();

        @Override
        public void onFlag(FlaggedItem flag, String messagePreview) {
            alerts.add(flag);
        }

        public List<FlaggedItem> alerts() {
            return alerts;
        }
    }
}
