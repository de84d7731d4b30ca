package com.herzen.tutor.ratelimit;

import com.herzen.tutor.config.TutorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
@Slf4j
public class RateLimiter {
    private final RateWindowStore store;
    private final TutorProperties.RateLimit props;
    private final Clock clock;

    public RateLimiter(RateWindowStore store, TutorProperties properties, Clock clock) {
        this.store = store;
        this.props = properties.getRateLimit();
        this.clock = clock;
    }

    public boolean admit(String studentId) {
        boolean admitted = store.tryAcquire(studentId, clock.instant(), props.getWindow(), props.getMaxRequests());
        if (!admitted) {
            log.warn("Rate limit hit [studentId={}, max={}, window={}]", studentId, props.getMaxRequests(), props.getWindow());
        }
        return admitted;
    }

    public void release(String studentId) {
        store.releaseLatest(studentId);
    }

    public Duration retryAfter(String studentId) {
        return store.retryAfter(studentId, clock.instant(), props.getWindow(), props.getMaxRequests());
    }

    public int remaining(String studentId) {
        return Math.max(props.getMaxRequests() - store.inWindow(studentId, clock.instant(), props.getWindow()), 0);
    }

    @Scheduled(fixedDelayString = "${tutor.rate-limit.idle-eviction-interval-ms:300000}")
    public void evictIdle() {
        int evicted = store.evictIdle(clock.instant(), props.getWindow());
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit windows, {} still tracked", evicted, store.trackedKeys());
        }
    }
}
