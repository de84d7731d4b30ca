package com.herzen.tutor.ratelimit;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed sliding-window log: student id to the timestamps of admitted requests still inside the window.
 *
 * Every read-modify-write runs inside {@link ConcurrentHashMap#compute}, which serialises callers
 * for the same key while leaving other keys uncontended.
 */
@Component
public class RateWindowStore {
    private final ConcurrentHashMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    /**
     * Evicts entries of age {@code >= window}, then records {@code now} if fewer than {@code max}
     * remain. Returns whether the request was admitted.
     */
    public boolean tryAcquire(String key, Instant now, Duration window, int max) {
        boolean[] admitted = new boolean[1];
        windows.compute(key, (k, log) -> {
            Deque<Instant> entries = log == null ? new ArrayDeque<>() : log;
            evict(entries, now, window);
            if (entries.size() < max) {
                entries.addLast(now);
                admitted[0] = true;
            }
            return entries;
        });
        return admitted[0];
    }

    /**
     * Gives back the most recent admission, used when the admitted request could not be persisted.
     */
    public void releaseLatest(String key) {
        windows.computeIfPresent(key, (k, log) -> {
            log.pollLast();
            return log.isEmpty() ? null : log;
        });
    }

    public int inWindow(String key, Instant now, Duration window) {
        int[] count = new int[1];
        windows.computeIfPresent(key, (k, log) -> {
            evict(log, now, window);
            count[0] = log.size();
            return log.isEmpty() ? null : log;
        });
        return count[0];
    }

    /**
     * Time until the oldest in-window admission ages out, or zero when the key has room.
     */
    public Duration retryAfter(String key, Instant now, Duration window, int max) {
        Duration[] wait = {Duration.ZERO};
        windows.computeIfPresent(key, (k, log) -> {
            evict(log, now, window);
            if (log.size() >= max && !log.isEmpty()) {
                wait[0] = Duration.between(now, log.peekFirst().plus(window));
            }
            return log.isEmpty() ? null : log;
        });
        return wait[0];
    }

    public int evictIdle(Instant now, Duration window) {
        int before = windows.size();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, log) -> {
                evict(log, now, window);
                return log.isEmpty() ? null : log;
            });
        }
        return Math.max(before - windows.size(), 0);
    }

    public int trackedKeys() {
        return windows.size();
    }

    private static void evict(Deque<Instant> entries, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!entries.isEmpty() && !entries.peekFirst().isAfter(cutoff)) {
            entries.pollFirst();
        }
    }
}
