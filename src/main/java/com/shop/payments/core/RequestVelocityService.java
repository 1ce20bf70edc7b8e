package com.shop.payments.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * How many payment initializations has this user or IP made in the last 60 seconds?
 * Used to reject bursts before any gateway call is made. A limit of 0 disables the check.
 * <p>
 * A key is dropped as soon as its window is empty, and all keys are swept once per window,
 * so memory is bounded by the keys seen in the last 60 seconds.
 */
@Slf4j
@Service
public class RequestVelocityService {

    private static final long WINDOW_MS = 60_000L;

    private final Map<String, CopyOnWriteArrayList<Long>> byUser = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<Long>> byIp = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepAt;

    private final int maxPerUserPer60s;
    private final int maxPerIpPer60s;
    private final Clock clock;

    @Autowired
    public RequestVelocityService(@Value("${shop.payments.velocity.max-per-user-per-60s:0}") int maxPerUserPer60s,
                                  @Value("${shop.payments.velocity.max-per-ip-per-60s:0}") int maxPerIpPer60s) {
        this(maxPerUserPer60s, maxPerIpPer60s, Clock.systemUTC());
    }

    RequestVelocityService(int maxPerUserPer60s, int maxPerIpPer60s, Clock clock) {
        this.maxPerUserPer60s = maxPerUserPer60s;
        this.maxPerIpPer60s = maxPerIpPer60s;
        this.clock = clock;
        this.lastSweepAt = new AtomicLong(clock.millis());
    }

    /**
     * Record this request and return the counts in the current window for the user and IP.
     */
    public VelocitySnapshot recordAndCheck(String userId, String clientIp) {
        long now = clock.millis();
        sweepIfDue(now);
        int userCount = record(byUser, userId, now);
        int ipCount = record(byIp, clientIp, now);

        boolean overThreshold = (maxPerUserPer60s > 0 && userCount > maxPerUserPer60s)
                || (maxPerIpPer60s > 0 && ipCount > maxPerIpPer60s);
        if (overThreshold) {
            log.warn("Velocity check: userId={} userCount={} ip={} ipCount={} (thresholds: user={}, ip={})",
                    userId, userCount, clientIp != null ? "***" : null, ipCount, maxPerUserPer60s, maxPerIpPer60s);
        }
        return new VelocitySnapshot(userCount, ipCount, overThreshold);
    }

    int trackedUserCount() {
        return byUser.size();
    }

    int trackedIpCount() {
        return byIp.size();
    }

    private void sweepIfDue(long now) {
        long last = lastSweepAt.get();
        if (now - last < WINDOW_MS || !lastSweepAt.compareAndSet(last, now)) {
            return;
        }
        long cutoff = now - WINDOW_MS;
        int removed = evictExpired(byUser, cutoff) + evictExpired(byIp, cutoff);
        if (removed > 0) {
            log.debug("Velocity sweep dropped {} idle keys", removed);
        }
    }

    private static int evictExpired(Map<String, CopyOnWriteArrayList<Long>> windows, long cutoff) {
        int before = windows.size();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, list) -> {
                list.removeIf(ts -> ts < cutoff);
                return list.isEmpty() ? null : list;
            });
        }
        return Math.max(0, before - windows.size());
    }

    private static int record(Map<String, CopyOnWriteArrayList<Long>> windows, String key, long now) {
        if (key == null || key.isBlank()) {
            return 0;
        }
        long cutoff = now - WINDOW_MS;
        CopyOnWriteArrayList<Long> list = windows.compute(key, (k, existing) -> {
            CopyOnWriteArrayList<Long> window = existing != null ? existing : new CopyOnWriteArrayList<>();
            window.removeIf(ts -> ts < cutoff);
            window.add(now);
            return window;
        });
        return list.size();
    }

    @lombok.Value
    public static class VelocitySnapshot {
        int userCountLast60s;
        int ipCountLast60s;
        boolean overThreshold;
    }
}
