package com.phillippitts.draftsmith.service.provider;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-backend request counters owned by the provider hub.
 *
 * <p>Counters are monotonic. Each backend has its own monitor so concurrent executions against
 * the same backend update counters atomically, while different backends never contend.
 */
public class BackendStatisticsStore {

    private final Map<BackendKind, Counters> counters = new ConcurrentHashMap<>();

    /** Ensures counters exist for a backend; existing counters are kept. */
    public void track(BackendKind key) {
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new Counters());
    }

    public void recordRequest(BackendKind key) {
        Counters c = countersFor(key);
        synchronized (c) {
            c.requests++;
        }
    }

    public void recordSuccess(BackendKind key, long durationMs, long tokens) {
        Counters c = countersFor(key);
        synchronized (c) {
            c.successes++;
            c.totalDurationMs += durationMs;
            c.totalTokens += Math.max(0, tokens);
        }
    }

    public void recordFailure(BackendKind key, long durationMs) {
        Counters c = countersFor(key);
        synchronized (c) {
            c.failures++;
            c.totalDurationMs += durationMs;
        }
    }

    /**
     * Snapshot for a backend, or null if it was never tracked.
     */
    public BackendStatistics snapshot(BackendKind key) {
        Counters c = counters.get(key);
        if (c == null) {
            return null;
        }
        synchronized (c) {
            double avg = c.requests > 0 ? (double) c.totalDurationMs / c.requests : 0.0;
            return new BackendStatistics(key, c.requests, c.successes, c.failures, avg, c.totalTokens);
        }
    }

    private Counters countersFor(BackendKind key) {
        return counters.computeIfAbsent(key, k -> new Counters());
    }

    private static final class Counters {
        private long requests;
        private long successes;
        private long failures;
        private long totalDurationMs;
        private long totalTokens;
    }
}
