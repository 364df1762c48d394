package com.phillippitts.draftsmith.service.provider;

/**
 * Point-in-time copy of a backend's counters.
 *
 * @param averageDurationMs total duration divided by request count, 0 when no requests were made
 */
public record BackendStatistics(BackendKind provider,
                                long requestCount,
                                long successCount,
                                long failureCount,
                                double averageDurationMs,
                                long totalTokensUsed) {
}
