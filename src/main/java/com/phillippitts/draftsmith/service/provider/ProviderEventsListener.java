package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackEvent;
import com.phillippitts.draftsmith.service.provider.event.ProviderFallbackExhaustedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs fallback outcomes, throttled per backend pair so a failing backend does not flood the log.
 */
@Component
class ProviderEventsListener {
    private static final Logger LOG = LogManager.getLogger(ProviderEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onFallback(ProviderFallbackEvent e) {
        if (shouldLog("fallback-" + e.requested() + '-' + e.servedBy())) {
            LOG.warn("Provider fallback: requested={}, servedBy={}, failedAttempts={}",
                    e.requested(), e.servedBy(), e.failedAttempts());
        }
    }

    @EventListener
    void onExhausted(ProviderFallbackExhaustedEvent e) {
        if (shouldLog("exhausted-" + e.requested())) {
            LOG.error("All providers failed: requested={}, attempts={}, lastFault={}",
                    e.requested(), e.attempts(), e.lastFaultCode());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
