package com.phillippitts.draftsmith.service.health;

import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for registered text-generation backends.
 *
 * <ul>
 *   <li>UP: every registered backend is configured</li>
 *   <li>DEGRADED: at least one backend is configured</li>
 *   <li>DOWN: no backend is configured, or none is registered</li>
 * </ul>
 *
 * <p>Exposed via the /actuator/health endpoint.
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderHub hub;

    public ProviderHealthIndicator(ProviderHub hub) {
        this.hub = hub;
    }

    @Override
    public Health health() {
        List<BackendKind> registered = hub.registeredProviders();
        long configured = registered.stream().filter(hub::isConfigured).count();

        Health.Builder builder = new Health.Builder();
        if (!registered.isEmpty() && configured == registered.size()) {
            builder.up().withDetail("status", "All providers configured");
        } else if (configured > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        } else {
            builder.down().withDetail("status", "No providers available");
        }
        for (BackendKind key : registered) {
            builder.withDetail(key.key(), hub.isConfigured(key) ? "configured" : "not-configured");
        }
        return builder.build();
    }
}
