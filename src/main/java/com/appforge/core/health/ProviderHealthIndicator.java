package com.appforge.core.health;

import com.appforge.core.provider.ProviderHealth;
import com.appforge.core.provider.ProviderHealthRegistry;
import com.appforge.core.resilience.CircuitState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the LLM providers.
 * <p>
 * UP while every circuit is closed, DEGRADED when some are open or probing, DOWN when
 * none is closed or no provider is registered.
 */
@Component("providersHealthIndicator")
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderHealthRegistry registry;

    public ProviderHealthIndicator(ProviderHealthRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        var snapshots = registry.snapshots();
        if (snapshots.isEmpty()) {
            return Health.down().withDetail("reason", "no providers registered").build();
        }

        var builder = Health.up();
        int closed = 0;
        for (ProviderHealth.Snapshot snapshot : snapshots) {
            if (snapshot.circuitState() == CircuitState.CLOSED) {
                closed++;
            }
            builder.withDetail(snapshot.provider(), snapshot.circuitState().name()
                    + " (failure rate " + String.format("%.1f", snapshot.failureRate()) + "%)");
        }

        if (closed == 0) {
            return builder.status("DOWN").build();
        }
        return closed < snapshots.size() ? builder.status("DEGRADED").build() : builder.build();
    }
}
