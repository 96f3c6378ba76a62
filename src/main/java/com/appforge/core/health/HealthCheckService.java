package com.appforge.core.health;

import com.appforge.core.persistence.CheckpointStore;
import com.appforge.core.provider.ProviderHealth;
import com.appforge.core.provider.ProviderHealthRegistry;
import com.appforge.core.resilience.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the checkpoint store and every registered provider circuit.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProviderHealthRegistry providerHealth;
    private final CheckpointStore checkpointStore;

    public HealthCheckService(ProviderHealthRegistry providerHealth, CheckpointStore checkpointStore) {
        this.providerHealth = providerHealth;
        this.checkpointStore = checkpointStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCheckpointStore());
        results.add(checkProviders());
        for (ProviderHealth.Snapshot snapshot : providerHealth.snapshots()) {
            results.add(checkProvider(snapshot));
        }
        return results;
    }

    private HealthStatus checkCheckpointStore() {
        String storeType = checkpointStore.getClass().getSimpleName();
        try {
            if (checkpointStore.isAvailable()) {
                return new HealthStatus("checkpoints", HealthStatus.Status.UP,
                        "Checkpoint store reachable", Map.of("store", storeType));
            }
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Checkpoint store unreachable", Map.of("store", storeType));
        } catch (RuntimeException e) {
            log.warn("Checkpoint store health check failed: {}", e.getMessage());
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Checkpoint store error: " + e.getMessage(), Map.of("store", storeType));
        }
    }

    private HealthStatus checkProviders() {
        List<ProviderHealth.Snapshot> snapshots = providerHealth.snapshots();
        if (snapshots.isEmpty()) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No LLM providers registered", Map.of());
        }
        long closed = snapshots.stream().filter(s -> s.circuitState() == CircuitState.CLOSED).count();
        if (closed == snapshots.size()) {
            return new HealthStatus("providers", HealthStatus.Status.UP,
                    snapshots.size() + " provider(s) available", Map.of());
        }
        if (closed == 0) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No provider circuit is closed", Map.of());
        }
        return new HealthStatus("providers", HealthStatus.Status.DEGRADED,
                closed + " of " + snapshots.size() + " provider circuits closed", Map.of());
    }

    private HealthStatus checkProvider(ProviderHealth.Snapshot snapshot) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("circuit", snapshot.circuitState().name());
        metadata.put("failureRate", String.format("%.1f%%", snapshot.failureRate()));
        metadata.put("consecutiveFailures", String.valueOf(snapshot.consecutiveFailures()));
        metadata.put("calls", String.valueOf(snapshot.totalCalls()));
        metadata.put("avgLatencyMs", String.format("%.0f", snapshot.averageLatencyMs()));
        metadata.put("remainingBudget", String.valueOf(snapshot.remainingBudget()));

        HealthStatus.Status status = switch (snapshot.circuitState()) {
            case CLOSED -> HealthStatus.Status.UP;
            case HALF_OPEN -> HealthStatus.Status.DEGRADED;
            case OPEN -> HealthStatus.Status.DOWN;
        };
        return new HealthStatus("provider:" + snapshot.provider(), status,
                "Circuit " + snapshot.circuitState().name().toLowerCase(), metadata);
    }
}
