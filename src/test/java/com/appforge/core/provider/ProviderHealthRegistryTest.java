package com.appforge.core.provider;

import com.appforge.core.config.AppforgeProperties;
import com.appforge.core.metrics.AppforgeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ProviderHealthRegistryTest {

    private ProviderHealthRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderHealthRegistry(new AppforgeProperties.Circuit(), Clock.systemUTC(),
                new AppforgeMetrics(new SimpleMeterRegistry()));
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("registration order is the priority and listing keeps it")
        void priorityOrder() {
            registry.register("openai", 60);
            registry.register("anthropic", 50);
            registry.register("gemini", 40, 10_000);

            assertEquals(List.of("openai", "anthropic", "gemini"),
                    registry.all().stream().map(ProviderHealth::provider).toList());
            assertEquals(2, registry.get("gemini").priority());
        }

        @Test
        @DisplayName("a provider can be registered once")
        void duplicateRejected() {
            registry.register("openai", 60);
            assertThrows(IllegalArgumentException.class, () -> registry.register("openai", 10));
        }

        @Test
        @DisplayName("unknown providers are reported")
        void unknownProvider() {
            assertTrue(registry.find("openai").isEmpty());
            assertThrows(IllegalArgumentException.class, () -> registry.get("openai"));
        }

        @Test
        @DisplayName("the token budget is optional")
        void tokenBudget() {
            ProviderHealth unlimited = registry.register("openai", 60);
            ProviderHealth limited = registry.register("anthropic", 60, 100);

            assertTrue(unlimited.tryConsumeTokens(1_000_000));
            assertTrue(limited.tryConsumeTokens(60));
            assertFalse(limited.tryConsumeTokens(60));
            assertEquals(Duration.ofMinutes(1), limited.budgetRefreshPeriod());
        }
    }

    @Test
    @DisplayName("readers see a consistent priority list while providers are registered")
    void concurrentReadsDuringRegistration() throws Exception {
        registry.register("provider-0", 60);
        int readers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(readers);
        CountDownLatch started = new CountDownLatch(readers);
        AtomicBoolean done = new AtomicBoolean();
        try {
            List<Future<Integer>> reads = new ArrayList<>();
            for (int r = 0; r < readers; r++) {
                reads.add(pool.submit(() -> {
                    started.countDown();
                    int lookups = 0;
                    do {
                        List<ProviderHealth> all = registry.all();
                        for (int i = 0; i < all.size(); i++) {
                            assertEquals(i, all.get(i).priority());
                            assertSame(all.get(i), registry.get(all.get(i).provider()));
                        }
                        lookups++;
                    } while (!done.get());
                    return lookups;
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 1; i < 50; i++) {
                registry.register("provider-" + i, 60);
            }
            done.set(true);
            for (Future<Integer> read : reads) {
                assertTrue(read.get(5, TimeUnit.SECONDS) > 0);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50, registry.all().size());
    }
}
