package com.appforge.core.resilience;

import com.appforge.core.config.AppforgeProperties;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.provider.ProviderHealth;
import com.appforge.core.provider.ProviderHealthRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCircuitBreakerTest {

    private static final Duration COOLDOWN = Duration.ofMillis(200);

    private SimpleMeterRegistry meters;
    private ProviderHealth health;
    private ProviderCircuitBreaker circuit;

    @BeforeEach
    void setUp() {
        var props = new AppforgeProperties.Circuit();
        props.setFailureThreshold(3);
        props.setCooldown(COOLDOWN);
        meters = new SimpleMeterRegistry();
        var registry = new ProviderHealthRegistry(props, Clock.systemUTC(), new AppforgeMetrics(meters));
        health = registry.register("openai", 60);
        circuit = health.circuit();
    }

    private void fail() {
        assertTrue(circuit.tryAcquire());
        circuit.recordFailure(Duration.ofMillis(10), new IOException("connection reset"));
        health.recordFailure(Duration.ofMillis(10));
    }

    private void succeed() {
        assertTrue(circuit.tryAcquire());
        circuit.recordSuccess(Duration.ofMillis(10));
        health.recordSuccess(Duration.ofMillis(10));
    }

    @Test
    @DisplayName("stays closed below the failure threshold")
    void staysClosedBelowThreshold() {
        fail();
        fail();
        assertEquals(CircuitState.CLOSED, circuit.state());
        assertTrue(circuit.isCallable());
        assertEquals(2, health.consecutiveFailures());
    }

    @Test
    @DisplayName("opens after K consecutive failures and rejects the next call")
    void opensAfterThreshold() {
        fail();
        fail();
        fail();

        assertEquals(CircuitState.OPEN, circuit.state());
        assertFalse(circuit.tryAcquire());
        assertFalse(circuit.isCallable());
        assertTrue(circuit.remainingCooldown().compareTo(Duration.ZERO) > 0);
        assertEquals(1.0, meters.find("appforge.circuit.transitions").tag("to", "OPEN").counter().count());
    }

    @Test
    @DisplayName("admits exactly one probe after the cooldown and closes when it succeeds")
    void halfOpenProbeCloses() throws InterruptedException {
        fail();
        fail();
        fail();
        Thread.sleep(COOLDOWN.toMillis() + 100);

        assertTrue(circuit.isCallable());
        assertTrue(circuit.tryAcquire());
        assertEquals(CircuitState.HALF_OPEN, circuit.state());
        assertFalse(circuit.tryAcquire(), "only one probe may be in flight");

        circuit.recordSuccess(Duration.ofMillis(10));
        health.recordSuccess(Duration.ofMillis(10));

        assertEquals(CircuitState.CLOSED, circuit.state());
        assertEquals(0, health.consecutiveFailures());
    }

    @Test
    @DisplayName("a failed probe reopens the circuit")
    void failedProbeReopens() throws InterruptedException {
        fail();
        fail();
        fail();
        Thread.sleep(COOLDOWN.toMillis() + 100);

        assertTrue(circuit.tryAcquire());
        circuit.recordFailure(Duration.ofMillis(10), new IOException("still down"));

        assertEquals(CircuitState.OPEN, circuit.state());
        assertFalse(circuit.tryAcquire());
    }

    @Test
    @DisplayName("released permissions are not counted as calls")
    void releaseDoesNotCount() {
        for (int i = 0; i < 5; i++) {
            assertTrue(circuit.tryAcquire());
            circuit.release();
        }
        assertEquals(CircuitState.CLOSED, circuit.state());
        assertEquals(0f, circuit.failureRate());
    }

    @Test
    @DisplayName("mixed outcomes keep the circuit closed while the rate is below threshold")
    void mixedOutcomes() {
        succeed();
        succeed();
        fail();
        succeed();

        assertEquals(CircuitState.CLOSED, circuit.state());
        assertEquals(25f, circuit.failureRate());
        assertEquals(4, health.totalCalls());
        assertEquals(1, health.totalFailures());
        assertEquals(0, health.consecutiveFailures());
    }

    @Test
    @DisplayName("K consecutive failures open the circuit even after earlier successes in the window")
    void consecutiveFailuresAfterSuccesses() {
        for (int i = 0; i < 5; i++) {
            succeed();
        }
        fail();
        fail();
        assertEquals(CircuitState.CLOSED, circuit.state());

        fail();

        assertEquals(CircuitState.OPEN, circuit.state());
        assertFalse(circuit.tryAcquire());
    }

    @Test
    @DisplayName("a success in between restarts the consecutive count")
    void successResetsConsecutiveCount() {
        for (int i = 0; i < 5; i++) {
            succeed();
        }
        fail();
        fail();
        succeed();
        fail();
        fail();

        assertEquals(CircuitState.CLOSED, circuit.state());
        assertEquals(2, circuit.consecutiveFailures());
    }

    @Test
    @DisplayName("openFor keeps the circuit open for the requested time")
    void openForHonoursDuration() throws InterruptedException {
        circuit.openFor(Duration.ofMillis(600));

        assertEquals(CircuitState.OPEN, circuit.state());
        assertTrue(circuit.remainingCooldown().compareTo(COOLDOWN) > 0);
        Thread.sleep(COOLDOWN.toMillis() + 100);
        assertFalse(circuit.isCallable());
        assertFalse(circuit.tryAcquire());

        Thread.sleep(500);
        assertTrue(circuit.isCallable());
        assertTrue(circuit.tryAcquire());
        assertEquals(CircuitState.HALF_OPEN, circuit.state());
    }

    @Test
    @DisplayName("a shorter openFor does not cut an open period short")
    void openForKeepsLongerPeriod() {
        circuit.openFor(Duration.ofSeconds(5));
        circuit.openFor(Duration.ofMillis(10));

        assertTrue(circuit.remainingCooldown().compareTo(Duration.ofSeconds(4)) > 0);
    }
}
