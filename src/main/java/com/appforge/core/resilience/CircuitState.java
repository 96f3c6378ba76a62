package com.appforge.core.resilience;

/**
 * Circuit state of a provider as seen by the fallback logic.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
