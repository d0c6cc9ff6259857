package com.meshgate.core.model;

/**
 * Circuit breaker states.
 * <ul>
 *   <li>CLOSED to OPEN: failure percentage over the rolling window crosses the threshold</li>
 *   <li>OPEN to HALF_OPEN: reset timeout elapsed</li>
 *   <li>HALF_OPEN to CLOSED: probe call succeeded</li>
 *   <li>HALF_OPEN to OPEN: probe call failed</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
