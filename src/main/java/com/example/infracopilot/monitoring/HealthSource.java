package com.example.infracopilot.monitoring;

/**
 * Contract shared by every health source adapter.
 *
 * Implementations never throw across this boundary: missing configuration,
 * authentication failures, timeouts and connection errors are captured in the
 * returned snapshot.
 *
 * @param <C> what the adapter needs to know to run one check
 * @param <S> the snapshot it produces
 */
public interface HealthSource<C, S> {

    S check(C context);
}
