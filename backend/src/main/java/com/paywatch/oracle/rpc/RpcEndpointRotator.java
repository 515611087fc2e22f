package com.paywatch.oracle.rpc;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection that skips endpoints cooling down after a failure.
 * When every endpoint is cooling down the next one in order is returned anyway.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final long cooldownMs;
    private final Clock clock;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public RpcEndpointRotator(List<String> endpoints, long cooldownMs, Clock clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.cooldownMs = Math.max(0L, cooldownMs);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Next available endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        long now = clock.millis();
        String fallback = null;
        for (int attempt = 0; attempt < endpoints.size(); attempt++) {
            String candidate = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            if (fallback == null) {
                fallback = candidate;
            }
            Long until = cooldownUntilMs.get(candidate);
            if (until == null || until <= now) {
                return candidate;
            }
        }
        return fallback;
    }

    /** Skip {@code endpoint} for the configured cooldown. */
    public void markFailed(String endpoint) {
        if (cooldownMs > 0 && endpoints.contains(endpoint)) {
            cooldownUntilMs.put(endpoint, clock.millis() + cooldownMs);
        }
    }

    public boolean isCoolingDown(String endpoint) {
        Long until = cooldownUntilMs.get(endpoint);
        return until != null && until > clock.millis();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
