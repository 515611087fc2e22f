package com.paywatch.oracle.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.paywatch.oracle.OracleException;
import com.paywatch.oracle.config.OracleAdapterConfig;
import com.paywatch.oracle.config.OracleProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Single-attempt JSON-RPC call for a chain: picks an endpoint, takes a rate-limiter permit, applies the
 * per-call timeout and unwraps {@code result}. No retries; the monitoring poll interval is the retry loop.
 * <p>
 * A verification makes many calls; it takes a {@link #deadline()} up front and passes it to every call, so the
 * whole verification is bounded by {@code paywatch.oracle.verification-timeout}.
 */
@Component
@Slf4j
public class JsonRpcGateway {

    private final JsonRpcClient client;
    private final Map<String, RpcEndpointRotator> rotatorsByChain;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;
    private final Duration verificationTimeout;

    public JsonRpcGateway(
            JsonRpcClient client,
            @Qualifier(OracleAdapterConfig.ROTATORS_BY_CHAIN) Map<String, RpcEndpointRotator> rotatorsByChain,
            @Qualifier(OracleAdapterConfig.ORACLE_RATE_LIMITER) RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            OracleProperties properties
    ) {
        this.client = client;
        this.rotatorsByChain = rotatorsByChain;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.callTimeout = properties.getCallTimeout();
        this.verificationTimeout = properties.getVerificationTimeout();
    }

    /** {@link System#nanoTime()} value after which calls made for one verification fail. */
    public long deadline() {
        return System.nanoTime() + verificationTimeout.toNanos();
    }

    /**
     * Like {@link #call(String, String, Object)}, with the timeout cut to what is left before {@code deadline}.
     *
     * @throws OracleException also when the deadline has already passed
     */
    public JsonNode call(String chain, String method, Object params, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new OracleException("Verification on " + chain + " exceeded " + verificationTimeout.toMillis()
                    + "ms before " + method);
        }
        Duration timeout = remaining < callTimeout.toNanos() ? Duration.ofNanos(remaining) : callTimeout;
        return doCall(chain, method, params, timeout);
    }

    /**
     * @return the {@code result} node; {@link NullNode} when the node is absent or JSON null
     * @throws OracleException on any transport, timeout, JSON-RPC error or decode failure
     */
    public JsonNode call(String chain, String method, Object params) {
        return doCall(chain, method, params, callTimeout);
    }

    private JsonNode doCall(String chain, String method, Object params, Duration timeout) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chain);
        if (rotator == null) {
            throw new OracleException("No RPC endpoints configured for chain " + chain);
        }
        if (!rateLimiter.acquirePermission()) {
            throw new OracleException("RPC budget exhausted for " + method + " on " + chain);
        }
        String endpoint = rotator.getNextEndpoint();
        String json;
        try {
            json = client.call(endpoint, method, params).timeout(timeout).block();
        } catch (RuntimeException e) {
            rotator.markFailed(endpoint);
            throw new OracleException(method + " on " + endpoint + " failed: " + messageOf(e), e);
        }
        if (json == null || json.isBlank()) {
            throw new OracleException("Empty RPC response for " + method + " from " + endpoint);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new OracleException("Malformed RPC response for " + method + " from " + endpoint, e);
        }
        if (root.hasNonNull("error")) {
            throw new OracleException("RPC error for " + method + ": " + root.get("error"));
        }
        JsonNode result = root.get("result");
        return result != null ? result : NullNode.getInstance();
    }

    private static String messageOf(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
