package com.paywatch.oracle.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paywatch.oracle.config.OracleProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canned JSON-RPC responses per method. Handlers return the {@code result} JSON; the envelope is added here.
 * Methods without a handler answer with a JSON-RPC error.
 */
public class MockJsonRpcClient implements JsonRpcClient {

    private final Map<String, Function<List<?>, String>> handlers = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final Set<String> hanging = new HashSet<>();
    private Duration latency = Duration.ZERO;

    public MockJsonRpcClient on(String method, String resultJson) {
        handlers.put(method, params -> resultJson);
        return this;
    }

    public MockJsonRpcClient on(String method, Function<List<?>, String> handler) {
        handlers.put(method, handler);
        return this;
    }

    /** Calls to {@code method} never complete. */
    public MockJsonRpcClient hang(String method) {
        hanging.add(method);
        return this;
    }

    /** Every response arrives after {@code latency}. */
    public MockJsonRpcClient latency(Duration latency) {
        this.latency = latency;
        return this;
    }

    public long callCount(String method) {
        synchronized (calls) {
            return calls.stream().filter(method::equals).count();
        }
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        synchronized (calls) {
            calls.add(method);
        }
        if (hanging.contains(method)) {
            return Mono.never();
        }
        Function<List<?>, String> handler = handlers.get(method);
        String body;
        if (handler == null) {
            body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"method not found\"}}";
        } else {
            String result = handler.apply(params instanceof List<?> list ? list : List.of());
            body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + result + "}";
        }
        return latency.isZero() ? Mono.just(body) : Mono.delay(latency).thenReturn(body);
    }

    /** Gateway over this client for every chain in {@code properties}, without rate limiting pressure. */
    public JsonRpcGateway gateway(OracleProperties properties) {
        return gateway(properties, RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(10_000)
                .timeoutDuration(Duration.ZERO)
                .build()));
    }

    public JsonRpcGateway gateway(OracleProperties properties, RateLimiter limiter) {
        Map<String, RpcEndpointRotator> rotators = properties.getChains().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> new RpcEndpointRotator(e.getValue().getUrls(), 0, Clock.systemUTC())));
        return new JsonRpcGateway(this, rotators, limiter, new ObjectMapper(), properties);
    }
}
