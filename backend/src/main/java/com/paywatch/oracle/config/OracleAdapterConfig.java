package com.paywatch.oracle.config;

import com.paywatch.oracle.rpc.JsonRpcClient;
import com.paywatch.oracle.rpc.RpcEndpointRotator;
import com.paywatch.oracle.rpc.WebClientJsonRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wires the JSON-RPC client, one endpoint rotator per configured chain, and the shared RPC rate limiter.
 */
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class OracleAdapterConfig {

    public static final String ROTATORS_BY_CHAIN = "rpcRotatorsByChain";
    public static final String ORACLE_RATE_LIMITER = "oracleRpcRateLimiter";

    /** Chains without urls are left out; verifying on them fails with an OracleException. */
    @Bean(name = ROTATORS_BY_CHAIN)
    public Map<String, RpcEndpointRotator> rpcRotatorsByChain(OracleProperties properties, Clock clock) {
        return properties.getChains().entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().getUrls().isEmpty())
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> new RpcEndpointRotator(e.getValue().getUrls(), properties.getEndpointCooldownMs(), clock)));
    }

    @Bean
    public JsonRpcClient jsonRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientJsonRpcClient(webClientBuilder);
    }

    @Bean(name = ORACLE_RATE_LIMITER)
    public RateLimiter oracleRpcRateLimiter(OracleProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("oracle-rpc", config);
    }
}
