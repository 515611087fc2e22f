package com.paywatch.oracle.rpc;

import com.paywatch.common.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

    @Test
    void roundRobin() {
        RpcEndpointRotator r = new RpcEndpointRotator(List.of("a", "b", "c"), 0, clock);
        assertThat(r.getNextEndpoint()).isEqualTo("a");
        assertThat(r.getNextEndpoint()).isEqualTo("b");
        assertThat(r.getNextEndpoint()).isEqualTo("c");
        assertThat(r.getNextEndpoint()).isEqualTo("a");
    }

    @Test
    void failedEndpointSkippedUntilCooldownEnds() {
        RpcEndpointRotator r = new RpcEndpointRotator(List.of("a", "b"), 30_000, clock);
        r.markFailed("a");

        assertThat(r.isCoolingDown("a")).isTrue();
        assertThat(r.getNextEndpoint()).isEqualTo("b");
        assertThat(r.getNextEndpoint()).isEqualTo("b");

        clock.advance(Duration.ofSeconds(31));
        assertThat(r.isCoolingDown("a")).isFalse();
        assertThat(List.of(r.getNextEndpoint(), r.getNextEndpoint())).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void allCoolingDown_stillReturnsAnEndpoint() {
        RpcEndpointRotator r = new RpcEndpointRotator(List.of("only"), 30_000, clock);
        r.markFailed("only");
        assertThat(r.getNextEndpoint()).isEqualTo("only");
    }

    @Test
    void emptyEndpoints_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of(), 0, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint required");
    }
}
