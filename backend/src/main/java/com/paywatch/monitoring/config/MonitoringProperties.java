package com.paywatch.monitoring.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Payment monitoring config. The poll interval is a tuning knob: shorter detects payments sooner,
 * longer puts less load on the RPC providers.
 */
@ConfigurationProperties(prefix = "paywatch.monitoring")
@NoArgsConstructor
@Getter
@Setter
public class MonitoringProperties {

    /** Fixed delay between two polls of one request. The first poll runs one interval after start. */
    private Duration pollInterval = Duration.ofSeconds(20);

    /** Threads of the monitoring scheduler shared by all tasks. */
    private int poolSize = 4;

    /** Consecutive oracle failures after which each further failure is logged as persistent. */
    private int errorWarnThreshold = 5;

    /** Attempts per critical write (status transition, transaction record) within one poll. */
    private int criticalWriteAttempts = 2;

    /** Base backoff between critical write attempts. */
    private long criticalWriteBaseDelayMs = 200;

    /** How often (ms) overdue PENDING requests are swept to EXPIRED. Default 5 min. */
    private long sweepIntervalMs = 300_000;
}
