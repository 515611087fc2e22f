package com.paywatch.monitoring.config;

import com.paywatch.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Monitoring scheduler (one fixed-delay task per pending request, {@code payment-monitor-} threads) and the retry
 * policy for settlement writes.
 */
@Configuration
@EnableConfigurationProperties(MonitoringProperties.class)
public class MonitoringConfig {

    public static final String MONITORING_SCHEDULER = "monitoring-scheduler";
    public static final String CRITICAL_WRITE_RETRY = "critical-write-retry";

    @Bean(name = MONITORING_SCHEDULER)
    public ThreadPoolTaskScheduler monitoringScheduler(MonitoringProperties properties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(1, properties.getPoolSize()));
        s.setThreadNamePrefix("payment-monitor-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(10);
        s.initialize();
        return s;
    }

    @Bean(name = CRITICAL_WRITE_RETRY)
    public RetryPolicy criticalWriteRetryPolicy(MonitoringProperties properties) {
        return new RetryPolicy(properties.getCriticalWriteBaseDelayMs(), 0.2,
                Math.max(1, properties.getCriticalWriteAttempts()));
    }
}
