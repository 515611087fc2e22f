package com.paywatch.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires PENDING requests past {@code expiresAt} that no monitoring task caught
 * (task failed to start, store was down at the expiry poll). Default every 5 min.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExpiredRequestSweepJob {

    private final PaymentRequestLifecycleService lifecycle;

    @Scheduled(fixedDelayString = "${paywatch.monitoring.sweep-interval-ms:300000}",
            initialDelayString = "${paywatch.monitoring.sweep-interval-ms:300000}")
    public void sweep() {
        int expired = lifecycle.expireOverdueRequests();
        if (expired > 0) {
            log.info("Expired request sweep: {} request(s) marked EXPIRED", expired);
        } else {
            log.debug("Expired request sweep: nothing to expire");
        }
    }
}
