package com.paywatch.monitoring;

import com.paywatch.domain.PaymentRequest;
import com.paywatch.lifecycle.PaymentRequestLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resumes monitoring after a restart: on application ready, every stored PENDING request gets a task again
 * (or is expired when its window closed while the service was down).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringRecoveryListener {

    private final PaymentRequestLifecycleService lifecycle;
    private final PaymentMonitorScheduler scheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        List<PaymentRequest> requests;
        try {
            requests = lifecycle.listRequests();
        } catch (RuntimeException e) {
            log.error("Could not load payment requests for monitoring recovery", e);
            return;
        }
        long pending = requests.stream().filter(PaymentRequest::isPending).count();
        log.info("Recovering monitoring: {} stored request(s), {} pending", requests.size(), pending);
        scheduler.restoreActive(requests);
    }
}
