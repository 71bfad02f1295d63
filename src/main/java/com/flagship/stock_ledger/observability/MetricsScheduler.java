package com.flagship.stock_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OrphanReferenceMetrics orphanReferenceMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:60000}")
    public void refreshOrphanMetrics() {
        orphanReferenceMetrics.refreshMetrics();
    }
}
