package com.flagship.pawn_ledger.observability;

import com.flagship.pawn_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database query: outbox backlog and
 * vouchers left without entries.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerService ledgerService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            ledgerMetrics.updateUnpostedVouchers(ledgerService.countUnpostedVouchers());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh ledger gauges: {}", e.getMessage());
        }
    }
}
