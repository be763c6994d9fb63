package com.flagship.savings_loan.overdue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Runs the overdue sweep once a day for the application clock's current date.
 */
@Component
@ConditionalOnProperty(name = "overdue.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OverdueSweepScheduler {

    private final OverdueProcessingService processingService;
    private final Clock clock;

    @Scheduled(cron = "${overdue.sweep.cron:0 30 0 * * *}", zone = "${app.time-zone:UTC}")
    public void runDailySweep() {
        LocalDate today = LocalDate.now(clock);
        log.debug("Scheduled overdue sweep triggered for {}", today);
        OverdueBatchReport report = processingService.processAllOverdue(today);
        if (report.getFailures() > 0) {
            log.warn("Scheduled overdue sweep had {} failed loan(s)", report.getFailures());
        }
    }
}
