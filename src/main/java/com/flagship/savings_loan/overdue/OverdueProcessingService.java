package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.loan.LoanPersistenceService;
import com.flagship.savings_loan.loan.LoanService;
import com.flagship.savings_loan.loan.OverdueCharge;
import com.flagship.savings_loan.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Applies overdue interest to every active loan.
 *
 * Not transactional itself: each loan is assessed in its own transaction via
 * {@link LoanService#applyOverdueInterest}, so one failing loan does not roll back
 * the others. Re-running for the same date charges nothing new.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OverdueProcessingService {

    private final LoanPersistenceService persistenceService;
    private final LoanService loanService;
    private final LedgerMetrics metrics;

    public OverdueBatchReport processAllOverdue(LocalDate asOfDate) {
        Instant start = Instant.now();
        List<UUID> loanIds = persistenceService.findActiveLoanIds();
        log.info("Starting overdue sweep: asOf={}, activeLoans={}", asOfDate, loanIds.size());

        List<LoanOverdueResult> results = new ArrayList<>(loanIds.size());
        for (UUID loanId : loanIds) {
            try {
                List<OverdueCharge> charges = loanService.applyOverdueInterest(loanId, asOfDate);
                results.add(LoanOverdueResult.charged(loanId, charges));
            } catch (RuntimeException e) {
                log.error("Overdue processing failed for loan {}: {}", loanId, e.getMessage(), e);
                results.add(LoanOverdueResult.failed(loanId, e.getMessage()));
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        metrics.recordBatchDuration(duration);
        OverdueBatchReport report = new OverdueBatchReport(asOfDate, List.copyOf(results), duration);

        log.info("Overdue sweep finished: asOf={}, examined={}, charged={}, failed={}, totalInterest={}, duration={}ms",
            asOfDate, report.getLoansExamined(), report.getLoansCharged(), report.getFailures(),
            report.getTotalInterestCharged(), duration.toMillis());
        return report;
    }
}
