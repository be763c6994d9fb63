package com.flagship.savings_loan.observability;

import com.flagship.savings_loan.overdue.DashboardSummary;
import com.flagship.savings_loan.overdue.PortfolioService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics for loan and savings operations.
 *
 * Metrics exposed:
 * - loans.issued: loans created
 * - loans.repayments: repayments, tagged by outcome
 * - loans.closed: loans settled in full
 * - loans.overdue.charges: overdue periods charged
 * - loans.overdue.interest: distribution of interest charged per assessment
 * - savings.payments: savings payments, tagged by kind
 * - ledger.operation.latency: operation latency, tagged by operation
 * - overdue.batch.duration: duration of a batch sweep
 * - loans.active, loans.overdue, loans.outstanding.balance, members.total,
 *   savings.balance.total: portfolio gauges, reloaded with the outbox gauges
 *   by {@link #refreshGauges()}
 */
@Component
@Slf4j
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final PortfolioService portfolioService;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    private final AtomicLong activeLoans = new AtomicLong();
    private final AtomicLong overdueLoans = new AtomicLong();
    private final AtomicLong totalMembers = new AtomicLong();
    private final AtomicReference<BigDecimal> outstandingBalance = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> totalSavings = new AtomicReference<>(BigDecimal.ZERO);

    private final Counter loansIssued;
    private final Counter loansClosed;
    private final Counter overdueCharges;
    private final DistributionSummary overdueInterest;
    private final Timer batchTimer;

    public LedgerMetrics(MeterRegistry registry, PortfolioService portfolioService,
                         OutboxMetrics outboxMetrics, Clock clock) {
        this.registry = registry;
        this.portfolioService = portfolioService;
        this.outboxMetrics = outboxMetrics;
        this.clock = clock;

        this.loansIssued = Counter.builder("loans.issued")
                .description("Number of loans issued")
                .register(registry);

        this.loansClosed = Counter.builder("loans.closed")
                .description("Number of loans repaid in full")
                .register(registry);

        this.overdueCharges = Counter.builder("loans.overdue.charges")
                .description("Number of overdue periods charged")
                .register(registry);

        this.overdueInterest = DistributionSummary.builder("loans.overdue.interest")
                .description("Overdue interest charged per assessment")
                .baseUnit("currency")
                .register(registry);

        this.batchTimer = Timer.builder("overdue.batch.duration")
                .description("Time taken by an overdue batch sweep")
                .register(registry);

        Gauge.builder("loans.active", activeLoans, AtomicLong::get)
                .description("Loans with an outstanding balance")
                .register(registry);
        Gauge.builder("loans.overdue", overdueLoans, AtomicLong::get)
                .description("Active loans whose due date has passed")
                .register(registry);
        Gauge.builder("loans.outstanding.balance", outstandingBalance, ref -> ref.get().doubleValue())
                .description("Sum of the balances of active loans")
                .baseUnit("currency")
                .register(registry);
        Gauge.builder("members.total", totalMembers, AtomicLong::get)
                .description("Registered members")
                .register(registry);
        Gauge.builder("savings.balance.total", totalSavings, ref -> ref.get().doubleValue())
                .description("Sum of member savings balances")
                .baseUnit("currency")
                .register(registry);
    }

    /**
     * Reloads the portfolio and outbox gauges from the database. A failure in
     * one group is logged and does not stop the other.
     */
    @Scheduled(fixedRateString = "${metrics.refresh.interval-ms:15000}",
               initialDelayString = "${metrics.refresh.initial-delay-ms:5000}")
    public void refreshGauges() {
        try {
            updatePortfolio(portfolioService.summarize(LocalDate.now(clock)));
        } catch (RuntimeException e) {
            log.warn("Failed to refresh portfolio gauges: {}", e.getMessage());
        }
        try {
            outboxMetrics.refresh();
        } catch (RuntimeException e) {
            log.warn("Failed to refresh outbox gauges: {}", e.getMessage());
        }
    }

    void updatePortfolio(DashboardSummary summary) {
        activeLoans.set(summary.getActiveLoans());
        overdueLoans.set(summary.getOverdueLoans());
        totalMembers.set(summary.getTotalMembers());
        outstandingBalance.set(summary.getOutstandingLoanBalance().getAmount());
        totalSavings.set(summary.getTotalSavings().getAmount());
    }

    public void recordLoanIssued() {
        loansIssued.increment();
    }

    public void recordLoanClosed() {
        loansClosed.increment();
    }

    public void recordOverdueInterest(int periods, BigDecimal totalCharged) {
        overdueCharges.increment(periods);
        overdueInterest.record(totalCharged.doubleValue());
    }

    public void recordRepayment(String outcome) {
        registry.counter("loans.repayments", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSavingsPayment(String kind) {
        registry.counter("savings.payments", "kind", sanitizeTag(kind)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
