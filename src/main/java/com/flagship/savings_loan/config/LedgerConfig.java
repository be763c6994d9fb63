package com.flagship.savings_loan.config;

import com.flagship.savings_loan.loan.DueDateCalculator;
import com.flagship.savings_loan.loan.LoanPolicy;
import com.flagship.savings_loan.money.Money;
import com.flagship.savings_loan.savings.SavingsPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Scheme rules and the business clock.
 *
 * Rates and amounts come from configuration; the defaults are the scheme's
 * standard terms (20% flat interest, 20% monthly overdue compounding, due on the 5th).
 */
@Configuration
@EnableScheduling
@Slf4j
public class LedgerConfig {

    @Bean
    public LoanPolicy loanPolicy(
            @Value("${loan.interest-rate:0.20}") BigDecimal interestRate,
            @Value("${loan.overdue-interest-rate:0.20}") BigDecimal overdueInterestRate,
            @Value("${loan.due-day-of-month:5}") int dueDayOfMonth) {
        LoanPolicy policy = new LoanPolicy(interestRate, overdueInterestRate, dueDayOfMonth);
        log.info("Loan policy: interestRate={}, overdueInterestRate={}, dueDay={}",
            interestRate, overdueInterestRate, dueDayOfMonth);
        return policy;
    }

    @Bean
    public DueDateCalculator dueDateCalculator(LoanPolicy loanPolicy) {
        return loanPolicy.dueDateCalculator();
    }

    @Bean
    public SavingsPolicy savingsPolicy(
            @Value("${savings.initial-deposit:1000.00}") BigDecimal initialDeposit,
            @Value("${savings.monthly-subscription:500.00}") BigDecimal monthlySubscription) {
        return new SavingsPolicy(Money.of(initialDeposit), Money.of(monthlySubscription));
    }

    @Bean
    public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
