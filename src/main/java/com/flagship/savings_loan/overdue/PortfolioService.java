package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.loan.LoanRepository;
import com.flagship.savings_loan.member.MemberRepository;
import com.flagship.savings_loan.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final MemberRepository memberRepository;
    private final LoanRepository loanRepository;

    /**
     * A loan counts as overdue when its due date lies strictly before {@code asOfDate};
     * paying on the due date itself is on time.
     */
    @Transactional(readOnly = true)
    public DashboardSummary summarize(LocalDate asOfDate) {
        return new DashboardSummary(
            asOfDate,
            memberRepository.count(),
            Money.of(memberRepository.sumSavingsBalance()),
            loanRepository.countByActiveTrue(),
            Money.of(loanRepository.sumOutstandingBalance()),
            loanRepository.countByActiveTrueAndNextDueDateBefore(asOfDate)
        );
    }
}
