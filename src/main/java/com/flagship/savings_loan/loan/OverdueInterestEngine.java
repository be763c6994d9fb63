package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.ledger.LoanTransaction;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compounds overdue interest on a loan.
 *
 * For every due date crossed without payment, charges the overdue rate on the
 * balance as it stands after the previous period's charge, then moves the due date
 * to the next one on or after the as-of date. Because the due date ends up on or
 * after the as-of date, assessing the result again for the same date charges nothing.
 *
 * Pure: the caller persists the returned loan and ledger entries.
 */
@Component
public class OverdueInterestEngine {

    private final LoanPolicy policy;
    private final DueDateCalculator dueDates;

    public OverdueInterestEngine(LoanPolicy policy, DueDateCalculator dueDates) {
        this.policy = policy;
        this.dueDates = dueDates;
    }

    /**
     * @throws com.flagship.savings_loan.exception.ValidationException if a period's
     *         charge would take the balance past {@link com.flagship.savings_loan.money.Money#MAX}
     */
    public OverdueAssessment assess(Loan loan, LocalDate asOfDate) {
        if (!loan.isOverdueOn(asOfDate)) {
            return OverdueAssessment.notOverdue(loan);
        }

        int periods = dueDates.dueDatesElapsed(loan.getNextDueDate(), asOfDate);
        List<OverdueCharge> charges = new ArrayList<>(periods);
        List<LoanTransaction> entries = new ArrayList<>(periods);

        Loan current = loan;
        for (int period = 1; period <= periods; period++) {
            var charge = current.getCurrentBalance().times(policy.getOverdueInterestRate());
            current = current.accrueOverdueInterest(charge);
            charges.add(new OverdueCharge(period, charge, current.getCurrentBalance()));
            entries.add(LoanTransaction.overdueInterest(loan.getId(), charge, period, asOfDate));
        }

        current = current.rescheduleTo(dueDates.nextDueDate(asOfDate));
        return new OverdueAssessment(current,
            Collections.unmodifiableList(charges),
            Collections.unmodifiableList(entries));
    }
}
