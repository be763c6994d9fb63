package com.flagship.savings_loan.loan;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Computes loan due dates for a fixed due day of the month.
 *
 * A reference date on or before the due day falls due in its own month, any later
 * date falls due in the following month. The calculator is stateless apart from the
 * due day and is shared between issuance, overdue processing and repayment.
 */
public final class DueDateCalculator {

    private final int dueDayOfMonth;

    public DueDateCalculator(int dueDayOfMonth) {
        // 28 is the last day every month has
        if (dueDayOfMonth < 1 || dueDayOfMonth > 28) {
            throw new IllegalArgumentException("Due day of month must be between 1 and 28, got " + dueDayOfMonth);
        }
        this.dueDayOfMonth = dueDayOfMonth;
    }

    public int getDueDayOfMonth() {
        return dueDayOfMonth;
    }

    /**
     * Returns the first due date on or after {@code referenceDate}.
     */
    public LocalDate nextDueDate(LocalDate referenceDate) {
        LocalDate inSameMonth = referenceDate.withDayOfMonth(dueDayOfMonth);
        if (referenceDate.getDayOfMonth() <= dueDayOfMonth) {
            return inSameMonth;
        }
        return inSameMonth.plusMonths(1);
    }

    /**
     * Counts the due dates that have passed without payment between a loan's
     * current due date and {@code asOfDate}.
     *
     * A due date counts once {@code asOfDate} is strictly after it, so a payment made
     * on the due day itself is never late. The current due date counts as the first
     * boundary. Returns 0 when {@code asOfDate} is not after {@code dueDate}, and at
     * least 1 otherwise.
     *
     * @param dueDate  the loan's current next due date
     * @param asOfDate the date the loan is being assessed on
     */
    public int dueDatesElapsed(LocalDate dueDate, LocalDate asOfDate) {
        if (!asOfDate.isAfter(dueDate)) {
            return 0;
        }
        LocalDate firstBoundary = nextDueDate(dueDate);
        LocalDate lastBoundary = asOfDate.getDayOfMonth() > dueDayOfMonth
            ? asOfDate.withDayOfMonth(dueDayOfMonth)
            : asOfDate.withDayOfMonth(dueDayOfMonth).minusMonths(1);

        if (lastBoundary.isBefore(firstBoundary)) {
            return 1;
        }
        long months = ChronoUnit.MONTHS.between(YearMonth.from(firstBoundary), YearMonth.from(lastBoundary));
        return Math.toIntExact(months + 1);
    }
}
