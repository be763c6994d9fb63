package com.flagship.savings_loan.loan;

import com.flagship.savings_loan.loan.dto.ApplyOverdueRequest;
import com.flagship.savings_loan.loan.dto.IssueLoanRequest;
import com.flagship.savings_loan.loan.dto.LoanResponse;
import com.flagship.savings_loan.loan.dto.LoanTransactionResponse;
import com.flagship.savings_loan.loan.dto.OverdueChargeResponse;
import com.flagship.savings_loan.loan.dto.OverduePreviewResponse;
import com.flagship.savings_loan.loan.dto.ReconciliationResponse;
import com.flagship.savings_loan.loan.dto.RepayLoanRequest;
import com.flagship.savings_loan.loan.dto.RepaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for loan issuance, repayment and overdue handling.
 *
 * Every operation takes an optional business date ({@code as_of}); when absent
 * the application clock supplies today's date.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    private final LoanService loanService;
    private final Clock clock;

    @PostMapping("/members/{memberId}/loans")
    public ResponseEntity<LoanResponse> issueLoan(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody IssueLoanRequest request) {

        LocalDate asOf = resolve(request.getAsOf());
        log.info("Received loan request: memberId={}, principal={}, asOf={}",
                memberId, request.getPrincipalAmount(), asOf);

        Loan loan = loanService.issueLoan(memberId, request.getPrincipalAmount(), asOf);
        return ResponseEntity.status(HttpStatus.CREATED).body(LoanResponse.from(loan));
    }

    @GetMapping("/members/{memberId}/loans")
    public List<LoanResponse> getLoansForMember(@PathVariable("memberId") UUID memberId) {
        return loanService.getLoansForMember(memberId).stream()
            .map(LoanResponse::from)
            .toList();
    }

    @GetMapping("/loans/{loanId}")
    public LoanResponse getLoan(@PathVariable("loanId") UUID loanId) {
        return LoanResponse.from(loanService.getLoan(loanId));
    }

    @GetMapping("/loans/{loanId}/transactions")
    public List<LoanTransactionResponse> getTransactions(@PathVariable("loanId") UUID loanId) {
        return loanService.getTransactionHistory(loanId).stream()
            .map(LoanTransactionResponse::from)
            .toList();
    }

    @PostMapping("/loans/{loanId}/repayments")
    public RepaymentResponse repay(
            @PathVariable("loanId") UUID loanId,
            @Valid @RequestBody RepayLoanRequest request) {

        LocalDate asOf = resolve(request.getAsOf());
        log.info("Received repayment: loanId={}, amount={}, asOf={}", loanId, request.getAmount(), asOf);
        return RepaymentResponse.from(loanService.repayLoan(loanId, request.getAmount(), asOf));
    }

    @PostMapping("/loans/{loanId}/overdue-interest")
    public List<OverdueChargeResponse> applyOverdueInterest(
            @PathVariable("loanId") UUID loanId,
            @RequestBody(required = false) ApplyOverdueRequest request) {

        LocalDate asOf = resolve(request != null ? request.getAsOf() : null);
        return OverdueChargeResponse.fromAll(loanService.applyOverdueInterest(loanId, asOf));
    }

    @GetMapping("/loans/{loanId}/overdue-preview")
    public OverduePreviewResponse previewOverdueInterest(
            @PathVariable("loanId") UUID loanId,
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        LocalDate date = resolve(asOf);
        return OverduePreviewResponse.from(loanService.previewOverdueInterest(loanId, date), date);
    }

    @GetMapping("/loans/{loanId}/reconciliation")
    public ReconciliationResponse reconcile(@PathVariable("loanId") UUID loanId) {
        return ReconciliationResponse.from(loanService.reconcile(loanId));
    }

    private LocalDate resolve(LocalDate asOf) {
        return asOf != null ? asOf : LocalDate.now(clock);
    }
}
