package com.flagship.savings_loan.savings;

import com.flagship.savings_loan.ledger.SavingsTransaction;
import com.flagship.savings_loan.ledger.SavingsTransactionType;
import com.flagship.savings_loan.savings.dto.SavingsPaymentRequest;
import com.flagship.savings_loan.savings.dto.SavingsTransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/members/{memberId}/savings")
@RequiredArgsConstructor
@Slf4j
public class SavingsController {

    private final SavingsService savingsService;
    private final SavingsPolicy savingsPolicy;
    private final Clock clock;

    @PostMapping("/payments")
    public ResponseEntity<SavingsTransactionResponse> recordPayment(
            @PathVariable("memberId") UUID memberId,
            @Valid @RequestBody SavingsPaymentRequest request) {

        SavingsTransactionType kind = request.getKind() != null ? request.getKind() : SavingsTransactionType.SUBSCRIPTION;
        LocalDate asOf = request.getAsOf() != null ? request.getAsOf() : LocalDate.now(clock);

        BigDecimal amount = request.getAmount() != null
            ? request.getAmount()
            : savingsPolicy.getMonthlySubscription().getAmount();

        SavingsTransaction recorded = savingsService.recordSavingsPayment(memberId, amount, kind, asOf);
        return ResponseEntity.status(HttpStatus.CREATED).body(SavingsTransactionResponse.from(recorded));
    }

    @GetMapping("/transactions")
    public List<SavingsTransactionResponse> getTransactions(@PathVariable("memberId") UUID memberId) {
        return savingsService.getSavingsHistory(memberId).stream()
            .map(SavingsTransactionResponse::from)
            .toList();
    }
}
