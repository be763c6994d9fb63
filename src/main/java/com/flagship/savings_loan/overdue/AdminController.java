package com.flagship.savings_loan.overdue;

import com.flagship.savings_loan.loan.dto.ApplyOverdueRequest;
import com.flagship.savings_loan.overdue.dto.DashboardResponse;
import com.flagship.savings_loan.overdue.dto.OverdueBatchResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Operator endpoints: manual overdue sweep and scheme dashboard.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final OverdueProcessingService processingService;
    private final PortfolioService portfolioService;
    private final Clock clock;

    @PostMapping("/overdue/process")
    public OverdueBatchResponse processOverdue(@RequestBody(required = false) ApplyOverdueRequest request) {
        LocalDate asOf = request != null && request.getAsOf() != null ? request.getAsOf() : LocalDate.now(clock);
        return OverdueBatchResponse.from(processingService.processAllOverdue(asOf));
    }

    @GetMapping("/dashboard")
    public DashboardResponse dashboard(
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return DashboardResponse.from(portfolioService.summarize(asOf != null ? asOf : LocalDate.now(clock)));
    }
}
