package com.flagship.savings_loan.member;

import com.flagship.savings_loan.member.dto.MemberResponse;
import com.flagship.savings_loan.member.dto.MemberSummaryResponse;
import com.flagship.savings_loan.member.dto.RegisterMemberRequest;
import com.flagship.savings_loan.savings.SavingsPolicy;
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
import java.util.UUID;

@RestController
@RequestMapping("/api/members")
@RequiredArgsConstructor
@Slf4j
public class MemberController {

    private final MemberService memberService;
    private final SavingsPolicy savingsPolicy;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<MemberResponse> register(@Valid @RequestBody RegisterMemberRequest request) {
        LocalDate joined = request.getAsOf() != null ? request.getAsOf() : LocalDate.now(clock);
        log.info("Received member registration: memberNumber={}", request.getMemberNumber());

        Member member = memberService.registerMember(request.getMemberNumber(), request.getFullName(), joined);
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(member));
    }

    @GetMapping("/{memberId}")
    public MemberResponse getMember(@PathVariable("memberId") UUID memberId) {
        return MemberResponse.from(memberService.getMember(memberId));
    }

    @GetMapping("/{memberId}/summary")
    public MemberSummaryResponse getSummary(
            @PathVariable("memberId") UUID memberId,
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        return MemberSummaryResponse.from(memberService.summarize(memberId, date), savingsPolicy.getMonthlySubscription());
    }
}
