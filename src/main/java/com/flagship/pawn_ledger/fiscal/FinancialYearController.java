package com.flagship.pawn_ledger.fiscal;

import com.flagship.pawn_ledger.fiscal.dto.ConfirmationRequest;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Year-end endpoints. {@code year} is the calendar year the financial year starts in.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/financial-years/{year}")
@RequiredArgsConstructor
public class FinancialYearController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final FinancialYearService financialYearService;
    private final LedgerMetrics metrics;

    @GetMapping("/closing-readiness")
    public ClosingReadiness closingReadiness(@PathVariable("companyId") UUID companyId,
                                             @PathVariable("year") int year) {
        return financialYearService.closingReadiness(companyId, year);
    }

    @PostMapping("/close")
    public YearEndClosing closeYear(@PathVariable("companyId") UUID companyId,
                                    @PathVariable("year") int year,
                                    @RequestBody ConfirmationRequest request,
                                    @RequestHeader(ACTOR_HEADER) String actor) {
        return metrics.timeApi("close_year",
            () -> financialYearService.closeYear(companyId, year, request.getConfirmation(), actor));
    }

    @PostMapping("/open")
    public YearOpening openYear(@PathVariable("companyId") UUID companyId,
                                @PathVariable("year") int year,
                                @RequestBody ConfirmationRequest request,
                                @RequestHeader(ACTOR_HEADER) String actor) {
        return metrics.timeApi("open_year",
            () -> financialYearService.openYear(companyId, year, request.getConfirmation(), actor));
    }
}
