package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Financial reports and daily book views. Dates default to today.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/reports")
@RequiredArgsConstructor
public class ReportController {

    private final BalanceService balanceService;
    private final DaybookService daybookService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @GetMapping("/trial-balance")
    public TrialBalance trialBalance(@PathVariable("companyId") UUID companyId,
                                     @RequestParam(name = "as_of", required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return metrics.timeApi("trial_balance", () -> balanceService.trialBalance(companyId, orToday(asOf)));
    }

    /**
     * @param financialYear calendar year the financial year starts in; defaults to the current one
     */
    @GetMapping("/profit-and-loss")
    public ProfitAndLoss profitAndLoss(@PathVariable("companyId") UUID companyId,
                                       @RequestParam(name = "financial_year", required = false) Integer financialYear) {
        return metrics.timeApi("profit_and_loss", () -> financialYear != null
            ? balanceService.profitAndLoss(companyId, financialYear)
            : balanceService.profitAndLoss(companyId, LocalDate.now(clock)));
    }

    @GetMapping("/balance-sheet")
    public BalanceSheet balanceSheet(@PathVariable("companyId") UUID companyId,
                                     @RequestParam(name = "as_of", required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return metrics.timeApi("balance_sheet", () -> balanceService.balanceSheet(companyId, orToday(asOf)));
    }

    @GetMapping("/daybook")
    public DaySummary daybook(@PathVariable("companyId") UUID companyId,
                              @RequestParam(name = "date", required = false)
                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return daybookService.dailySummary(companyId, orToday(date));
    }

    @GetMapping("/daybook/range")
    public DateRangeSummary daybookRange(@PathVariable("companyId") UUID companyId,
                                         @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                         @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return daybookService.dateRangeSummary(companyId, from, to);
    }

    @GetMapping("/daybook/accounts")
    public AccountDaySummary daybookByAccount(@PathVariable("companyId") UUID companyId,
                                              @RequestParam(name = "date", required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return daybookService.accountWiseSummary(companyId, orToday(date));
    }

    @GetMapping("/daybook/vouchers")
    public VoucherDaySummary daybookByVoucher(@PathVariable("companyId") UUID companyId,
                                              @RequestParam(name = "date", required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return daybookService.voucherWiseSummary(companyId, orToday(date));
    }

    private LocalDate orToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }
}
