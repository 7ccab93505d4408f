package com.flagship.pawn_ledger.fiscal;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.config.LedgerProperties;
import com.flagship.pawn_ledger.event.FinancialYearClosedEvent;
import com.flagship.pawn_ledger.event.FinancialYearOpenedEvent;
import com.flagship.pawn_ledger.exception.AlreadyClosedException;
import com.flagship.pawn_ledger.exception.LedgerInvariantViolationException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.PendingUnpostedVouchersException;
import com.flagship.pawn_ledger.exception.PriorYearNotClosedException;
import com.flagship.pawn_ledger.exception.YearNotEndedException;
import com.flagship.pawn_ledger.ledger.EntryDirection;
import com.flagship.pawn_ledger.ledger.EntryReference;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.ReferenceKind;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.master.Company;
import com.flagship.pawn_ledger.master.MasterDataService;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.report.BalanceService;
import com.flagship.pawn_ledger.report.ProfitAndLoss;
import com.flagship.pawn_ledger.report.TrialBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.UUID;

/**
 * Year-end closing and year opening.
 *
 * Both run in one SERIALIZABLE transaction that holds the company row
 * exclusively; postings take a share lock on the same row and wait. After the
 * voucher is posted the trial balance must still balance, otherwise everything
 * rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialYearService {

    public static final String CONFIRMATION_TOKEN = "CONFIRM";
    public static final String EARLIER_YEAR_NOT_CLOSED = "EARLIER_YEAR_NOT_CLOSED";

    private final MasterDataService masterDataService;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final BalanceService balanceService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Closes a financial year into Retained Earnings.
     *
     * Every income account is debited by its credit balance and every expense
     * account credited by its debit balance; the net goes to Retained Earnings,
     * credited for a profit and debited for a loss. A year without income or
     * expense is recorded as closed without a voucher.
     *
     * @param startYear calendar year the financial year starts in
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public YearEndClosing closeYear(UUID companyId, int startYear, String confirmation, String actor) {
        requireConfirmation(confirmation, "close");
        MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, companyId.toString());
        try {
            Company company = masterDataService.lockCompany(companyId);
            FinancialYear year = FinancialYear.starting(startYear, company.getFiscalStart());

            if (isClosed(companyId, year)) {
                throw new AlreadyClosedException(year.getLabel());
            }
            LocalDate today = LocalDate.now(clock);
            if (year.getEndDate().isAfter(today)) {
                throw new YearNotEndedException(year.getLabel(), year.getEndDate());
            }
            requireEarlierYearsClosed(companyId, year, company.getFiscalStart());
            requireNoUnpostedVouchers(companyId, year);

            ProfitAndLoss pnl = balanceService.profitAndLoss(companyId, year);
            PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
                .companyId(companyId)
                .voucherType(VoucherType.YEAR_END_CLOSING)
                .voucherDate(year.getEndDate())
                .narration("Year-end closing " + year.getLabel())
                .actor(actor);
            EntryReference reference = EntryReference.of(ReferenceKind.YEAR_END_CLOSING, companyId);

            int accountsClosed = 0;
            for (ProfitAndLoss.Line line : pnl.getIncome()) {
                request.line(PostingRequest.Line.of(line.getAccountId(),
                    line.getAmount().signum() > 0 ? EntryDirection.DEBIT : EntryDirection.CREDIT,
                    line.getAmount().abs(), "Close " + line.getCode() + " " + line.getName(), reference));
                accountsClosed++;
            }
            for (ProfitAndLoss.Line line : pnl.getExpenses()) {
                request.line(PostingRequest.Line.of(line.getAccountId(),
                    line.getAmount().signum() > 0 ? EntryDirection.CREDIT : EntryDirection.DEBIT,
                    line.getAmount().abs(), "Close " + line.getCode() + " " + line.getName(), reference));
                accountsClosed++;
            }

            Voucher voucher = null;
            if (accountsClosed > 0) {
                BigDecimal netProfit = pnl.getNetProfit();
                if (!LedgerAmounts.isZero(netProfit)) {
                    UUID retainedEarnings = retainedEarningsAccount(companyId).getId();
                    request.line(PostingRequest.Line.of(retainedEarnings,
                        netProfit.signum() > 0 ? EntryDirection.CREDIT : EntryDirection.DEBIT,
                        netProfit.abs(), netProfit.signum() > 0 ? "Net profit " + year.getLabel()
                            : "Net loss " + year.getLabel(), reference));
                }
                voucher = ledgerService.post(request.build());
                requireBalancedTrialBalance(companyId, year.getEndDate(), "closing " + year.getLabel());
            }

            jdbcTemplate.update(
                "INSERT INTO financial_year_closings " +
                "(id, company_id, financial_year, period_start, period_end, voucher_id, net_profit, closed_by) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(), companyId, startYear, year.getStartDate(), year.getEndDate(),
                voucher != null ? voucher.getId() : null, pnl.getNetProfit(), actor);

            YearEndClosing closing = YearEndClosing.builder()
                .companyId(companyId)
                .financialYear(year.getLabel())
                .periodStart(year.getStartDate())
                .periodEnd(year.getEndDate())
                .voucherId(voucher != null ? voucher.getId() : null)
                .voucherNumber(voucher != null ? voucher.getVoucherNumber() : null)
                .totalIncome(pnl.getTotalIncome())
                .totalExpenses(pnl.getTotalExpenses())
                .netProfit(pnl.getNetProfit())
                .accountsClosed(accountsClosed)
                .closedBy(actor)
                .build();

            outboxService.record(FinancialYearClosedEvent.from(closing));
            metrics.recordYearEnd("close");
            log.info("Closed financial year {} of company {}: income={}, expenses={}, net profit={}, voucher={}",
                year.getLabel(), companyId, pnl.getTotalIncome(), pnl.getTotalExpenses(), pnl.getNetProfit(),
                closing.getVoucherNumber());
            return closing;
        } finally {
            MDC.remove(CorrelationContext.COMPANY_ID_MDC_KEY);
        }
    }

    /**
     * Opens a financial year by carrying every non-zero asset, liability and
     * equity balance as of the prior year end into one YEAR_OPENING voucher
     * dated the fiscal start.
     *
     * @param startYear calendar year the financial year starts in
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public YearOpening openYear(UUID companyId, int startYear, String confirmation, String actor) {
        requireConfirmation(confirmation, "open");
        MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, companyId.toString());
        try {
            Company company = masterDataService.lockCompany(companyId);
            FinancialYear year = FinancialYear.starting(startYear, company.getFiscalStart());
            FinancialYear prior = year.previous();

            if (!isClosed(companyId, prior)) {
                throw new PriorYearNotClosedException(year.getLabel(), prior.getLabel());
            }
            if (isOpened(companyId, year)) {
                throw new LedgerStateConflictException("ALREADY_OPENED",
                    "Financial year " + year.getLabel() + " is already opened");
            }

            TrialBalance balances = balanceService.trialBalance(companyId, prior.getEndDate());
            PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
                .companyId(companyId)
                .voucherType(VoucherType.YEAR_OPENING)
                .voucherDate(year.getStartDate())
                .narration("Opening balances " + year.getLabel())
                .actor(actor);
            EntryReference reference = EntryReference.of(ReferenceKind.YEAR_OPENING, companyId);

            int accountsCarried = 0;
            BigDecimal totalDebit = LedgerAmounts.ZERO;
            BigDecimal totalCredit = LedgerAmounts.ZERO;
            for (TrialBalance.Line line : balances.getLines()) {
                if (line.getType().isProfitAndLoss()) {
                    continue;
                }
                String narration = "Opening balance " + line.getCode() + " " + line.getName();
                if (LedgerAmounts.isPositive(line.getDebit())) {
                    request.line(PostingRequest.Line.debit(line.getAccountId(), line.getDebit(), narration, reference));
                    totalDebit = totalDebit.add(line.getDebit());
                    accountsCarried++;
                } else if (LedgerAmounts.isPositive(line.getCredit())) {
                    request.line(PostingRequest.Line.credit(line.getAccountId(), line.getCredit(), narration, reference));
                    totalCredit = totalCredit.add(line.getCredit());
                    accountsCarried++;
                }
            }

            Voucher voucher = null;
            if (accountsCarried > 0) {
                if (!LedgerAmounts.sameAmount(totalDebit, totalCredit)) {
                    log.error("Balance sheet balances of company {} as of {} do not net to zero: debit={}, credit={}",
                        companyId, prior.getEndDate(), totalDebit, totalCredit);
                    throw new LedgerInvariantViolationException("Carry-forward balances of " + prior.getLabel()
                        + " do not balance; income or expense left unclosed");
                }
                voucher = ledgerService.post(request.build());
                requireBalancedTrialBalance(companyId, year.getStartDate(), "opening " + year.getLabel());
            }

            jdbcTemplate.update(
                "INSERT INTO financial_year_openings (id, company_id, financial_year, voucher_id, opened_by) " +
                "VALUES (?, ?, ?, ?, ?)",
                UUID.randomUUID(), companyId, startYear, voucher != null ? voucher.getId() : null, actor);

            YearOpening opening = YearOpening.builder()
                .companyId(companyId)
                .financialYear(year.getLabel())
                .openingDate(year.getStartDate())
                .voucherId(voucher != null ? voucher.getId() : null)
                .voucherNumber(voucher != null ? voucher.getVoucherNumber() : null)
                .accountsCarried(accountsCarried)
                .totalCarried(totalDebit)
                .openedBy(actor)
                .build();

            outboxService.record(FinancialYearOpenedEvent.from(opening));
            metrics.recordYearEnd("open");
            log.info("Opened financial year {} of company {}: {} account(s) carried, total {}, voucher={}",
                year.getLabel(), companyId, accountsCarried, totalDebit, opening.getVoucherNumber());
            return opening;
        } finally {
            MDC.remove(CorrelationContext.COMPANY_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public ClosingReadiness closingReadiness(UUID companyId, int startYear) {
        Company company = masterDataService.getCompany(companyId);
        FinancialYear year = FinancialYear.starting(startYear, company.getFiscalStart());

        return ClosingReadiness.builder()
            .financialYear(year.getLabel())
            .periodStart(year.getStartDate())
            .periodEnd(year.getEndDate())
            .yearEnded(!year.getEndDate().isAfter(LocalDate.now(clock)))
            .alreadyClosed(isClosed(companyId, year))
            .unpostedVoucherCount(ledgerService.countUnpostedVouchers(companyId, year.getStartDate(), year.getEndDate()))
            .trialBalanceBalanced(balanceService.trialBalance(companyId, year.getEndDate()).isBalanced())
            .profitAndLoss(balanceService.profitAndLoss(companyId, year))
            .build();
    }

    @Transactional(readOnly = true)
    public boolean isClosed(UUID companyId, FinancialYear year) {
        Boolean closed = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM financial_year_closings WHERE company_id = ? AND financial_year = ?) " +
            "OR EXISTS (SELECT 1 FROM vouchers WHERE company_id = ? AND voucher_type = 'YEAR_END_CLOSING' " +
            "AND voucher_date BETWEEN ? AND ?)",
            Boolean.class, companyId, year.getStartYear(), companyId, year.getStartDate(), year.getEndDate());
        return Boolean.TRUE.equals(closed);
    }

    private boolean isOpened(UUID companyId, FinancialYear year) {
        Boolean opened = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM financial_year_openings WHERE company_id = ? AND financial_year = ?)",
            Boolean.class, companyId, year.getStartYear());
        return Boolean.TRUE.equals(opened);
    }

    private void requireConfirmation(String confirmation, String operation) {
        if (!CONFIRMATION_TOKEN.equals(confirmation)) {
            throw new LedgerValidationException("CONFIRMATION_REQUIRED",
                "Confirmation '" + CONFIRMATION_TOKEN + "' is required to " + operation + " a financial year");
        }
    }

    /**
     * Entries dated before the year and after the last closed year end belong to
     * a year that was never closed. Closing past them would freeze that income
     * and expense outside Retained Earnings.
     */
    private void requireEarlierYearsClosed(UUID companyId, FinancialYear year, MonthDay fiscalStart) {
        LocalDate firstUnclosed = jdbcTemplate.queryForObject(
            "SELECT MIN(e.transaction_date) FROM ledger_entries e " +
            "WHERE e.company_id = ? AND e.transaction_date < ? " +
            "AND e.transaction_date > COALESCE((SELECT MAX(c.period_end) FROM financial_year_closings c " +
            "WHERE c.company_id = ? AND c.period_end < ?), DATE '0001-01-01')",
            LocalDate.class, companyId, year.getStartDate(), companyId, year.getStartDate());
        if (firstUnclosed != null) {
            String earlier = FinancialYear.containing(firstUnclosed, fiscalStart).getLabel();
            log.warn("Refusing to close {} of company {}: {} has entries and is not closed",
                year.getLabel(), companyId, earlier);
            throw new LedgerStateConflictException(EARLIER_YEAR_NOT_CLOSED,
                "Close financial year " + earlier + " before closing " + year.getLabel());
        }
    }

    private void requireNoUnpostedVouchers(UUID companyId, FinancialYear year) {
        long unposted = ledgerService.countUnpostedVouchers(companyId, year.getStartDate(), year.getEndDate());
        if (unposted > 0) {
            throw new PendingUnpostedVouchersException(year.getLabel(), unposted);
        }
    }

    private void requireBalancedTrialBalance(UUID companyId, LocalDate asOf, String operation) {
        TrialBalance trialBalance = balanceService.trialBalance(companyId, asOf);
        if (!trialBalance.isBalanced()) {
            log.error("Trial balance of company {} as of {} is out of balance after {}: debit={}, credit={}",
                companyId, asOf, operation, trialBalance.getTotalDebit(), trialBalance.getTotalCredit());
            throw new LedgerInvariantViolationException("Trial balance out of balance after " + operation);
        }
    }

    /**
     * Retained Earnings, created under the capital group when the chart lacks it.
     */
    private Account retainedEarningsAccount(UUID companyId) {
        LedgerProperties.Accounts codes = properties.getAccounts();
        return accountService.findByCode(companyId, codes.getRetainedEarnings())
            .orElseGet(() -> {
                UUID parentId = accountService.findByCode(companyId, codes.getCapitalGroup())
                    .map(Account::getId)
                    .orElse(null);
                log.info("Creating Retained Earnings account {} for company {}", codes.getRetainedEarnings(), companyId);
                return accountService.createAccount(companyId, codes.getRetainedEarnings(), "Retained Earnings",
                    AccountType.EQUITY, parentId);
            });
    }
}
