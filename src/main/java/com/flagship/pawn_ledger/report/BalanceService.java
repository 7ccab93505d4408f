package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.fiscal.FinancialYear;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.master.Company;
import com.flagship.pawn_ledger.master.Customer;
import com.flagship.pawn_ledger.master.MasterDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Balances, trial balance, profit and loss and balance sheet.
 *
 * Everything is computed from ledger entries and voucher metadata. Cached
 * fields such as a payment's {@code balance_amount} are never read here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final LedgerQueries queries;
    private final AccountService accountService;
    private final MasterDataService masterDataService;

    @Transactional(readOnly = true)
    public AccountBalance accountBalance(UUID accountId, UUID companyId, LocalDate asOf) {
        Account account = accountService.getAccount(accountId, companyId);
        AccountTotals totals = queries.balanceAsOf(companyId, accountId, asOf);

        return AccountBalance.builder()
            .accountId(accountId)
            .code(account.getCode())
            .name(account.getName())
            .type(account.getType())
            .asOf(asOf)
            .totalDebits(totals.getDebits())
            .totalCredits(totals.getCredits())
            .balance(totals.balanceFor(account.getType()))
            .build();
    }

    /**
     * Balance of the customer's sub-account; zero for a customer that has none yet.
     */
    @Transactional(readOnly = true)
    public CustomerBalance customerBalance(UUID customerId, UUID companyId, LocalDate asOf) {
        Customer customer = masterDataService.getCustomer(customerId, companyId);
        CustomerBalance.CustomerBalanceBuilder result = CustomerBalance.builder()
            .customerId(customerId)
            .customerName(customer.getName())
            .asOf(asOf)
            .balance(LedgerAmounts.ZERO);

        if (!customer.hasLedgerAccount()) {
            return result.build();
        }
        AccountBalance balance = accountBalance(customer.getLedgerAccountId(), companyId, asOf);
        return result
            .accountId(balance.getAccountId())
            .accountCode(balance.getCode())
            .balance(balance.getBalance())
            .build();
    }

    /**
     * Every active account plus inactive ones that still carry a balance. Each net
     * balance lands in the debit column when debits exceed credits, otherwise in
     * the credit column.
     */
    @Transactional(readOnly = true)
    public TrialBalance trialBalance(UUID companyId, LocalDate asOf) {
        masterDataService.getCompany(companyId);
        Map<UUID, AccountTotals> balances = queries.balancesAsOf(companyId, asOf);

        List<TrialBalance.Line> lines = new ArrayList<>();
        BigDecimal totalDebit = LedgerAmounts.ZERO;
        BigDecimal totalCredit = LedgerAmounts.ZERO;

        for (Account account : accountService.listAccounts(companyId)) {
            BigDecimal net = balances.getOrDefault(account.getId(), AccountTotals.NONE).net();
            if (!account.isActive() && LedgerAmounts.isZero(net)) {
                continue;
            }
            BigDecimal debit = net.signum() > 0 ? net : LedgerAmounts.ZERO;
            BigDecimal credit = net.signum() < 0 ? net.negate() : LedgerAmounts.ZERO;

            lines.add(TrialBalance.Line.builder()
                .accountId(account.getId())
                .code(account.getCode())
                .name(account.getName())
                .type(account.getType())
                .active(account.isActive())
                .debit(debit)
                .credit(credit)
                .build());
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
        }

        boolean balanced = LedgerAmounts.sameAmount(totalDebit, totalCredit);
        if (!balanced) {
            log.error("Trial balance of company {} as of {} does not balance: debit={}, credit={}",
                companyId, asOf, totalDebit, totalCredit);
        }
        return TrialBalance.builder()
            .companyId(companyId)
            .asOf(asOf)
            .lines(lines)
            .totalDebit(totalDebit)
            .totalCredit(totalCredit)
            .balanced(balanced)
            .build();
    }

    @Transactional(readOnly = true)
    public ProfitAndLoss profitAndLoss(UUID companyId, int financialYear) {
        Company company = masterDataService.getCompany(companyId);
        return profitAndLoss(companyId, FinancialYear.starting(financialYear, company.getFiscalStart()));
    }

    /**
     * Profit and loss of the financial year that contains {@code date}.
     */
    @Transactional(readOnly = true)
    public ProfitAndLoss profitAndLoss(UUID companyId, LocalDate date) {
        Company company = masterDataService.getCompany(companyId);
        return profitAndLoss(companyId, FinancialYear.containing(date, company.getFiscalStart()));
    }

    /**
     * Income and expense within the fiscal window. The closing voucher is left out,
     * so a closed year reports the same figures as before it was closed.
     */
    @Transactional(readOnly = true)
    public ProfitAndLoss profitAndLoss(UUID companyId, FinancialYear year) {
        Map<UUID, AccountTotals> totals = queries.totalsByAccount(companyId, null,
            year.getStartDate(), year.getEndDate(), List.of(VoucherType.YEAR_END_CLOSING));

        List<ProfitAndLoss.Line> income = new ArrayList<>();
        List<ProfitAndLoss.Line> expenses = new ArrayList<>();
        BigDecimal totalIncome = LedgerAmounts.ZERO;
        BigDecimal totalExpenses = LedgerAmounts.ZERO;

        for (Account account : accountService.listAccounts(companyId)) {
            if (!account.getType().isProfitAndLoss()) {
                continue;
            }
            BigDecimal amount = totals.getOrDefault(account.getId(), AccountTotals.NONE)
                .balanceFor(account.getType());
            if (LedgerAmounts.isZero(amount)) {
                continue;
            }
            ProfitAndLoss.Line line = new ProfitAndLoss.Line(account.getId(), account.getCode(), account.getName(), amount);
            if (account.getType() == AccountType.INCOME) {
                income.add(line);
                totalIncome = totalIncome.add(amount);
            } else {
                expenses.add(line);
                totalExpenses = totalExpenses.add(amount);
            }
        }

        BigDecimal netProfit = totalIncome.subtract(totalExpenses);
        BigDecimal profitPercentage = totalIncome.signum() == 0
            ? LedgerAmounts.ZERO
            : netProfit.multiply(HUNDRED).divide(totalIncome, LedgerAmounts.SCALE, RoundingMode.HALF_UP);

        return ProfitAndLoss.builder()
            .companyId(companyId)
            .financialYear(year.getLabel())
            .periodStart(year.getStartDate())
            .periodEnd(year.getEndDate())
            .income(income)
            .expenses(expenses)
            .totalIncome(totalIncome)
            .totalExpenses(totalExpenses)
            .netProfit(netProfit)
            .profitPercentage(profitPercentage)
            .build();
    }

    @Transactional(readOnly = true)
    public BalanceSheet balanceSheet(UUID companyId, LocalDate asOf) {
        masterDataService.getCompany(companyId);
        Map<UUID, AccountTotals> balances = queries.balancesAsOf(companyId, asOf);

        List<BalanceSheet.Line> assets = new ArrayList<>();
        List<BalanceSheet.Line> liabilities = new ArrayList<>();
        List<BalanceSheet.Line> equity = new ArrayList<>();
        BigDecimal totalAssets = LedgerAmounts.ZERO;
        BigDecimal totalLiabilities = LedgerAmounts.ZERO;
        BigDecimal totalEquity = LedgerAmounts.ZERO;
        BigDecimal earnings = LedgerAmounts.ZERO;

        for (Account account : accountService.listAccounts(companyId)) {
            BigDecimal amount = balances.getOrDefault(account.getId(), AccountTotals.NONE)
                .balanceFor(account.getType());
            if (LedgerAmounts.isZero(amount)) {
                continue;
            }
            BalanceSheet.Line line = new BalanceSheet.Line(account.getId(), account.getCode(), account.getName(), amount);
            switch (account.getType()) {
                case ASSET:
                    assets.add(line);
                    totalAssets = totalAssets.add(amount);
                    break;
                case LIABILITY:
                    liabilities.add(line);
                    totalLiabilities = totalLiabilities.add(amount);
                    break;
                case EQUITY:
                    equity.add(line);
                    totalEquity = totalEquity.add(amount);
                    break;
                case INCOME:
                    earnings = earnings.add(amount);
                    break;
                case EXPENSE:
                    earnings = earnings.subtract(amount);
                    break;
                default:
                    throw new IllegalStateException("Unknown account type " + account.getType());
            }
        }

        if (!LedgerAmounts.isZero(earnings)) {
            equity.add(new BalanceSheet.Line(null, null, BalanceSheet.CURRENT_EARNINGS_LINE, earnings));
            totalEquity = totalEquity.add(earnings);
        }

        return BalanceSheet.builder()
            .companyId(companyId)
            .asOf(asOf)
            .assets(assets)
            .liabilities(liabilities)
            .equity(equity)
            .totalAssets(totalAssets)
            .totalLiabilities(totalLiabilities)
            .totalEquity(totalEquity)
            .currentPeriodEarnings(earnings)
            .balanced(LedgerAmounts.sameAmount(totalAssets, totalLiabilities.add(totalEquity)))
            .build();
    }
}
