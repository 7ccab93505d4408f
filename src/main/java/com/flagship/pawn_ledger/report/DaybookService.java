package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.config.LedgerProperties;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.master.Customer;
import com.flagship.pawn_ledger.master.MasterDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Day book views and customer statements.
 *
 * Movements exclude carry-forward vouchers, so the opening of a period plus its
 * movements always lands on the ledger balance at the end of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DaybookService {

    static final int MAX_RANGE_DAYS = 366;

    private final LedgerQueries queries;
    private final AccountService accountService;
    private final MasterDataService masterDataService;
    private final LedgerProperties properties;

    /**
     * Entries of one day with a running cash balance. The opening is the cash
     * balance at the end of the previous day.
     */
    @Transactional(readOnly = true)
    public DaySummary dailySummary(UUID companyId, LocalDate date) {
        Account cash = accountService.requireByCode(companyId, properties.getAccounts().getCash());
        BigDecimal opening = queries.balanceAsOf(companyId, cash.getId(), date.minusDays(1)).net();

        List<DaySummary.Entry> entries = new ArrayList<>();
        BigDecimal running = opening;
        BigDecimal totalDebits = LedgerAmounts.ZERO;
        BigDecimal totalCredits = LedgerAmounts.ZERO;
        BigDecimal cashReceipts = LedgerAmounts.ZERO;
        BigDecimal cashPayments = LedgerAmounts.ZERO;
        Set<UUID> vouchers = new LinkedHashSet<>();
        Map<String, Long> typeCounts = new TreeMap<>();

        for (Movement movement : queries.movements(companyId, null, date, date)) {
            BigDecimal debit = movement.isDebit() ? movement.getAmount() : LedgerAmounts.ZERO;
            BigDecimal credit = movement.isDebit() ? LedgerAmounts.ZERO : movement.getAmount();
            totalDebits = totalDebits.add(debit);
            totalCredits = totalCredits.add(credit);

            if (movement.getAccountId().equals(cash.getId())) {
                running = running.add(debit).subtract(credit);
                cashReceipts = cashReceipts.add(debit);
                cashPayments = cashPayments.add(credit);
            }
            if (vouchers.add(movement.getVoucherId())) {
                typeCounts.merge(movement.getVoucherType().name(), 1L, Long::sum);
            }

            entries.add(DaySummary.Entry.builder()
                .voucherId(movement.getVoucherId())
                .voucherNumber(movement.voucherNumber())
                .voucherType(movement.getVoucherType().name())
                .entryId(movement.getEntryId())
                .accountId(movement.getAccountId())
                .accountCode(movement.getAccountCode())
                .accountName(movement.getAccountName())
                .direction(movement.getDirection())
                .debit(debit)
                .credit(credit)
                .narration(movement.effectiveNarration())
                .runningBalance(running)
                .build());
        }

        return DaySummary.builder()
            .companyId(companyId)
            .date(date)
            .openingBalance(opening)
            .closingBalance(running)
            .entries(entries)
            .totalDebits(totalDebits)
            .totalCredits(totalCredits)
            .cashReceipts(cashReceipts)
            .cashPayments(cashPayments)
            .voucherCount(vouchers.size())
            .voucherTypeCounts(typeCounts)
            .build();
    }

    /**
     * One row per day with activity between {@code from} and {@code to}, at most
     * {@value #MAX_RANGE_DAYS} days.
     */
    @Transactional(readOnly = true)
    public DateRangeSummary dateRangeSummary(UUID companyId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new LedgerValidationException("INVALID_DATE_RANGE", "'from' must not be after 'to'");
        }
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_RANGE_DAYS) {
            throw new LedgerValidationException("INVALID_DATE_RANGE",
                "Date range is limited to " + MAX_RANGE_DAYS + " days");
        }

        Account cash = accountService.requireByCode(companyId, properties.getAccounts().getCash());
        Map<LocalDate, List<Movement>> byDay = new LinkedHashMap<>();
        for (Movement movement : queries.movements(companyId, null, from, to)) {
            byDay.computeIfAbsent(movement.getDate(), d -> new ArrayList<>()).add(movement);
        }

        BigDecimal cashBalance = queries.balanceAsOf(companyId, cash.getId(), from.minusDays(1)).net();
        List<DateRangeSummary.Day> days = new ArrayList<>();
        BigDecimal rangeDebits = LedgerAmounts.ZERO;
        BigDecimal rangeCredits = LedgerAmounts.ZERO;

        for (Map.Entry<LocalDate, List<Movement>> day : byDay.entrySet()) {
            BigDecimal opening = cashBalance;
            BigDecimal debits = LedgerAmounts.ZERO;
            BigDecimal credits = LedgerAmounts.ZERO;
            Set<UUID> vouchers = new LinkedHashSet<>();

            for (Movement movement : day.getValue()) {
                vouchers.add(movement.getVoucherId());
                if (movement.isDebit()) {
                    debits = debits.add(movement.getAmount());
                } else {
                    credits = credits.add(movement.getAmount());
                }
                if (movement.getAccountId().equals(cash.getId())) {
                    cashBalance = movement.isDebit()
                        ? cashBalance.add(movement.getAmount())
                        : cashBalance.subtract(movement.getAmount());
                }
            }

            days.add(new DateRangeSummary.Day(day.getKey(), vouchers.size(), debits, credits, opening, cashBalance));
            rangeDebits = rangeDebits.add(debits);
            rangeCredits = rangeCredits.add(credits);
        }

        return new DateRangeSummary(companyId, from, to, days, rangeDebits, rangeCredits);
    }

    @Transactional(readOnly = true)
    public AccountDaySummary accountWiseSummary(UUID companyId, LocalDate date) {
        Map<UUID, List<Movement>> byAccount = new LinkedHashMap<>();
        for (Movement movement : queries.movements(companyId, null, date, date)) {
            byAccount.computeIfAbsent(movement.getAccountId(), id -> new ArrayList<>()).add(movement);
        }

        List<AccountDaySummary.Line> lines = new ArrayList<>();
        BigDecimal totalDebits = LedgerAmounts.ZERO;
        BigDecimal totalCredits = LedgerAmounts.ZERO;

        for (List<Movement> movements : byAccount.values()) {
            Movement first = movements.get(0);
            BigDecimal debits = sum(movements, true);
            BigDecimal credits = sum(movements, false);
            lines.add(new AccountDaySummary.Line(first.getAccountId(), first.getAccountCode(), first.getAccountName(),
                first.getAccountType(), debits, credits, movements.size()));
            totalDebits = totalDebits.add(debits);
            totalCredits = totalCredits.add(credits);
        }
        lines.sort((a, b) -> a.getCode().compareTo(b.getCode()));

        return new AccountDaySummary(companyId, date, lines, totalDebits, totalCredits);
    }

    @Transactional(readOnly = true)
    public VoucherDaySummary voucherWiseSummary(UUID companyId, LocalDate date) {
        Map<UUID, List<Movement>> byVoucher = new LinkedHashMap<>();
        for (Movement movement : queries.movements(companyId, null, date, date)) {
            byVoucher.computeIfAbsent(movement.getVoucherId(), id -> new ArrayList<>()).add(movement);
        }

        List<VoucherDaySummary.Line> lines = new ArrayList<>();
        for (List<Movement> movements : byVoucher.values()) {
            Movement first = movements.get(0);
            BigDecimal debits = sum(movements, true);
            BigDecimal credits = sum(movements, false);
            lines.add(new VoucherDaySummary.Line(first.getVoucherId(), first.voucherNumber(),
                first.getVoucherType().name(), first.getVoucherNarration(), first.getVoucherCreatedBy(),
                debits, credits, movements.size(), LedgerAmounts.sameAmount(debits, credits)));
        }
        return new VoucherDaySummary(companyId, date, lines);
    }

    /**
     * Statement of a customer's sub-account between two dates, inclusive.
     * A customer without a sub-account gets an empty statement.
     */
    @Transactional(readOnly = true)
    public CustomerStatement customerStatement(UUID customerId, UUID companyId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new LedgerValidationException("INVALID_DATE_RANGE", "'from' must not be after 'to'");
        }
        Customer customer = masterDataService.getCustomer(customerId, companyId);
        CustomerStatement.CustomerStatementBuilder statement = CustomerStatement.builder()
            .customerId(customerId)
            .customerName(customer.getName())
            .from(from)
            .to(to);

        if (!customer.hasLedgerAccount()) {
            return statement
                .openingBalance(LedgerAmounts.ZERO)
                .entries(List.of())
                .totalDebits(LedgerAmounts.ZERO)
                .totalCredits(LedgerAmounts.ZERO)
                .closingBalance(LedgerAmounts.ZERO)
                .balanceVerification(new CustomerStatement.Verification(
                    LedgerAmounts.ZERO, LedgerAmounts.ZERO, LedgerAmounts.ZERO, true))
                .build();
        }

        Account account = accountService.getAccount(customer.getLedgerAccountId(), companyId);
        AccountType type = account.getType();
        BigDecimal opening = queries.balanceAsOf(companyId, account.getId(), from.minusDays(1)).balanceFor(type);

        List<CustomerStatement.Line> lines = new ArrayList<>();
        BigDecimal running = opening;
        BigDecimal totalDebits = LedgerAmounts.ZERO;
        BigDecimal totalCredits = LedgerAmounts.ZERO;

        for (Movement movement : queries.movements(companyId, account.getId(), from, to)) {
            BigDecimal debit = movement.isDebit() ? movement.getAmount() : LedgerAmounts.ZERO;
            BigDecimal credit = movement.isDebit() ? LedgerAmounts.ZERO : movement.getAmount();
            running = running.add(credit).subtract(debit);
            totalDebits = totalDebits.add(debit);
            totalCredits = totalCredits.add(credit);

            lines.add(CustomerStatement.Line.builder()
                .date(movement.getDate())
                .voucherId(movement.getVoucherId())
                .voucherNumber(movement.voucherNumber())
                .voucherType(movement.getVoucherType().name())
                .narration(movement.effectiveNarration())
                .debit(debit)
                .credit(credit)
                .runningBalance(running)
                .build());
        }

        BigDecimal ledgerBalance = queries.balanceAsOf(companyId, account.getId(), to).balanceFor(type);
        BigDecimal difference = running.subtract(ledgerBalance);
        boolean matches = LedgerAmounts.isZero(difference);
        if (!matches) {
            log.error("Statement of customer {} ends at {} but ledger balance as of {} is {}",
                customerId, running, to, ledgerBalance);
        }

        return statement
            .accountId(account.getId())
            .accountCode(account.getCode())
            .openingBalance(opening)
            .entries(lines)
            .totalDebits(totalDebits)
            .totalCredits(totalCredits)
            .closingBalance(running)
            .balanceVerification(new CustomerStatement.Verification(running, ledgerBalance, difference, matches))
            .build();
    }

    private BigDecimal sum(List<Movement> movements, boolean debits) {
        return movements.stream()
            .filter(m -> m.isDebit() == debits)
            .map(Movement::getAmount)
            .reduce(LedgerAmounts.ZERO, BigDecimal::add);
    }
}
