package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.master.Customer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DaybookServiceTest extends IntegrationTestSupport {

    private static final LocalDate DAY_ONE = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_TWO = LocalDate.of(2024, 1, 2);

    @Autowired
    private DaybookService daybookService;

    @Autowired
    private LedgerService ledgerService;

    private UUID companyId;
    private Customer customer;

    @BeforeEach
    void setUp() {
        companyId = newCompany().getId();
        customer = newCustomer(companyId);
        journal(DAY_ONE, "1001", "3001", "100000");
        disburse(companyId, customer.getId(), twoPercentScheme(companyId).getId(), "90000", DAY_TWO);
        journal(DAY_TWO, "5001", "1001", "500");
    }

    private void journal(LocalDate date, String debitCode, String creditCode, String value) {
        ledgerService.post(PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.JOURNAL)
            .voucherDate(date)
            .narration("Journal " + debitCode + "/" + creditCode)
            .actor(ACTOR)
            .line(PostingRequest.Line.debit(accountService.requireByCode(companyId, debitCode).getId(),
                amount(value), null, null))
            .line(PostingRequest.Line.credit(accountService.requireByCode(companyId, creditCode).getId(),
                amount(value), null, null))
            .build());
    }

    @Test
    @DisplayName("Daily summary runs the cash balance from the previous day's close")
    void testDailySummary() {
        DaySummary day = daybookService.dailySummary(companyId, DAY_TWO);

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("100000.00"), day.getOpeningBalance()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("11300.00"), day.getClosingBalance()));
        assertEquals(7, day.getEntries().size());
        assertEquals(2, day.getVoucherCount());
        assertEquals(1L, day.getVoucherTypeCounts().get("LOAN_DISBURSAL"));
        assertEquals(1L, day.getVoucherTypeCounts().get("JOURNAL"));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("94100.00"), day.getTotalDebits()));
        assertTrue(LedgerAmounts.sameAmount(day.getTotalDebits(), day.getTotalCredits()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1800.00"), day.getCashReceipts()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("90500.00"), day.getCashPayments()));

        DaySummary.Entry last = day.getEntries().get(day.getEntries().size() - 1);
        assertTrue(LedgerAmounts.sameAmount(day.getClosingBalance(), last.getRunningBalance()));
    }

    @Test
    @DisplayName("A day without activity opens and closes on the same balance")
    void testDailySummary_QuietDay() {
        DaySummary day = daybookService.dailySummary(companyId, LocalDate.of(2024, 1, 10));

        assertTrue(day.getEntries().isEmpty());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("11300.00"), day.getOpeningBalance()));
        assertTrue(LedgerAmounts.sameAmount(day.getOpeningBalance(), day.getClosingBalance()));
    }

    @Test
    @DisplayName("Account-wise summary totals each account touched on the day")
    void testAccountWiseSummary() {
        AccountDaySummary summary = daybookService.accountWiseSummary(companyId, DAY_TWO);

        List<AccountDaySummary.Line> lines = summary.getAccounts();
        assertEquals(4, lines.size());
        assertEquals("1001", lines.get(0).getCode());
        assertEquals(3, lines.get(0).getEntryCount());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1800.00"), lines.get(0).getDebits()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("90500.00"), lines.get(0).getCredits()));
        assertTrue(lines.get(1).getCode().startsWith("2001-"));
        assertTrue(LedgerAmounts.sameAmount(summary.getTotalDebits(), summary.getTotalCredits()));
    }

    @Test
    @DisplayName("Voucher-wise summary lists each voucher of the day as balanced")
    void testVoucherWiseSummary() {
        VoucherDaySummary summary = daybookService.voucherWiseSummary(companyId, DAY_TWO);

        assertEquals(2, summary.getVouchers().size());
        assertTrue(summary.getVouchers().stream().allMatch(VoucherDaySummary.Line::isBalanced));
        assertTrue(summary.getVouchers().stream()
            .anyMatch(line -> line.getVoucherType().equals("LOAN_DISBURSAL") && line.getEntryCount() == 5));
    }

    @Test
    @DisplayName("Date range summary has one row per active day and chains the cash balance")
    void testDateRangeSummary() {
        DateRangeSummary range = daybookService.dateRangeSummary(companyId, DAY_ONE, LocalDate.of(2024, 1, 31));

        assertEquals(2, range.getDays().size());
        DateRangeSummary.Day first = range.getDays().get(0);
        DateRangeSummary.Day second = range.getDays().get(1);
        assertEquals(DAY_ONE, first.getDate());
        assertTrue(LedgerAmounts.isZero(first.getOpeningCash()));
        assertTrue(LedgerAmounts.sameAmount(first.getClosingCash(), second.getOpeningCash()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("11300.00"), second.getClosingCash()));
        assertTrue(LedgerAmounts.sameAmount(range.getTotalDebits(), range.getTotalCredits()));
    }

    @Test
    @DisplayName("Date ranges must be ordered and at most a year long")
    void testDateRangeSummary_InvalidRange() {
        LedgerValidationException reversed = assertThrows(LedgerValidationException.class,
            () -> daybookService.dateRangeSummary(companyId, DAY_TWO, DAY_ONE));
        LedgerValidationException tooLong = assertThrows(LedgerValidationException.class,
            () -> daybookService.dateRangeSummary(companyId, DAY_ONE, DAY_ONE.plusDays(DaybookService.MAX_RANGE_DAYS)));

        assertEquals("INVALID_DATE_RANGE", reversed.getErrorCode());
        assertEquals("INVALID_DATE_RANGE", tooLong.getErrorCode());
    }

    @Test
    @DisplayName("Customer statement ends on the ledger balance")
    void testCustomerStatement() {
        CustomerStatement statement = daybookService.customerStatement(customer.getId(), companyId,
            DAY_ONE, LocalDate.of(2024, 1, 31));

        assertTrue(LedgerAmounts.isZero(statement.getOpeningBalance()));
        assertEquals(2, statement.getEntries().size());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-90000.00"), statement.getClosingBalance()));
        assertTrue(statement.getBalanceVerification().isMatches());
        assertTrue(LedgerAmounts.isZero(statement.getBalanceVerification().getDifference()));
    }

    @Test
    @DisplayName("A later statement opens on the earlier closing balance")
    void testCustomerStatement_OpeningBalance() {
        CustomerStatement statement = daybookService.customerStatement(customer.getId(), companyId,
            LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));

        assertTrue(statement.getEntries().isEmpty());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-90000.00"), statement.getOpeningBalance()));
        assertTrue(statement.getBalanceVerification().isMatches());
    }

    @Test
    @DisplayName("A customer without a ledger account gets an empty statement")
    void testCustomerStatement_NoAccount() {
        CustomerStatement statement = daybookService.customerStatement(newCustomer(companyId).getId(), companyId,
            DAY_ONE, DAY_TWO);

        assertTrue(statement.getEntries().isEmpty());
        assertNull(statement.getAccountId());
        assertTrue(statement.getBalanceVerification().isMatches());
    }
}
