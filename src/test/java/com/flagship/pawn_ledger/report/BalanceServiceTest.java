package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.exception.LedgerReferenceException;
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
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Capital of 100000 on 1 January, a 90000 pledge and 500 rent on 2 January.
 */
class BalanceServiceTest extends IntegrationTestSupport {

    private static final LocalDate DAY_ONE = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_TWO = LocalDate.of(2024, 1, 2);

    @Autowired
    private BalanceService balanceService;

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

    private AccountBalance balance(String code, LocalDate asOf) {
        return balanceService.accountBalance(accountService.requireByCode(companyId, code).getId(), companyId, asOf);
    }

    @Test
    @DisplayName("Account balances are signed by the account's normal side")
    void testAccountBalance() {
        AccountBalance cash = balance("1001", DAY_TWO);
        AccountBalance capital = balance("3001", DAY_TWO);
        AccountBalance rent = balance("5001", DAY_TWO);

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("11300.00"), cash.getBalance()), "cash " + cash.getBalance());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("101800.00"), cash.getTotalDebits()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("100000.00"), capital.getBalance()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("500.00"), rent.getBalance()));
    }

    @Test
    @DisplayName("Balances as of an earlier date ignore later entries")
    void testAccountBalance_AsOf() {
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("100000.00"), balance("1001", DAY_ONE).getBalance()));
        assertTrue(LedgerAmounts.isZero(balance("1001", DAY_ONE.minusDays(1)).getBalance()));
    }

    @Test
    @DisplayName("A customer owing money has a negative balance")
    void testCustomerBalance() {
        CustomerBalance owing = balanceService.customerBalance(customer.getId(), companyId, DAY_TWO);
        CustomerBalance fresh = balanceService.customerBalance(newCustomer(companyId).getId(), companyId, DAY_TWO);

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-90000.00"), owing.getBalance()));
        assertTrue(owing.getAccountCode().startsWith("2001-"));
        assertTrue(LedgerAmounts.isZero(fresh.getBalance()));
        assertNull(fresh.getAccountId());
    }

    @Test
    @DisplayName("Trial balance totals match")
    void testTrialBalance() {
        TrialBalance trialBalance = balanceService.trialBalance(companyId, DAY_TWO);

        assertTrue(trialBalance.isBalanced());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("101800.00"), trialBalance.getTotalDebit()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("101800.00"), trialBalance.getTotalCredit()));

        TrialBalance.Line interest = trialBalance.getLines().stream()
            .filter(line -> line.getCode().equals("4001"))
            .findFirst()
            .orElseThrow();
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1800.00"), interest.getCredit()));
        assertTrue(LedgerAmounts.isZero(interest.getDebit()));
    }

    @Test
    @DisplayName("Profit and loss covers the financial year containing the date")
    void testProfitAndLoss() {
        ProfitAndLoss pnl = balanceService.profitAndLoss(companyId, DAY_TWO);

        assertEquals("2023-24", pnl.getFinancialYear());
        assertEquals(LocalDate.of(2023, 4, 1), pnl.getPeriodStart());
        assertEquals(1, pnl.getIncome().size());
        assertEquals(1, pnl.getExpenses().size());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1800.00"), pnl.getTotalIncome()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("500.00"), pnl.getTotalExpenses()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1300.00"), pnl.getNetProfit()));

        ProfitAndLoss nextYear = balanceService.profitAndLoss(companyId, 2024);
        assertTrue(LedgerAmounts.isZero(nextYear.getNetProfit()));
        assertTrue(LedgerAmounts.isZero(nextYear.getProfitPercentage()));
    }

    @Test
    @DisplayName("Balance sheet balances with unclosed earnings shown under equity")
    void testBalanceSheet() {
        BalanceSheet sheet = balanceService.balanceSheet(companyId, DAY_TWO);

        assertTrue(sheet.isBalanced());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("11300.00"), sheet.getTotalAssets()));
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("1300.00"), sheet.getCurrentPeriodEarnings()));
        assertTrue(sheet.getEquity().stream()
            .anyMatch(line -> BalanceSheet.CURRENT_EARNINGS_LINE.equals(line.getName())));
    }

    @Test
    @DisplayName("Balances of another company's account are not visible")
    void testAccountBalance_OtherCompany() {
        UUID foreignCash = accountService.requireByCode(newCompany().getId(), "1001").getId();

        assertThrows(LedgerReferenceException.class,
            () -> balanceService.accountBalance(foreignCash, companyId, DAY_TWO));
    }
}
