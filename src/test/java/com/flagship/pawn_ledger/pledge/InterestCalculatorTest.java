package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement arithmetic without a database: first month mandatory, then one
 * month of interest per fully completed calendar month.
 */
class InterestCalculatorTest {

    private final InterestCalculator calculator = new InterestCalculator();

    private Pledge pledge(String principal, LocalDate pledgeDate) {
        BigDecimal amount = new BigDecimal(principal);
        BigDecimal rate = new BigDecimal("2.00");
        return Pledge.disbursed(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            "PL-TEST-1", amount, rate, calculator.firstMonthInterest(amount, rate), BigDecimal.ZERO,
            pledgeDate, pledgeDate.plusMonths(12), UUID.randomUUID(), "test-user");
    }

    @Test
    @DisplayName("Settlement within the first month charges only the mandatory first month")
    void testQuote_WithinFirstMonth() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 1));

        for (int day = 1; day <= 31; day++) {
            SettlementQuote quote = calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 1, day));

            assertEquals(0, quote.getCompletedMonths());
            assertEquals(new BigDecimal("1800.00"), quote.getTotalInterest(), "day " + day);
            assertEquals(new BigDecimal("90000.00"), quote.getFinalAmount(), "day " + day);
            assertEquals(PledgeStatus.ACTIVE, quote.getStatus());
        }
    }

    @Test
    @DisplayName("One full calendar month later adds exactly one month of interest")
    void testQuote_OneCompletedMonth() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 1));

        SettlementQuote quote = calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 2, 1));

        assertEquals(1, quote.getCompletedMonths());
        assertEquals(new BigDecimal("3600.00"), quote.getTotalInterest());
        assertEquals(new BigDecimal("1800.00"), quote.getRemainingInterest());
        assertEquals(new BigDecimal("91800.00"), quote.getFinalAmount());
        assertEquals(2, quote.getBreakdown().size());
        assertEquals(InterestPeriod.Status.DUE, quote.getBreakdown().get(1).getStatus());
    }

    @Test
    @DisplayName("A month ending on a day the shorter month lacks is not complete early")
    void testQuote_MonthEndPledge() {
        Pledge pledge = pledge("50000", LocalDate.of(2024, 1, 31));

        assertEquals(0, calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 2, 29)).getCompletedMonths());
        assertEquals(2, calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 3, 31)).getCompletedMonths());
    }

    @Test
    @DisplayName("Total interest equals the sum of the breakdown")
    void testQuote_BreakdownSumsToTotal() {
        Pledge pledge = pledge("12345.67", LocalDate.of(2023, 6, 15));

        SettlementQuote quote = calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 5, 20));

        BigDecimal sum = quote.getBreakdown().stream()
            .map(InterestPeriod::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertTrue(LedgerAmounts.sameAmount(sum, quote.getTotalInterest()),
            "breakdown " + sum + " vs total " + quote.getTotalInterest());
        assertEquals(quote.getCompletedMonths() + 1, quote.getBreakdown().size());
        assertTrue(quote.getBreakdown().get(0).isMandatory());
    }

    @Test
    @DisplayName("Payments reduce remaining interest and principal and mark the pledge partially paid")
    void testQuote_WithPayments() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 1));
        PaymentTotals payments = new PaymentTotals(new BigDecimal("1800.00"), new BigDecimal("10000.00"),
            LedgerAmounts.ZERO, LedgerAmounts.ZERO, 1);

        SettlementQuote quote = calculator.quote(pledge, payments, LocalDate.of(2024, 2, 10));

        assertEquals(new BigDecimal("0.00"), quote.getRemainingInterest());
        assertEquals(new BigDecimal("80000.00"), quote.getRemainingPrincipal());
        assertEquals(new BigDecimal("80000.00"), quote.getFinalAmount());
        assertEquals(new BigDecimal("80000.00"), quote.getNetOutstanding());
        assertEquals(PledgeStatus.PARTIAL_PAID, quote.getStatus());
        assertEquals(InterestPeriod.Status.PAID, quote.getBreakdown().get(1).getStatus());
    }

    @Test
    @DisplayName("Paying everything due redeems the pledge")
    void testQuote_FullySettled() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 1));
        PaymentTotals payments = new PaymentTotals(new BigDecimal("1800.00"), new BigDecimal("89000.00"),
            LedgerAmounts.ZERO, new BigDecimal("1000.00"), 2);

        SettlementQuote quote = calculator.quote(pledge, payments, LocalDate.of(2024, 2, 1));

        assertEquals(new BigDecimal("0.00"), quote.getFinalAmount());
        assertEquals(PledgeStatus.REDEEMED, quote.getStatus());
    }

    @Test
    @DisplayName("The same pledge, payments and date always give the same quote")
    void testQuote_Deterministic() {
        Pledge pledge = pledge("45678.90", LocalDate.of(2023, 11, 30));
        PaymentTotals payments = new PaymentTotals(new BigDecimal("900.00"), new BigDecimal("5000.00"),
            LedgerAmounts.ZERO, LedgerAmounts.ZERO, 1);
        LocalDate asOf = LocalDate.of(2024, 4, 12);

        SettlementQuote first = calculator.quote(pledge, payments, asOf);
        SettlementQuote second = calculator.quote(pledge, payments, asOf);

        assertEquals(first, second);
        assertEquals(first.getBreakdown(), second.getBreakdown());
    }

    @Test
    @DisplayName("Status moves from active to partially paid to redeemed as payments accumulate")
    void testQuote_StatusProgression() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 1));
        LocalDate asOf = LocalDate.of(2024, 3, 15);

        SettlementQuote unpaid = calculator.quote(pledge, PaymentTotals.NONE, asOf);
        SettlementQuote partly = calculator.quote(pledge, new PaymentTotals(new BigDecimal("3600.00"),
            new BigDecimal("40000.00"), LedgerAmounts.ZERO, LedgerAmounts.ZERO, 1), asOf);
        SettlementQuote settled = calculator.quote(pledge, new PaymentTotals(new BigDecimal("3600.00"),
            new BigDecimal("90000.00"), LedgerAmounts.ZERO, LedgerAmounts.ZERO, 2), asOf);

        assertEquals(2, unpaid.getCompletedMonths());
        assertEquals(PledgeStatus.ACTIVE, unpaid.getStatus());
        assertEquals(new BigDecimal("93600.00"), unpaid.getFinalAmount());

        assertEquals(PledgeStatus.PARTIAL_PAID, partly.getStatus());
        assertEquals(new BigDecimal("50000.00"), partly.getFinalAmount());

        assertEquals(PledgeStatus.REDEEMED, settled.getStatus());
        assertTrue(LedgerAmounts.isZero(settled.getFinalAmount()));
        assertTrue(LedgerAmounts.isZero(settled.getNetOutstanding()));
    }

    @Test
    @DisplayName("Quoting before the pledge date is rejected")
    void testQuote_BeforePledgeDate() {
        Pledge pledge = pledge("90000", LocalDate.of(2024, 1, 10));

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> calculator.quote(pledge, PaymentTotals.NONE, LocalDate.of(2024, 1, 9)));
        assertEquals("INVALID_AS_OF_DATE", e.getErrorCode());
    }
}
