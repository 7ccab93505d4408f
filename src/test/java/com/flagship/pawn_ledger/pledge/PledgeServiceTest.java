package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.event.PledgeDisbursedEvent;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerEntry;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.outbox.OutboxEvent;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.report.BalanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PledgeServiceTest extends IntegrationTestSupport {

    private static final LocalDate PLEDGE_DATE = LocalDate.of(2024, 1, 1);

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private OutboxService outboxService;

    private UUID companyId;
    private UUID customerId;
    private UUID schemeId;

    @BeforeEach
    void setUp() {
        companyId = newCompany().getId();
        customerId = newCustomer(companyId).getId();
        schemeId = twoPercentScheme(companyId).getId();
    }

    @Test
    @DisplayName("Disbursal derives the final amount and posts a balanced LOAN_DISBURSAL voucher")
    void testDisburse_PostsVoucher() {
        Pledge pledge = disburse(companyId, customerId, schemeId, "90000", PLEDGE_DATE);

        assertEquals(new BigDecimal("90000.00"), pledge.getPrincipal());
        assertEquals(new BigDecimal("1800.00"), pledge.getFirstMonthInterest());
        assertEquals(new BigDecimal("91800.00"), pledge.getFinalAmount());
        assertEquals(PledgeStatus.ACTIVE, pledge.getStatus());
        assertEquals(PLEDGE_DATE.plusMonths(12), pledge.getDueDate());
        assertTrue(pledge.getPledgeNo().startsWith("PL-2024-"));

        Voucher voucher = ledgerService.getVoucher(pledge.getDisbursalVoucherId(), companyId);
        assertEquals(VoucherType.LOAN_DISBURSAL, voucher.getType());
        assertTrue(voucher.isBalanced());
        assertEquals(5, voucher.getEntries().size());
        assertEquals(new BigDecimal("93600.00"), voucher.getTotalDebits());
        for (LedgerEntry entry : voucher.getEntries()) {
            assertEquals(pledge.getId(), entry.getReference().getId());
        }
    }

    @Test
    @DisplayName("After disbursal the customer owes the principal and interest income holds the first month")
    void testDisburse_Balances() {
        Pledge pledge = disburse(companyId, customerId, schemeId, "90000", PLEDGE_DATE);

        BigDecimal customerBalance = balanceService.customerBalance(customerId, companyId, PLEDGE_DATE).getBalance();
        BigDecimal interestIncome = balanceService.accountBalance(
            accountService.requireByCode(companyId, "4001").getId(), companyId, PLEDGE_DATE).getBalance();

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-90000.00"), customerBalance), "customer " + customerBalance);
        assertTrue(LedgerAmounts.sameAmount(pledge.getFirstMonthInterest(), interestIncome));
    }

    @Test
    @DisplayName("Document charges are added to the final amount and credited to service charges")
    void testDisburse_WithDocumentCharges() {
        Pledge pledge = pledgeService.disburse(DisbursePledgeCommand.builder()
            .companyId(companyId)
            .customerId(customerId)
            .schemeId(schemeId)
            .pledgeNo("GL-0001")
            .principal(amount("40000"))
            .firstMonthInterest(amount("700"))
            .documentCharges(amount("250"))
            .pledgeDate(PLEDGE_DATE)
            .actor(ACTOR)
            .build());

        assertEquals("GL-0001", pledge.getPledgeNo());
        assertEquals(new BigDecimal("40950.00"), pledge.getFinalAmount());

        BigDecimal serviceCharges = balanceService.accountBalance(
            accountService.requireByCode(companyId, "4003").getId(), companyId, PLEDGE_DATE).getBalance();
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("250.00"), serviceCharges));
    }

    @Test
    @DisplayName("Pledge numbers are unique within a company")
    void testDisburse_DuplicatePledgeNumber() {
        DisbursePledgeCommand command = DisbursePledgeCommand.builder()
            .companyId(companyId)
            .customerId(customerId)
            .schemeId(schemeId)
            .pledgeNo("GL-0002")
            .principal(amount("1000"))
            .pledgeDate(PLEDGE_DATE)
            .actor(ACTOR)
            .build();
        pledgeService.disburse(command);

        LedgerStateConflictException e = assertThrows(LedgerStateConflictException.class,
            () -> pledgeService.disburse(command));
        assertEquals("DUPLICATE_PLEDGE_NUMBER", e.getErrorCode());
        assertEquals(1, pledgeService.pledgesOfCustomer(customerId, companyId).size());
    }

    @Test
    @DisplayName("Non-positive principal is rejected before anything is posted")
    void testDisburse_InvalidPrincipal() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> disburse(companyId, customerId, schemeId, "0", PLEDGE_DATE));

        assertEquals("INVALID_AMOUNT", e.getErrorCode());
        assertTrue(pledgeService.pledgesOfCustomer(customerId, companyId).isEmpty());
    }

    @Test
    @DisplayName("Settlement quotes follow the completed-month rule")
    void testSettlementQuote() {
        Pledge pledge = disburse(companyId, customerId, schemeId, "90000", PLEDGE_DATE);

        SettlementQuote sameMonth = pledgeService.settlementQuote(pledge.getId(), companyId, LocalDate.of(2024, 1, 25));
        SettlementQuote nextMonth = pledgeService.settlementQuote(pledge.getId(), companyId, LocalDate.of(2024, 2, 1));

        assertEquals(new BigDecimal("1800.00"), sameMonth.getTotalInterest());
        assertEquals(new BigDecimal("90000.00"), sameMonth.getFinalAmount());
        assertEquals(new BigDecimal("3600.00"), nextMonth.getTotalInterest());
        assertEquals(new BigDecimal("91800.00"), nextMonth.getFinalAmount());
    }

    @Test
    @DisplayName("Disbursal writes a PledgeDisbursed event in the same transaction")
    void testDisburse_RecordsEvent() {
        Pledge pledge = disburse(companyId, customerId, schemeId, "5000", PLEDGE_DATE);

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Pledge", pledge.getId());

        assertEquals(1, events.size());
        assertEquals(PledgeDisbursedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains(pledge.getPledgeNo()));
        assertFalse(events.get(0).isPublished());
    }
}
