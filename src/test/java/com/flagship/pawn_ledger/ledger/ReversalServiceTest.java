package com.flagship.pawn_ledger.ledger;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.NothingToReverseException;
import com.flagship.pawn_ledger.report.BalanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ReversalServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ReversalService reversalService;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID companyId;
    private UUID cashId;
    private UUID incomeId;
    private Voucher original;

    @BeforeEach
    void setUp() {
        companyId = newCompany().getId();
        cashId = accountService.requireByCode(companyId, "1001").getId();
        incomeId = accountService.requireByCode(companyId, "4003").getId();
        EntryReference reference = EntryReference.of(ReferenceKind.MANUAL, UUID.randomUUID());

        original = ledgerService.post(PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.RECEIPT)
            .voucherDate(LocalDate.of(2024, 8, 5))
            .narration("Valuation fee")
            .actor(ACTOR)
            .line(PostingRequest.Line.debit(cashId, amount("500.00"), "Fee received", reference))
            .line(PostingRequest.Line.credit(incomeId, amount("500.00"), "Fee income", reference))
            .build());
    }

    @Test
    @DisplayName("Reversal mirrors every entry and links back to the original")
    void testReverse_MirrorsOriginal() {
        Voucher reversal = reversalService.reverse(original.getId(), companyId, "auditor", "Entered twice");

        assertEquals(VoucherType.JOURNAL, reversal.getType());
        assertEquals(original.getId(), reversal.getReversesVoucherId());
        assertTrue(reversal.isReversal());
        assertEquals("auditor", reversal.getCreatedBy());
        assertTrue(reversal.getNarration().contains(original.getVoucherNumber()));
        assertEquals(original.getEntries().size(), reversal.getEntries().size());

        for (int i = 0; i < original.getEntries().size(); i++) {
            LedgerEntry before = original.getEntries().get(i);
            LedgerEntry after = reversal.getEntries().get(i);
            assertEquals(before.getAccountId(), after.getAccountId());
            assertEquals(before.getDirection().opposite(), after.getDirection());
            assertEquals(before.getAmount(), after.getAmount());
            assertEquals(ReferenceKind.JOURNAL_REVERSAL, after.getReference().getKind());
        }

        LocalDate today = LocalDate.now();
        assertTrue(LedgerAmounts.isZero(balanceService.accountBalance(cashId, companyId, today).getBalance()));
        assertTrue(LedgerAmounts.isZero(balanceService.accountBalance(incomeId, companyId, today).getBalance()));
    }

    @Test
    @DisplayName("A voucher is reversed at most once")
    void testReverse_Twice() {
        reversalService.reverse(original.getId(), companyId, ACTOR, "First");

        LedgerStateConflictException e = assertThrows(LedgerStateConflictException.class,
            () -> reversalService.reverse(original.getId(), companyId, ACTOR, "Second"));
        assertEquals(ReversalService.ALREADY_REVERSED, e.getErrorCode());
        assertTrue(ledgerService.findReversalOf(original.getId()).isPresent());
    }

    @Test
    @DisplayName("A voucher without entries has nothing to reverse")
    void testReverse_NothingToReverse() {
        UUID emptyVoucherId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO vouchers (id, company_id, voucher_type, voucher_date, narration, created_by) " +
            "VALUES (?, ?, 'JOURNAL', ?, 'Abandoned draft', ?)",
            emptyVoucherId, companyId, LocalDate.of(2024, 8, 6), ACTOR);

        NothingToReverseException e = assertThrows(NothingToReverseException.class,
            () -> reversalService.reverse(emptyVoucherId, companyId, ACTOR, "Cleanup"));

        assertEquals(NothingToReverseException.ERROR_CODE, e.getErrorCode());
        assertTrue(ledgerService.findReversalOf(emptyVoucherId).isEmpty());
    }

    @Test
    @DisplayName("Recent modifications list the reversal with its original voucher")
    void testRecentModifications() {
        Voucher reversal = reversalService.reverse(original.getId(), companyId, ACTOR, "Wrong amount");

        List<ReversalSummary> recent = reversalService.recentModifications(companyId, 7);

        assertEquals(1, recent.size());
        ReversalSummary summary = recent.get(0);
        assertEquals(reversal.getId(), summary.getReversalVoucherId());
        assertEquals(original.getVoucherNumber(), summary.getOriginalVoucherNumber());
        assertEquals(VoucherType.RECEIPT, summary.getOriginalVoucherType());
        assertEquals(new BigDecimal("500.00"), summary.getAmount());
    }
}
