package com.flagship.pawn_ledger.ledger;

import com.flagship.pawn_ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PostingRequestTest {

    private final UUID cash = UUID.randomUUID();
    private final UUID customer = UUID.randomUUID();

    private PostingRequest request(String debit, String credit) {
        return PostingRequest.builder()
            .companyId(UUID.randomUUID())
            .voucherType(VoucherType.RECEIPT)
            .voucherDate(LocalDate.of(2024, 5, 1))
            .actor("test-user")
            .line(PostingRequest.Line.debit(cash, new BigDecimal(debit), null, null))
            .line(PostingRequest.Line.credit(customer, new BigDecimal(credit), null, null))
            .build();
    }

    @Test
    @DisplayName("Equal debits and credits balance")
    void testBalanced() {
        PostingRequest request = request("1500.50", "1500.50");

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("1500.50"), request.getDebitTotal());
        assertEquals(new BigDecimal("1500.50"), request.getCreditTotal());
    }

    @Test
    @DisplayName("A difference of one tolerance unit is unbalanced")
    void testUnbalancedByOneCent() {
        assertFalse(request("100.00", "99.99").isBalanced());
    }

    @Test
    @DisplayName("Amounts are normalized to two decimals half-up")
    void testAmountsNormalized() {
        PostingRequest.Line line = PostingRequest.Line.debit(cash, new BigDecimal("10.005"), null, null);

        assertEquals(new BigDecimal("10.01"), line.getAmount());
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected")
    void testNonPositiveAmountRejected() {
        LedgerValidationException zero = assertThrows(LedgerValidationException.class,
            () -> PostingRequest.Line.debit(cash, BigDecimal.ZERO, null, null));
        assertEquals("INVALID_AMOUNT", zero.getErrorCode());

        assertThrows(LedgerValidationException.class,
            () -> PostingRequest.Line.credit(cash, new BigDecimal("-5.00"), null, null));
        assertThrows(LedgerValidationException.class,
            () -> PostingRequest.Line.credit(cash, new BigDecimal("0.004"), null, null));
    }

    @Test
    @DisplayName("Reversed references keep the id and map payments to payment reversals")
    void testReferenceReversal() {
        UUID paymentId = UUID.randomUUID();
        EntryReference reversed = EntryReference.of(ReferenceKind.PAYMENT, paymentId).reversal();

        assertEquals(ReferenceKind.PAYMENT_REVERSAL, reversed.getKind());
        assertEquals(paymentId, reversed.getId());
        assertEquals(ReferenceKind.JOURNAL_REVERSAL, EntryReference.of(ReferenceKind.MANUAL, paymentId).reversal().getKind());
    }
}
