package com.flagship.pawn_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A posted transaction header together with its entries, in insertion order.
 */
@Value
public class Voucher {
    UUID id;
    long sequenceNumber;
    UUID companyId;
    VoucherType type;
    LocalDate voucherDate;
    String narration;
    String createdBy;
    Instant createdAt;
    UUID reversesVoucherId;
    List<LedgerEntry> entries;

    public String getVoucherNumber() {
        return type.voucherNumber(sequenceNumber);
    }

    public BigDecimal getTotalDebits() {
        return total(EntryDirection.DEBIT);
    }

    public BigDecimal getTotalCredits() {
        return total(EntryDirection.CREDIT);
    }

    public boolean isBalanced() {
        return LedgerAmounts.sameAmount(getTotalDebits(), getTotalCredits());
    }

    public boolean isReversal() {
        return reversesVoucherId != null;
    }

    private BigDecimal total(EntryDirection direction) {
        return entries.stream()
            .filter(e -> e.getDirection() == direction)
            .map(LedgerEntry::getAmount)
            .reduce(LedgerAmounts.ZERO, BigDecimal::add);
    }
}
