package com.flagship.pawn_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One immutable debit or credit line of a voucher.
 * Entries are append-only; a correction is a reversal voucher.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID voucherId;
    UUID companyId;
    UUID accountId;
    EntryDirection direction;
    BigDecimal amount;
    String narration;
    EntryReference reference;
    LocalDate transactionDate;
    long sequenceNumber;

    public boolean isDebit() {
        return direction == EntryDirection.DEBIT;
    }

    /**
     * Debit-positive signed amount.
     */
    public BigDecimal signedAmount() {
        return isDebit() ? amount : amount.negate();
    }
}
