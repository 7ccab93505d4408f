package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.ledger.EntryDirection;
import com.flagship.pawn_ledger.ledger.VoucherType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A ledger entry joined with its voucher and account, as the day book reads it.
 */
@Value
class Movement {
    UUID entryId;
    long entrySequence;
    LocalDate date;
    UUID voucherId;
    long voucherSequence;
    VoucherType voucherType;
    String voucherNarration;
    String voucherCreatedBy;
    UUID accountId;
    String accountCode;
    String accountName;
    AccountType accountType;
    EntryDirection direction;
    BigDecimal amount;
    String narration;

    String voucherNumber() {
        return voucherType.voucherNumber(voucherSequence);
    }

    boolean isDebit() {
        return direction == EntryDirection.DEBIT;
    }

    String effectiveNarration() {
        return narration != null ? narration : voucherNarration;
    }
}
