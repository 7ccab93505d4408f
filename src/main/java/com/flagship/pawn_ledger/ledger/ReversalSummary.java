package com.flagship.pawn_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One reversal voucher together with the voucher it cancelled.
 */
@Value
public class ReversalSummary {
    UUID reversalVoucherId;
    String reversalVoucherNumber;
    UUID originalVoucherId;
    String originalVoucherNumber;
    VoucherType originalVoucherType;
    LocalDate reversalDate;
    BigDecimal amount;
    String narration;
    String reversedBy;
    Instant reversedAt;
}
