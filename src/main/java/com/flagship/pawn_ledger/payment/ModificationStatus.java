package com.flagship.pawn_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Whether a payment can still be corrected, and why not.
 */
@Value
@Builder
public class ModificationStatus {
    UUID paymentId;
    String receiptNumber;
    LocalDate paymentDate;
    long ageDays;
    boolean canUpdate;
    boolean canDelete;
    int updateWindowDays;
    int deleteWindowDays;
    UUID voucherId;
    String voucherNumber;
    int voucherEntryCount;
}
