package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.ledger.Voucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published for every voucher the posting engine writes, reversals and
 * year-end vouchers included.
 */
@Value
public class VoucherPostedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "VoucherPosted";

    UUID eventId;
    UUID companyId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    LocalDate voucherDate;
    BigDecimal totalAmount;
    int entryCount;
    UUID reversesVoucherId;
    String createdBy;
    Instant occurredAt;

    public static VoucherPostedEvent from(Voucher voucher) {
        return new VoucherPostedEvent(
            UUID.randomUUID(),
            voucher.getCompanyId(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getType().name(),
            voucher.getVoucherDate(),
            voucher.getTotalDebits(),
            voucher.getEntries().size(),
            voucher.getReversesVoucherId(),
            voucher.getCreatedBy(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return voucherId;
    }

    @Override
    public String getAggregateType() {
        return "Voucher";
    }
}
