package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.payment.PledgePayment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a payment is recorded, and again with the new figures when it is updated.
 */
@Value
public class PaymentRecordedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PaymentRecorded";

    UUID eventId;
    UUID companyId;
    UUID paymentId;
    UUID pledgeId;
    String pledgeNo;
    String receiptNumber;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal interestAmount;
    BigDecimal principalAmount;
    BigDecimal penaltyAmount;
    BigDecimal discountAmount;
    String paymentMethod;
    UUID voucherId;
    Instant occurredAt;

    public static PaymentRecordedEvent from(PledgePayment payment, String pledgeNo) {
        return new PaymentRecordedEvent(
            UUID.randomUUID(),
            payment.getCompanyId(),
            payment.getId(),
            payment.getPledgeId(),
            pledgeNo,
            payment.getReceiptNumber(),
            payment.getPaymentDate(),
            payment.getAmount(),
            payment.getInterestAmount(),
            payment.getPrincipalAmount(),
            payment.getPenaltyAmount(),
            payment.getDiscountAmount(),
            payment.getPaymentMethod().name(),
            payment.getVoucherId(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return paymentId;
    }

    @Override
    public String getAggregateType() {
        return "Payment";
    }
}
