package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.payment.PledgePayment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the voucher of a payment is reversed, because the payment was
 * updated or deleted.
 */
@Value
public class PaymentReversedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PaymentReversed";

    public enum Action {
        UPDATED,
        DELETED
    }

    UUID eventId;
    UUID companyId;
    UUID paymentId;
    UUID pledgeId;
    String receiptNumber;
    Action action;
    UUID originalVoucherId;
    UUID reversalVoucherId;
    String reason;
    String actor;
    Instant occurredAt;

    public static PaymentReversedEvent of(PledgePayment payment, Voucher reversal, Action action, String reason) {
        return new PaymentReversedEvent(
            UUID.randomUUID(),
            payment.getCompanyId(),
            payment.getId(),
            payment.getPledgeId(),
            payment.getReceiptNumber(),
            action,
            payment.getVoucherId(),
            reversal.getId(),
            reason,
            reversal.getCreatedBy(),
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
