package com.flagship.pawn_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A payment against a pledge.
 *
 * Invariant: {@code amount == interestAmount + principalAmount + penaltyAmount}.
 * The discount is granted on top of the amount and reduces the principal.
 * {@code balanceAmount} is a cache of the settlement balance when the payment
 * was last written; reports never read it.
 */
@Value
public class PledgePayment {
    UUID id;
    UUID companyId;
    UUID pledgeId;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal interestAmount;
    BigDecimal principalAmount;
    BigDecimal penaltyAmount;
    BigDecimal discountAmount;
    BigDecimal balanceAmount;
    PaymentMethod paymentMethod;
    String bankReference;
    String receiptNumber;
    String notes;
    UUID voucherId;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public long ageInDays(LocalDate today) {
        return ChronoUnit.DAYS.between(paymentDate, today);
    }
}
