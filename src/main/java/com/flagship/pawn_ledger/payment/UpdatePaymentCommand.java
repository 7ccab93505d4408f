package com.flagship.pawn_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Correction of a recorded payment. Null fields keep the current value.
 */
@Value
@Builder
public class UpdatePaymentCommand {
    UUID paymentId;
    UUID companyId;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal interestAmount;
    BigDecimal principalAmount;
    BigDecimal penaltyAmount;
    BigDecimal discountAmount;
    PaymentMethod paymentMethod;
    String bankReference;
    String notes;
    String reason;
    String actor;
}
