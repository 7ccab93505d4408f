package com.flagship.pawn_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for recording a payment. A missing payment date means today; a missing
 * receipt number is generated.
 */
@Value
@Builder
public class RecordPaymentCommand {
    UUID companyId;
    UUID pledgeId;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal interestAmount;
    BigDecimal principalAmount;
    BigDecimal penaltyAmount;
    BigDecimal discountAmount;
    PaymentMethod paymentMethod;
    String bankReference;
    String receiptNumber;
    String notes;
    String actor;
}
