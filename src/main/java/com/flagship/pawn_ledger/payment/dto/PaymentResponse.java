package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.payment.PaymentMethod;
import com.flagship.pawn_ledger.payment.PledgePayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("pledge_id")
    UUID pledgeId;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @JsonProperty("penalty_amount")
    BigDecimal penaltyAmount;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("balance_amount")
    BigDecimal balanceAmount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("bank_reference")
    String bankReference;

    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("voucher_id")
    UUID voucherId;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(PledgePayment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .pledgeId(payment.getPledgeId())
            .paymentDate(payment.getPaymentDate())
            .amount(payment.getAmount())
            .interestAmount(payment.getInterestAmount())
            .principalAmount(payment.getPrincipalAmount())
            .penaltyAmount(payment.getPenaltyAmount())
            .discountAmount(payment.getDiscountAmount())
            .balanceAmount(payment.getBalanceAmount())
            .paymentMethod(payment.getPaymentMethod())
            .bankReference(payment.getBankReference())
            .receiptNumber(payment.getReceiptNumber())
            .notes(payment.getNotes())
            .voucherId(payment.getVoucherId())
            .createdBy(payment.getCreatedBy())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
