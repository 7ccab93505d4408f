package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.payment.PaymentMethod;
import com.flagship.pawn_ledger.payment.RecordPaymentCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class RecordPaymentRequest {

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0.00", message = "Interest amount cannot be negative")
    @JsonProperty("interest_amount")
    BigDecimal interestAmount;

    @DecimalMin(value = "0.00", message = "Principal amount cannot be negative")
    @JsonProperty("principal_amount")
    BigDecimal principalAmount;

    @DecimalMin(value = "0.00", message = "Penalty amount cannot be negative")
    @JsonProperty("penalty_amount")
    BigDecimal penaltyAmount;

    @DecimalMin(value = "0.00", message = "Discount amount cannot be negative")
    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @Size(max = 100)
    @JsonProperty("bank_reference")
    String bankReference;

    @Size(max = 50)
    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("notes")
    String notes;

    public RecordPaymentCommand toCommand(UUID companyId, UUID pledgeId, String actor) {
        return RecordPaymentCommand.builder()
            .companyId(companyId)
            .pledgeId(pledgeId)
            .paymentDate(paymentDate)
            .amount(amount)
            .interestAmount(interestAmount)
            .principalAmount(principalAmount)
            .penaltyAmount(penaltyAmount)
            .discountAmount(discountAmount)
            .paymentMethod(paymentMethod)
            .bankReference(bankReference)
            .receiptNumber(receiptNumber)
            .notes(notes)
            .actor(actor)
            .build();
    }
}
