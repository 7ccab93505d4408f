package com.flagship.pawn_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.payment.PaymentMethod;
import com.flagship.pawn_ledger.payment.UpdatePaymentCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Omitted fields keep their current value.
 */
@Value
public class UpdatePaymentRequest {

    @JsonProperty("payment_date")
    LocalDate paymentDate;

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

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @Size(max = 100)
    @JsonProperty("bank_reference")
    String bankReference;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("reason")
    String reason;

    public UpdatePaymentCommand toCommand(UUID paymentId, UUID companyId, String actor) {
        return UpdatePaymentCommand.builder()
            .paymentId(paymentId)
            .companyId(companyId)
            .paymentDate(paymentDate)
            .amount(amount)
            .interestAmount(interestAmount)
            .principalAmount(principalAmount)
            .penaltyAmount(penaltyAmount)
            .discountAmount(discountAmount)
            .paymentMethod(paymentMethod)
            .bankReference(bankReference)
            .notes(notes)
            .reason(reason)
            .actor(actor)
            .build();
    }
}
