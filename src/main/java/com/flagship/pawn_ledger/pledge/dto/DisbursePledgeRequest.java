package com.flagship.pawn_ledger.pledge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.pledge.DisbursePledgeCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class DisbursePledgeRequest {

    @NotNull(message = "Customer is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotNull(message = "Scheme is required")
    @JsonProperty("scheme_id")
    UUID schemeId;

    @Size(max = 40)
    @JsonProperty("pledge_no")
    String pledgeNo;

    @NotNull(message = "Principal is required")
    @DecimalMin(value = "0.01", message = "Principal must be greater than 0")
    @JsonProperty("principal")
    BigDecimal principal;

    @DecimalMin(value = "0.00", message = "First month interest cannot be negative")
    @JsonProperty("first_month_interest")
    BigDecimal firstMonthInterest;

    @DecimalMin(value = "0.00", message = "Document charges cannot be negative")
    @JsonProperty("document_charges")
    BigDecimal documentCharges;

    @NotNull(message = "Pledge date is required")
    @JsonProperty("pledge_date")
    LocalDate pledgeDate;

    public DisbursePledgeCommand toCommand(UUID companyId, String actor) {
        return DisbursePledgeCommand.builder()
            .companyId(companyId)
            .customerId(customerId)
            .schemeId(schemeId)
            .pledgeNo(pledgeNo)
            .principal(principal)
            .firstMonthInterest(firstMonthInterest)
            .documentCharges(documentCharges)
            .pledgeDate(pledgeDate)
            .actor(actor)
            .build();
    }
}
