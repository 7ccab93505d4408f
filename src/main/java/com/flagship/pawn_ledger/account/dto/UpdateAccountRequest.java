package com.flagship.pawn_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.account.AccountType;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Omitted fields keep their current value.
 */
@Value
public class UpdateAccountRequest {

    @Size(max = 200)
    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;
}
