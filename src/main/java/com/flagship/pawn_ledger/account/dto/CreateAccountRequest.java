package com.flagship.pawn_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.account.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 30)
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 200)
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("parent_id")
    UUID parentId;
}
