package com.flagship.pawn_ledger.fiscal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Body of the close and open calls; the confirmation must be the literal {@code CONFIRM}.
 */
@Value
public class ConfirmationRequest {

    @JsonProperty("confirmation")
    String confirmation;
}
