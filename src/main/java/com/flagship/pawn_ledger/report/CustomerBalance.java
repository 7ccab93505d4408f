package com.flagship.pawn_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Balance of a customer's sub-account. Negative while the customer owes money.
 */
@Value
@Builder
public class CustomerBalance {
    UUID customerId;
    String customerName;
    UUID accountId;
    String accountCode;
    LocalDate asOf;
    BigDecimal balance;
}
