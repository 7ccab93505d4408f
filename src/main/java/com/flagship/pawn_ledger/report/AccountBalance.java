package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Balance of one account as of a date, signed by the account's normal side.
 */
@Value
@Builder
public class AccountBalance {
    UUID accountId;
    String code;
    String name;
    AccountType type;
    LocalDate asOf;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    BigDecimal balance;
}
