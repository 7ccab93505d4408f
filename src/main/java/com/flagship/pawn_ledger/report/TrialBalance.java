package com.flagship.pawn_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TrialBalance {
    UUID companyId;
    LocalDate asOf;
    List<Line> lines;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    @JsonProperty("is_balanced")
    boolean balanced;

    /**
     * One account's net balance, placed in the debit or the credit column.
     */
    @Value
    @Builder
    public static class Line {
        UUID accountId;
        String code;
        String name;
        AccountType type;
        boolean active;
        BigDecimal debit;
        BigDecimal credit;
    }
}
