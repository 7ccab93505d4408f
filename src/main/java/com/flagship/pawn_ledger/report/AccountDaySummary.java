package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Debit and credit totals of each account touched on one day.
 */
@Value
public class AccountDaySummary {
    UUID companyId;
    LocalDate date;
    List<Line> accounts;
    BigDecimal totalDebits;
    BigDecimal totalCredits;

    @Value
    public static class Line {
        UUID accountId;
        String code;
        String name;
        AccountType type;
        BigDecimal debits;
        BigDecimal credits;
        long entryCount;
    }
}
