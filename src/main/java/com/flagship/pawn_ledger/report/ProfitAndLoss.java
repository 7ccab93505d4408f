package com.flagship.pawn_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Income and expense of one financial year, before the year-end closing voucher.
 */
@Value
@Builder
public class ProfitAndLoss {
    UUID companyId;
    String financialYear;
    LocalDate periodStart;
    LocalDate periodEnd;
    List<Line> income;
    List<Line> expenses;
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal netProfit;
    BigDecimal profitPercentage;

    @Value
    public static class Line {
        UUID accountId;
        String code;
        String name;
        BigDecimal amount;
    }
}
