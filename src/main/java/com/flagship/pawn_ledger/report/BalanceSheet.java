package com.flagship.pawn_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Assets against liabilities plus equity. Earnings not yet closed into retained
 * earnings are shown as an equity line without an account.
 */
@Value
@Builder
public class BalanceSheet {
    public static final String CURRENT_EARNINGS_LINE = "Current Period Earnings";

    UUID companyId;
    LocalDate asOf;
    List<Line> assets;
    List<Line> liabilities;
    List<Line> equity;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    BigDecimal totalEquity;
    BigDecimal currentPeriodEarnings;

    @JsonProperty("is_balanced")
    boolean balanced;

    @Value
    public static class Line {
        UUID accountId;
        String code;
        String name;
        BigDecimal amount;
    }
}
