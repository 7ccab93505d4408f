package com.flagship.pawn_ledger.fiscal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Outcome of closing a financial year. {@code voucherId} is null when the year
 * had no income or expense to close.
 */
@Value
@Builder
public class YearEndClosing {
    UUID companyId;
    String financialYear;
    LocalDate periodStart;
    LocalDate periodEnd;
    UUID voucherId;
    String voucherNumber;
    BigDecimal totalIncome;
    BigDecimal totalExpenses;
    BigDecimal netProfit;
    int accountsClosed;
    String closedBy;
}
