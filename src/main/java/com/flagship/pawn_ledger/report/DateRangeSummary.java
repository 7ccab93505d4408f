package com.flagship.pawn_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class DateRangeSummary {
    UUID companyId;
    LocalDate from;
    LocalDate to;
    List<Day> days;
    BigDecimal totalDebits;
    BigDecimal totalCredits;

    /**
     * Totals of one day that had activity.
     */
    @Value
    public static class Day {
        LocalDate date;
        long voucherCount;
        BigDecimal totalDebits;
        BigDecimal totalCredits;
        BigDecimal openingCash;
        BigDecimal closingCash;
    }
}
