package com.flagship.pawn_ledger.fiscal;

import lombok.Value;

import java.time.LocalDate;
import java.time.MonthDay;

/**
 * A company's financial year, identified by the calendar year it starts in and
 * labelled {@code 2024-25}. Derived from the fiscal start; never stored.
 */
@Value
public class FinancialYear {
    int startYear;
    LocalDate startDate;
    LocalDate endDate;

    public static FinancialYear starting(int startYear, MonthDay fiscalStart) {
        LocalDate start = fiscalStart.atYear(startYear);
        return new FinancialYear(startYear, start, start.plusYears(1).minusDays(1));
    }

    public static FinancialYear containing(LocalDate date, MonthDay fiscalStart) {
        LocalDate startThisYear = fiscalStart.atYear(date.getYear());
        int startYear = date.isBefore(startThisYear) ? date.getYear() - 1 : date.getYear();
        return starting(startYear, fiscalStart);
    }

    public static String labelOf(int startYear) {
        return String.format("%d-%02d", startYear, (startYear + 1) % 100);
    }

    public FinancialYear previous() {
        return starting(startYear - 1, MonthDay.from(startDate));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public String getLabel() {
        return labelOf(startYear);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
