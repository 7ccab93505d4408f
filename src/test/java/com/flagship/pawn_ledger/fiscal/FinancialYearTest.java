package com.flagship.pawn_ledger.fiscal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.MonthDay;

import static org.junit.jupiter.api.Assertions.*;

class FinancialYearTest {

    private static final MonthDay APRIL_FIRST = MonthDay.of(4, 1);

    @Test
    @DisplayName("A year starting in April runs to the end of March")
    void testStarting() {
        FinancialYear year = FinancialYear.starting(2024, APRIL_FIRST);

        assertEquals(LocalDate.of(2024, 4, 1), year.getStartDate());
        assertEquals(LocalDate.of(2025, 3, 31), year.getEndDate());
        assertEquals("2024-25", year.getLabel());
    }

    @Test
    @DisplayName("Dates before the fiscal start belong to the previous year")
    void testContaining() {
        assertEquals(2023, FinancialYear.containing(LocalDate.of(2024, 3, 31), APRIL_FIRST).getStartYear());
        assertEquals(2024, FinancialYear.containing(LocalDate.of(2024, 4, 1), APRIL_FIRST).getStartYear());
        assertEquals(2024, FinancialYear.containing(LocalDate.of(2024, 12, 31), MonthDay.of(1, 1)).getStartYear());
    }

    @Test
    @DisplayName("Century rollover keeps a two-digit suffix")
    void testLabel() {
        assertEquals("2099-00", FinancialYear.labelOf(2099));
        assertEquals("2023-24", FinancialYear.starting(2024, APRIL_FIRST).previous().getLabel());
    }

    @Test
    @DisplayName("Both ends of the year are inside it")
    void testContains() {
        FinancialYear year = FinancialYear.starting(2024, APRIL_FIRST);

        assertTrue(year.contains(year.getStartDate()));
        assertTrue(year.contains(year.getEndDate()));
        assertFalse(year.contains(year.getEndDate().plusDays(1)));
    }
}
