package com.flagship.pawn_ledger.exception;

import java.time.LocalDate;

public class YearNotEndedException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "YEAR_NOT_ENDED";

    public YearNotEndedException(String financialYear, LocalDate endDate) {
        super(ERROR_CODE, "Financial year " + financialYear + " ends on " + endDate + " and cannot be closed yet");
    }
}
