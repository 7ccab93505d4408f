package com.flagship.pawn_ledger.exception;

import java.time.LocalDate;

/**
 * The voucher date falls on or before the end of a closed financial year.
 */
public class PeriodClosedException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "PERIOD_CLOSED";

    public PeriodClosedException(LocalDate date, String financialYear) {
        super(ERROR_CODE, "Books are closed through financial year " + financialYear + "; cannot post on " + date);
    }
}
