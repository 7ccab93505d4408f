package com.flagship.pawn_ledger.exception;

public class PriorYearNotClosedException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "PRIOR_YEAR_NOT_CLOSED";

    public PriorYearNotClosedException(String financialYear, String priorYear) {
        super(ERROR_CODE, "Cannot open " + financialYear + ": prior year " + priorYear + " is not closed");
    }
}
