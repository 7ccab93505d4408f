package com.flagship.pawn_ledger.exception;

public class AlreadyClosedException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "ALREADY_CLOSED";

    public AlreadyClosedException(String financialYear) {
        super(ERROR_CODE, "Financial year " + financialYear + " is already closed");
    }
}
