package com.flagship.pawn_ledger.exception;

/**
 * An operation that must leave the books balanced did not.
 *
 * Never auto-corrected. The message stays in the server log; callers only see a
 * generic internal ledger error.
 */
public class LedgerInvariantViolationException extends LedgerException {

    public static final String ERROR_CODE = "INTERNAL_LEDGER_ERROR";

    public LedgerInvariantViolationException(String message) {
        super(ErrorKind.CONSISTENCY, ERROR_CODE, message);
    }

    public LedgerInvariantViolationException(String message, Throwable cause) {
        super(ErrorKind.CONSISTENCY, ERROR_CODE, message, cause);
    }
}
