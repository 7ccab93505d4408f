package com.flagship.pawn_ledger.exception;

import java.util.Map;

/**
 * The request is well formed but business policy forbids it in the current state.
 */
public class LedgerStateConflictException extends LedgerException {

    public LedgerStateConflictException(String errorCode, String message) {
        super(ErrorKind.STATE_CONFLICT, errorCode, message);
    }

    public LedgerStateConflictException(String errorCode, String message, Map<String, String> details) {
        super(ErrorKind.STATE_CONFLICT, errorCode, message, details);
    }
}
