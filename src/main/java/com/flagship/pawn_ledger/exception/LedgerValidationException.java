package com.flagship.pawn_ledger.exception;

import java.util.Map;

/**
 * Input rejected before any write: bad amounts, missing fields, malformed requests.
 */
public class LedgerValidationException extends LedgerException {

    public LedgerValidationException(String errorCode, String message) {
        super(ErrorKind.VALIDATION, errorCode, message);
    }

    public LedgerValidationException(String errorCode, String message, Map<String, String> details) {
        super(ErrorKind.VALIDATION, errorCode, message, details);
    }
}
