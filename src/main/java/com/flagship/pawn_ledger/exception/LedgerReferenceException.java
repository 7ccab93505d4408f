package com.flagship.pawn_ledger.exception;

import java.util.UUID;

/**
 * A referenced company, account, customer, pledge, payment or voucher does not exist
 * within the caller's company.
 */
public class LedgerReferenceException extends LedgerException {

    public LedgerReferenceException(String errorCode, String message) {
        super(ErrorKind.REFERENTIAL, errorCode, message);
    }

    public static LedgerReferenceException notFound(String entity, UUID id) {
        return new LedgerReferenceException(
                entity.toUpperCase().replace(' ', '_') + "_NOT_FOUND",
                entity + " not found: " + id);
    }
}
