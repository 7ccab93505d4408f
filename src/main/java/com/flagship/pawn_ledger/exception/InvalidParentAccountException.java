package com.flagship.pawn_ledger.exception;

import java.util.UUID;

/**
 * The parent account does not exist or belongs to a different company.
 */
public class InvalidParentAccountException extends LedgerReferenceException {

    public static final String ERROR_CODE = "INVALID_PARENT";

    public InvalidParentAccountException(UUID parentId, UUID companyId) {
        super(ERROR_CODE, "Parent account " + parentId + " does not exist in company " + companyId);
    }
}
