package com.flagship.pawn_ledger.exception;

import java.util.UUID;

public class MissingParentAccountException extends LedgerReferenceException {

    public static final String ERROR_CODE = "MISSING_PARENT_ACCOUNT";

    public MissingParentAccountException(String parentCode, UUID companyId) {
        super(ERROR_CODE, "Account " + parentCode + " not found in company " + companyId
                + ". Initialize the chart of accounts first.");
    }
}
