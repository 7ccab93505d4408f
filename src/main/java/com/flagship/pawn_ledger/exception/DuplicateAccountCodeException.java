package com.flagship.pawn_ledger.exception;

import java.util.UUID;

public class DuplicateAccountCodeException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "DUPLICATE_CODE";

    public DuplicateAccountCodeException(String code, UUID companyId) {
        super(ERROR_CODE, "Account code " + code + " already exists in company " + companyId);
    }
}
