package com.flagship.pawn_ledger.exception;

import java.util.UUID;

public class NothingToReverseException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "NOTHING_TO_REVERSE";

    public NothingToReverseException(UUID voucherId) {
        super(ERROR_CODE, "Voucher " + voucherId + " has no ledger entries to reverse");
    }
}
