package com.flagship.pawn_ledger.exception;

import java.util.Map;

public class PendingUnpostedVouchersException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "PENDING_UNPOSTED_VOUCHERS";

    public PendingUnpostedVouchersException(String financialYear, long count) {
        super(ERROR_CODE,
                "Financial year " + financialYear + " has " + count + " voucher(s) without ledger entries",
                Map.of("unposted_vouchers", String.valueOf(count)));
    }
}
