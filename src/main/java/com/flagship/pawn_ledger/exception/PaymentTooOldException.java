package com.flagship.pawn_ledger.exception;

import java.util.Map;
import java.util.UUID;

public class PaymentTooOldException extends LedgerStateConflictException {

    public static final String ERROR_CODE = "PAYMENT_TOO_OLD";

    public PaymentTooOldException(UUID paymentId, String action, long ageDays, int windowDays) {
        super(ERROR_CODE,
                String.format("Payment %s is %d days old; %s is only allowed within %d days",
                        paymentId, ageDays, action, windowDays),
                Map.of("age_days", String.valueOf(ageDays), "window_days", String.valueOf(windowDays)));
    }
}
