package com.flagship.pawn_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Debit and credit totals of a voucher differ by at least the ledger tolerance.
 */
@Getter
public class UnbalancedVoucherException extends LedgerValidationException {

    public static final String ERROR_CODE = "UNBALANCED_VOUCHER";

    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;
    private final BigDecimal difference;

    public UnbalancedVoucherException(BigDecimal totalDebits, BigDecimal totalCredits) {
        super(ERROR_CODE,
                String.format("Voucher is not balanced: debits=%s, credits=%s, difference=%s",
                        totalDebits, totalCredits, totalDebits.subtract(totalCredits)),
                Map.of("total_debits", totalDebits.toPlainString(),
                        "total_credits", totalCredits.toPlainString(),
                        "difference", totalDebits.subtract(totalCredits).toPlainString()));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
        this.difference = totalDebits.subtract(totalCredits);
    }
}
