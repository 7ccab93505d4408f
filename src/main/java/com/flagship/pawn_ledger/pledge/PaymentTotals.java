package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Sums of the payment components recorded against one pledge.
 */
@Value
public class PaymentTotals {
    public static final PaymentTotals NONE = new PaymentTotals(
        LedgerAmounts.ZERO, LedgerAmounts.ZERO, LedgerAmounts.ZERO, LedgerAmounts.ZERO, 0);

    BigDecimal interest;
    BigDecimal principal;
    BigDecimal penalty;
    BigDecimal discount;
    long paymentCount;

    public boolean hasPayments() {
        return paymentCount > 0;
    }
}
