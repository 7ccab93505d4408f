package com.flagship.pawn_ledger.payment;

/**
 * How the customer paid. Everything but cash is received into the bank account.
 */
public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHEQUE,
    UPI;

    public boolean isCash() {
        return this == CASH;
    }
}
