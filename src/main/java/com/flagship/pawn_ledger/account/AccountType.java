package com.flagship.pawn_ledger.account;

import com.flagship.pawn_ledger.ledger.EntryDirection;

import java.math.BigDecimal;

/**
 * Account classification. Decides which side increases the balance.
 */
public enum AccountType {
    ASSET(EntryDirection.DEBIT),
    LIABILITY(EntryDirection.CREDIT),
    INCOME(EntryDirection.CREDIT),
    EXPENSE(EntryDirection.DEBIT),
    EQUITY(EntryDirection.CREDIT);

    private final EntryDirection normalSide;

    AccountType(EntryDirection normalSide) {
        this.normalSide = normalSide;
    }

    public EntryDirection getNormalSide() {
        return normalSide;
    }

    /**
     * Debit-minus-credit for debit-normal accounts, credit-minus-debit otherwise.
     */
    public BigDecimal balanceOf(BigDecimal debits, BigDecimal credits) {
        return normalSide == EntryDirection.DEBIT ? debits.subtract(credits) : credits.subtract(debits);
    }

    public boolean isProfitAndLoss() {
        return this == INCOME || this == EXPENSE;
    }
}
