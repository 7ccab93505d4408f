package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit sums of one account over a window.
 */
@Value
class AccountTotals {
    static final AccountTotals NONE = new AccountTotals(LedgerAmounts.ZERO, LedgerAmounts.ZERO);

    BigDecimal debits;
    BigDecimal credits;

    BigDecimal balanceFor(AccountType type) {
        return LedgerAmounts.normalize(type.balanceOf(debits, credits));
    }

    /**
     * Debit minus credit.
     */
    BigDecimal net() {
        return LedgerAmounts.normalize(debits.subtract(credits));
    }
}
