package com.flagship.pawn_ledger.ledger;

/**
 * Side of a ledger entry.
 */
public enum EntryDirection {
    DEBIT,
    CREDIT;

    public EntryDirection opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
