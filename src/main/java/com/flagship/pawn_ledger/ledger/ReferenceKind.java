package com.flagship.pawn_ledger.ledger;

/**
 * Kind of business object a ledger entry points back to.
 */
public enum ReferenceKind {
    PLEDGE,
    PAYMENT,
    PLEDGE_REVERSAL,
    PAYMENT_REVERSAL,
    JOURNAL_REVERSAL,
    YEAR_END_CLOSING,
    YEAR_OPENING,
    MANUAL;

    public ReferenceKind reversal() {
        switch (this) {
            case PAYMENT:
                return PAYMENT_REVERSAL;
            case PLEDGE:
                return PLEDGE_REVERSAL;
            default:
                return JOURNAL_REVERSAL;
        }
    }
}
