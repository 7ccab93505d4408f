package com.flagship.pawn_ledger.pledge;

/**
 * Lifecycle of a pledge. Derived from the ledger-relevant payment totals; moves
 * backwards only when a payment is reversed or deleted.
 */
public enum PledgeStatus {
    ACTIVE,
    PARTIAL_PAID,
    REDEEMED
}
