package com.flagship.pawn_ledger.account;

/**
 * Outcome of removing an account: accounts with history are only deactivated.
 */
public enum AccountRemoval {
    DEACTIVATED,
    DELETED
}
