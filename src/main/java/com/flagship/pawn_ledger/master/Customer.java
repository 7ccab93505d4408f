package com.flagship.pawn_ledger.master;

import lombok.Value;

import java.util.UUID;

/**
 * Customer master data, limited to what the ledger consumes.
 */
@Value
public class Customer {
    UUID id;
    UUID companyId;
    String name;
    String phone;
    UUID ledgerAccountId;

    public boolean hasLedgerAccount() {
        return ledgerAccountId != null;
    }
}
