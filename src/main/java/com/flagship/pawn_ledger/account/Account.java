package com.flagship.pawn_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * A node of a company's chart of accounts.
 * Plain value object; rows are read and written through {@link AccountService}.
 */
@Value
public class Account {
    UUID id;
    UUID companyId;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    boolean active;

    public boolean isRoot() {
        return parentId == null;
    }
}
