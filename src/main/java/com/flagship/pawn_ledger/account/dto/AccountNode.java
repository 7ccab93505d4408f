package com.flagship.pawn_ledger.account.dto;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountTree;
import com.flagship.pawn_ledger.account.AccountType;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * One account of the chart with its children, for display.
 */
@Value
public class AccountNode {
    UUID id;
    String code;
    String name;
    AccountType accountType;
    boolean active;
    List<AccountNode> children;

    public static List<AccountNode> forest(AccountTree tree) {
        return tree.roots().stream()
            .map(root -> of(root, tree))
            .toList();
    }

    private static AccountNode of(Account account, AccountTree tree) {
        List<AccountNode> children = tree.children(account.getId()).stream()
            .map(child -> of(child, tree))
            .toList();
        return new AccountNode(account.getId(), account.getCode(), account.getName(), account.getType(),
            account.isActive(), children);
    }
}
