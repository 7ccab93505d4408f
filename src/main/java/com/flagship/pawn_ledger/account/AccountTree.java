package com.flagship.pawn_ledger.account;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only view of a company's chart of accounts.
 *
 * Accounts are held in an arena keyed by id; the hierarchy is the parent id on
 * each account, and children are found by filtering on it.
 */
public final class AccountTree {

    private final Map<UUID, Account> accounts;

    private AccountTree(Map<UUID, Account> accounts) {
        this.accounts = accounts;
    }

    public static AccountTree of(Collection<Account> accounts) {
        Map<UUID, Account> arena = new LinkedHashMap<>();
        accounts.stream()
            .sorted(Comparator.comparing(Account::getCode))
            .forEach(account -> arena.put(account.getId(), account));
        return new AccountTree(arena);
    }

    public Optional<Account> get(UUID accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    public Optional<Account> findByCode(String code) {
        return accounts.values().stream()
            .filter(account -> account.getCode().equals(code))
            .findFirst();
    }

    public List<Account> roots() {
        return accounts.values().stream()
            .filter(Account::isRoot)
            .collect(Collectors.toList());
    }

    public List<Account> children(UUID parentId) {
        return accounts.values().stream()
            .filter(account -> parentId.equals(account.getParentId()))
            .collect(Collectors.toList());
    }

    /**
     * Walks up the parent chain, nearest ancestor first.
     */
    public List<Account> ancestors(UUID accountId) {
        List<Account> path = new ArrayList<>();
        Account current = accounts.get(accountId);
        while (current != null && current.getParentId() != null) {
            current = accounts.get(current.getParentId());
            if (current != null) {
                path.add(current);
            }
        }
        return path;
    }

    public Collection<Account> all() {
        return accounts.values();
    }

    public int size() {
        return accounts.size();
    }
}
