package com.flagship.pawn_ledger.account;

import com.flagship.pawn_ledger.config.LedgerProperties;
import com.flagship.pawn_ledger.exception.DuplicateAccountCodeException;
import com.flagship.pawn_ledger.exception.InvalidParentAccountException;
import com.flagship.pawn_ledger.exception.LedgerReferenceException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.MissingParentAccountException;
import com.flagship.pawn_ledger.master.Customer;
import com.flagship.pawn_ledger.master.MasterDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Account registry: the chart of accounts of each company.
 *
 * Codes are unique per company and a parent always belongs to the same company
 * as its child. Accounts that carry ledger history are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final String ACCOUNT_COLUMNS =
        "id, company_id, code, name, account_type, parent_id, is_active";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final MasterDataService masterDataService;
    private final LedgerProperties properties;

    /**
     * Creates an account.
     *
     * @throws DuplicateAccountCodeException if the code is already used in the company
     * @throws InvalidParentAccountException if the parent is unknown or in another company
     */
    @Transactional
    public Account createAccount(UUID companyId, String code, String name, AccountType type, UUID parentId) {
        if (code == null || code.isBlank() || name == null || name.isBlank() || type == null) {
            throw new LedgerValidationException("INVALID_ACCOUNT", "Account code, name and type are required");
        }
        masterDataService.getCompany(companyId);

        if (parentId != null && findAccount(parentId, companyId).isEmpty()) {
            throw new InvalidParentAccountException(parentId, companyId);
        }
        if (findByCode(companyId, code).isPresent()) {
            throw new DuplicateAccountCodeException(code, companyId);
        }

        UUID accountId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, company_id, code, name, account_type, parent_id) VALUES (?, ?, ?, ?, ?, ?)",
                accountId, companyId, code, name, type.name(), parentId);
        } catch (DuplicateKeyException e) {
            throw new DuplicateAccountCodeException(code, companyId);
        }

        log.debug("Created account {} {} ({}) in company {}", code, name, type, companyId);
        return new Account(accountId, companyId, code, name, type, parentId, true);
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId, UUID companyId) {
        return findAccount(accountId, companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Account", accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(UUID accountId, UUID companyId) {
        return jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? AND company_id = ?",
                accountRowMapper(), accountId, companyId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByCode(UUID companyId, String code) {
        return jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE company_id = ? AND code = ?",
                accountRowMapper(), companyId, code)
            .stream()
            .findFirst();
    }

    /**
     * Resolves one of the well-known accounts postings are routed to.
     */
    @Transactional(readOnly = true)
    public Account requireByCode(UUID companyId, String code) {
        return findByCode(companyId, code)
            .orElseThrow(() -> new LedgerReferenceException("ACCOUNT_NOT_FOUND",
                "Account " + code + " not found in company " + companyId
                    + ". Initialize the chart of accounts first."));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID companyId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE company_id = ? ORDER BY code",
            accountRowMapper(), companyId);
    }

    @Transactional(readOnly = true)
    public AccountTree accountTree(UUID companyId) {
        return AccountTree.of(listAccounts(companyId));
    }

    /**
     * Loads the given accounts of one company, keyed by id. Ids from other
     * companies are simply absent from the result.
     */
    @Transactional(readOnly = true)
    public Map<UUID, Account> findAccounts(UUID companyId, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return Map.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("ids", accountIds);
        return namedJdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE company_id = :companyId AND id IN (:ids)",
                params, accountRowMapper())
            .stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    /**
     * Creates the standard pawn chart of accounts. Codes that already exist are
     * left untouched, so calling this twice is harmless.
     *
     * @return the accounts created by this call
     */
    @Transactional
    public List<Account> initializeChartOfAccounts(UUID companyId) {
        masterDataService.getCompany(companyId);
        List<Account> created = new ArrayList<>();

        for (ChartOfAccounts.Template template : ChartOfAccounts.STANDARD_PAWN_CHART) {
            if (findByCode(companyId, template.getCode()).isPresent()) {
                continue;
            }
            UUID parentId = null;
            if (template.getParentCode() != null) {
                parentId = requireByCode(companyId, template.getParentCode()).getId();
            }
            created.add(createAccount(companyId, template.getCode(), template.getName(), template.getType(), parentId));
        }

        log.info("Initialized chart of accounts for company {}: {} account(s) created", companyId, created.size());
        return created;
    }

    /**
     * Returns the customer's ledger sub-account, creating it on first use.
     *
     * New sub-accounts are coded {@code <parent>-NNN} with the next free suffix
     * and linked on the customer record. The customer row stays locked until the
     * transaction ends, so concurrent callers get the same account.
     *
     * @throws MissingParentAccountException if the customer parent account does not exist
     */
    @Transactional
    public Account getOrCreateCustomerSubAccount(UUID customerId, UUID companyId) {
        Customer customer = masterDataService.lockCustomer(customerId, companyId);

        if (customer.hasLedgerAccount()) {
            Optional<Account> linked = findAccount(customer.getLedgerAccountId(), companyId);
            if (linked.isPresent()) {
                return linked.get();
            }
        }

        String parentCode = properties.getAccounts().getCustomerParent();
        Account parent = findByCode(companyId, parentCode)
            .orElseThrow(() -> new MissingParentAccountException(parentCode, companyId));

        String code = nextCustomerCode(companyId, parent);
        Account account = createAccount(companyId, code, "Customer - " + customer.getName(),
            AccountType.LIABILITY, parent.getId());
        masterDataService.linkLedgerAccount(customerId, account.getId());

        log.info("Created customer sub-account {} for customer {}", code, customerId);
        return account;
    }

    /**
     * Removes an account. Accounts with entries or children are deactivated;
     * accounts without history are deleted and unlinked from their customer.
     */
    @Transactional
    public AccountRemoval deactivate(UUID accountId, UUID companyId) {
        Account account = getAccount(accountId, companyId);

        if (hasEntries(accountId) || hasChildren(accountId)) {
            String name = account.getName();
            if (masterDataService.findCustomerByLedgerAccount(accountId).isPresent() && !name.startsWith("[DELETED]")) {
                name = "[DELETED] " + name;
            }
            jdbcTemplate.update(
                "UPDATE accounts SET is_active = FALSE, name = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                name, accountId);
            log.info("Deactivated account {} ({}) in company {}", account.getCode(), accountId, companyId);
            return AccountRemoval.DEACTIVATED;
        }

        masterDataService.clearLedgerAccountLink(accountId);
        jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", accountId);
        log.info("Deleted account {} ({}) without history from company {}", account.getCode(), accountId, companyId);
        return AccountRemoval.DELETED;
    }

    /**
     * Renames an account or changes its type. The type is frozen once entries exist.
     */
    @Transactional
    public Account updateAccount(UUID accountId, UUID companyId, String name, AccountType type) {
        Account account = getAccount(accountId, companyId);
        String newName = name != null && !name.isBlank() ? name : account.getName();
        AccountType newType = type != null ? type : account.getType();

        if (newType != account.getType() && hasEntries(accountId)) {
            throw new LedgerStateConflictException("ACCOUNT_TYPE_LOCKED",
                "Account " + account.getCode() + " has ledger entries; its type cannot change");
        }

        jdbcTemplate.update(
            "UPDATE accounts SET name = ?, account_type = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            newName, newType.name(), accountId);
        return new Account(account.getId(), companyId, account.getCode(), newName, newType,
            account.getParentId(), account.isActive());
    }

    @Transactional(readOnly = true)
    public boolean hasEntries(UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM ledger_entries WHERE account_id = ?)", Boolean.class, accountId);
        return Boolean.TRUE.equals(exists);
    }

    private boolean hasChildren(UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE parent_id = ?)", Boolean.class, accountId);
        return Boolean.TRUE.equals(exists);
    }

    private String nextCustomerCode(UUID companyId, Account parent) {
        String prefix = parent.getCode() + "-";
        List<String> codes = jdbcTemplate.queryForList(
            "SELECT code FROM accounts WHERE company_id = ? AND code LIKE ?",
            String.class, companyId, prefix + "%");

        int max = 0;
        for (String code : codes) {
            String suffix = code.substring(prefix.length());
            if (suffix.chars().allMatch(Character::isDigit) && !suffix.isEmpty()) {
                max = Math.max(max, Integer.parseInt(suffix));
            }
        }
        return prefix + String.format("%03d", max + 1);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getObject("company_id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getObject("parent_id", UUID.class),
            rs.getBoolean("is_active"));
    }
}
