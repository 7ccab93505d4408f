package com.flagship.pawn_ledger.account;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.exception.DuplicateAccountCodeException;
import com.flagship.pawn_ledger.exception.InvalidParentAccountException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.MissingParentAccountException;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.master.Company;
import com.flagship.pawn_ledger.master.Customer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    private UUID companyId;

    @BeforeEach
    void setUp() {
        Company company = newCompany();
        companyId = company.getId();
    }

    @Test
    @DisplayName("Initializing the chart twice creates nothing the second time")
    void testInitializeChart_Idempotent() {
        int before = accountService.listAccounts(companyId).size();

        List<Account> created = accountService.initializeChartOfAccounts(companyId);

        assertTrue(created.isEmpty());
        assertEquals(ChartOfAccounts.STANDARD_PAWN_CHART.size(), before);
        assertEquals(before, accountService.listAccounts(companyId).size());
    }

    @Test
    @DisplayName("The standard chart is a tree of groups and leaves")
    void testAccountTree() {
        AccountTree tree = accountService.accountTree(companyId);
        Account currentAssets = tree.findByCode("1000").orElseThrow();
        Account customers = tree.findByCode("2001").orElseThrow();

        assertTrue(tree.roots().stream().anyMatch(a -> a.getCode().equals("1000")));
        assertEquals(6, tree.children(currentAssets.getId()).size());
        assertEquals(List.of("2000"), tree.ancestors(customers.getId()).stream().map(Account::getCode).toList());
        assertEquals(AccountType.LIABILITY, customers.getType());
    }

    @Test
    @DisplayName("Account codes are unique within a company but not across companies")
    void testCreateAccount_DuplicateCode() {
        accountService.createAccount(companyId, "1201", "Gold Loan Float", AccountType.ASSET, null);

        DuplicateAccountCodeException e = assertThrows(DuplicateAccountCodeException.class,
            () -> accountService.createAccount(companyId, "1201", "Other", AccountType.ASSET, null));
        assertEquals(DuplicateAccountCodeException.ERROR_CODE, e.getErrorCode());

        Company other = masterDataService.createCompany("Other Co");
        Account sameCode = accountService.createAccount(other.getId(), "1201", "Gold Loan Float", AccountType.ASSET, null);
        assertEquals(other.getId(), sameCode.getCompanyId());
    }

    @Test
    @DisplayName("A parent must belong to the same company")
    void testCreateAccount_ForeignParent() {
        Company other = newCompany();
        UUID foreignParent = accountService.requireByCode(other.getId(), "1000").getId();

        assertThrows(InvalidParentAccountException.class,
            () -> accountService.createAccount(companyId, "1099", "Stray", AccountType.ASSET, foreignParent));
    }

    @Test
    @DisplayName("Customer sub-accounts are numbered under 2001 and reused on later calls")
    void testCustomerSubAccount() {
        Customer first = newCustomer(companyId);
        Customer second = newCustomer(companyId);

        Account firstAccount = accountService.getOrCreateCustomerSubAccount(first.getId(), companyId);
        Account again = accountService.getOrCreateCustomerSubAccount(first.getId(), companyId);
        Account secondAccount = accountService.getOrCreateCustomerSubAccount(second.getId(), companyId);

        assertEquals("2001-001", firstAccount.getCode());
        assertEquals(firstAccount.getId(), again.getId());
        assertEquals("2001-002", secondAccount.getCode());
        assertEquals(AccountType.LIABILITY, firstAccount.getType());
        assertEquals(accountService.requireByCode(companyId, "2001").getId(), firstAccount.getParentId());
        assertEquals(firstAccount.getId(), masterDataService.getCustomer(first.getId(), companyId).getLedgerAccountId());
    }

    @Test
    @DisplayName("Without the customer parent account no sub-account can be created")
    void testCustomerSubAccount_MissingParent() {
        Company bare = masterDataService.createCompany("No Chart Co");
        Customer customer = newCustomer(bare.getId());

        assertThrows(MissingParentAccountException.class,
            () -> accountService.getOrCreateCustomerSubAccount(customer.getId(), bare.getId()));
    }

    @Test
    @DisplayName("Accounts without history are deleted, accounts with entries only deactivated")
    void testDeactivate() {
        Account unused = accountService.createAccount(companyId, "5101", "Unused Expense", AccountType.EXPENSE, null);
        Account used = accountService.createAccount(companyId, "5102", "Used Expense", AccountType.EXPENSE, null);
        ledgerService.post(PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.PAYMENT)
            .voucherDate(LocalDate.of(2024, 7, 1))
            .actor(ACTOR)
            .line(PostingRequest.Line.debit(used.getId(), amount("300.00"), null, null))
            .line(PostingRequest.Line.credit(accountService.requireByCode(companyId, "1001").getId(),
                amount("300.00"), null, null))
            .build());

        assertEquals(AccountRemoval.DELETED, accountService.deactivate(unused.getId(), companyId));
        assertTrue(accountService.findAccount(unused.getId(), companyId).isEmpty());

        assertEquals(AccountRemoval.DEACTIVATED, accountService.deactivate(used.getId(), companyId));
        Account reloaded = accountService.getAccount(used.getId(), companyId);
        assertFalse(reloaded.isActive());
        assertTrue(accountService.hasEntries(used.getId()));
    }

    @Test
    @DisplayName("The type of an account with entries is frozen, its name is not")
    void testUpdateAccount_TypeLocked() {
        Account account = accountService.createAccount(companyId, "4101", "Misc Income", AccountType.INCOME, null);
        ledgerService.post(PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.RECEIPT)
            .voucherDate(LocalDate.of(2024, 7, 1))
            .actor(ACTOR)
            .line(PostingRequest.Line.debit(accountService.requireByCode(companyId, "1001").getId(),
                amount("40.00"), null, null))
            .line(PostingRequest.Line.credit(account.getId(), amount("40.00"), null, null))
            .build());

        Account renamed = accountService.updateAccount(account.getId(), companyId, "Sundry Income", null);
        assertEquals("Sundry Income", renamed.getName());

        LedgerStateConflictException e = assertThrows(LedgerStateConflictException.class,
            () -> accountService.updateAccount(account.getId(), companyId, null, AccountType.EXPENSE));
        assertEquals("ACCOUNT_TYPE_LOCKED", e.getErrorCode());
    }
}
