package com.flagship.pawn_ledger.account;

import com.flagship.pawn_ledger.account.dto.AccountNode;
import com.flagship.pawn_ledger.account.dto.CreateAccountRequest;
import com.flagship.pawn_ledger.account.dto.UpdateAccountRequest;
import com.flagship.pawn_ledger.report.AccountBalance;
import com.flagship.pawn_ledger.report.BalanceService;
import com.flagship.pawn_ledger.report.CustomerBalance;
import com.flagship.pawn_ledger.report.CustomerStatement;
import com.flagship.pawn_ledger.report.DaybookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chart of accounts and customer ledger endpoints.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final BalanceService balanceService;
    private final DaybookService daybookService;
    private final Clock clock;

    @PostMapping("/accounts/initialize")
    public ResponseEntity<List<Account>> initializeChartOfAccounts(@PathVariable("companyId") UUID companyId) {
        List<Account> created = accountService.initializeChartOfAccounts(companyId);
        return ResponseEntity.status(created.isEmpty() ? HttpStatus.OK : HttpStatus.CREATED).body(created);
    }

    @PostMapping("/accounts")
    public ResponseEntity<Account> createAccount(@PathVariable("companyId") UUID companyId,
                                                 @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(companyId, request.getCode(), request.getName(),
            request.getAccountType(), request.getParentId());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/accounts")
    public List<Account> listAccounts(@PathVariable("companyId") UUID companyId) {
        return accountService.listAccounts(companyId);
    }

    @GetMapping("/accounts/tree")
    public List<AccountNode> accountTree(@PathVariable("companyId") UUID companyId) {
        return AccountNode.forest(accountService.accountTree(companyId));
    }

    @PatchMapping("/accounts/{accountId}")
    public Account updateAccount(@PathVariable("companyId") UUID companyId,
                                 @PathVariable("accountId") UUID accountId,
                                 @Valid @RequestBody UpdateAccountRequest request) {
        return accountService.updateAccount(accountId, companyId, request.getName(), request.getAccountType());
    }

    @DeleteMapping("/accounts/{accountId}")
    public Map<String, Object> deactivateAccount(@PathVariable("companyId") UUID companyId,
                                                 @PathVariable("accountId") UUID accountId) {
        AccountRemoval removal = accountService.deactivate(accountId, companyId);
        return Map.of("account_id", accountId, "outcome", removal);
    }

    @GetMapping("/accounts/{accountId}/balance")
    public AccountBalance accountBalance(@PathVariable("companyId") UUID companyId,
                                         @PathVariable("accountId") UUID accountId,
                                         @RequestParam(name = "as_of", required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return balanceService.accountBalance(accountId, companyId, orToday(asOf));
    }

    @PostMapping("/customers/{customerId}/ledger-account")
    public Account customerLedgerAccount(@PathVariable("companyId") UUID companyId,
                                         @PathVariable("customerId") UUID customerId) {
        return accountService.getOrCreateCustomerSubAccount(customerId, companyId);
    }

    @GetMapping("/customers/{customerId}/balance")
    public CustomerBalance customerBalance(@PathVariable("companyId") UUID companyId,
                                           @PathVariable("customerId") UUID customerId,
                                           @RequestParam(name = "as_of", required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return balanceService.customerBalance(customerId, companyId, orToday(asOf));
    }

    @GetMapping("/customers/{customerId}/statement")
    public CustomerStatement customerStatement(@PathVariable("companyId") UUID companyId,
                                               @PathVariable("customerId") UUID customerId,
                                               @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                               @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return daybookService.customerStatement(customerId, companyId, from, to);
    }

    private LocalDate orToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }
}
