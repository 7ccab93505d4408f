package com.flagship.pawn_ledger.master;

import com.flagship.pawn_ledger.exception.LedgerReferenceException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Companies, customers and schemes.
 *
 * These records are owned by the surrounding back office; the ledger only
 * creates and reads the fields it needs, and keeps the customer to sub-account link.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MasterDataService {

    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public Company createCompany(String name, int fiscalStartMonth, int fiscalStartDay) {
        if (fiscalStartMonth < 1 || fiscalStartMonth > 12 || fiscalStartDay < 1 || fiscalStartDay > 28) {
            throw new LedgerValidationException("INVALID_FISCAL_START",
                "Fiscal start must be a month 1-12 and a day 1-28");
        }
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO companies (id, name, fiscal_start_month, fiscal_start_day) VALUES (?, ?, ?, ?)",
            id, name, fiscalStartMonth, fiscalStartDay);
        log.info("Created company {} ({}), fiscal year starts {}/{}", id, name, fiscalStartDay, fiscalStartMonth);
        return new Company(id, name, fiscalStartMonth, fiscalStartDay);
    }

    @Transactional
    public Company createCompany(String name) {
        return createCompany(name, 4, 1);
    }

    @Transactional(readOnly = true)
    public Company getCompany(UUID companyId) {
        return jdbcTemplate.query(
                "SELECT id, name, fiscal_start_month, fiscal_start_day FROM companies WHERE id = ?",
                companyRowMapper(), companyId)
            .stream()
            .findFirst()
            .orElseThrow(() -> LedgerReferenceException.notFound("Company", companyId));
    }

    /**
     * Locks the company row exclusively until the surrounding transaction ends.
     * Postings take a share lock on the same row, so they wait for the holder.
     */
    @Transactional
    public Company lockCompany(UUID companyId) {
        return jdbcTemplate.query(
                "SELECT id, name, fiscal_start_month, fiscal_start_day FROM companies WHERE id = ? FOR UPDATE",
                companyRowMapper(), companyId)
            .stream()
            .findFirst()
            .orElseThrow(() -> LedgerReferenceException.notFound("Company", companyId));
    }

    @Transactional
    public Customer createCustomer(UUID companyId, String name, String phone) {
        getCompany(companyId);
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO customers (id, company_id, name, phone) VALUES (?, ?, ?, ?)",
            id, companyId, name, phone);
        return new Customer(id, companyId, name, phone, null);
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(UUID customerId, UUID companyId) {
        return jdbcTemplate.query(
                "SELECT id, company_id, name, phone, ledger_account_id FROM customers WHERE id = ? AND company_id = ?",
                customerRowMapper(), customerId, companyId)
            .stream()
            .findFirst()
            .orElseThrow(() -> LedgerReferenceException.notFound("Customer", customerId));
    }

    @Transactional
    public Customer lockCustomer(UUID customerId, UUID companyId) {
        return jdbcTemplate.query(
                "SELECT id, company_id, name, phone, ledger_account_id FROM customers " +
                "WHERE id = ? AND company_id = ? FOR UPDATE",
                customerRowMapper(), customerId, companyId)
            .stream()
            .findFirst()
            .orElseThrow(() -> LedgerReferenceException.notFound("Customer", customerId));
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findCustomerByLedgerAccount(UUID accountId) {
        return jdbcTemplate.query(
                "SELECT id, company_id, name, phone, ledger_account_id FROM customers WHERE ledger_account_id = ?",
                customerRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    @Transactional
    public void linkLedgerAccount(UUID customerId, UUID accountId) {
        jdbcTemplate.update("UPDATE customers SET ledger_account_id = ? WHERE id = ?", accountId, customerId);
    }

    @Transactional
    public void clearLedgerAccountLink(UUID accountId) {
        jdbcTemplate.update("UPDATE customers SET ledger_account_id = NULL WHERE ledger_account_id = ?", accountId);
    }

    @Transactional
    public Scheme createScheme(UUID companyId, String name, BigDecimal monthlyRate, int durationMonths) {
        getCompany(companyId);
        if (monthlyRate == null || monthlyRate.signum() <= 0 || durationMonths <= 0) {
            throw new LedgerValidationException("INVALID_SCHEME",
                "Scheme needs a positive monthly rate and duration");
        }
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO schemes (id, company_id, name, monthly_rate, duration_months) VALUES (?, ?, ?, ?, ?)",
            id, companyId, name, monthlyRate, durationMonths);
        return new Scheme(id, companyId, name, monthlyRate, durationMonths);
    }

    @Transactional(readOnly = true)
    public Scheme getScheme(UUID schemeId, UUID companyId) {
        List<Scheme> schemes = jdbcTemplate.query(
            "SELECT id, company_id, name, monthly_rate, duration_months FROM schemes WHERE id = ? AND company_id = ?",
            (rs, rowNum) -> new Scheme(
                rs.getObject("id", UUID.class),
                rs.getObject("company_id", UUID.class),
                rs.getString("name"),
                rs.getBigDecimal("monthly_rate"),
                rs.getInt("duration_months")),
            schemeId, companyId);
        return schemes.stream()
            .findFirst()
            .orElseThrow(() -> LedgerReferenceException.notFound("Scheme", schemeId));
    }

    private RowMapper<Company> companyRowMapper() {
        return (rs, rowNum) -> new Company(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getInt("fiscal_start_month"),
            rs.getInt("fiscal_start_day"));
    }

    private RowMapper<Customer> customerRowMapper() {
        return (rs, rowNum) -> new Customer(
            rs.getObject("id", UUID.class),
            rs.getObject("company_id", UUID.class),
            rs.getString("name"),
            rs.getString("phone"),
            rs.getObject("ledger_account_id", UUID.class));
    }
}
