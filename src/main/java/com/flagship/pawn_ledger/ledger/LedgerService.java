package com.flagship.pawn_ledger.ledger;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.event.VoucherPostedEvent;
import com.flagship.pawn_ledger.exception.LedgerException;
import com.flagship.pawn_ledger.exception.LedgerInvariantViolationException;
import com.flagship.pawn_ledger.exception.LedgerReferenceException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.PeriodClosedException;
import com.flagship.pawn_ledger.exception.UnbalancedVoucherException;
import com.flagship.pawn_ledger.fiscal.FinancialYear;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Posting engine: writes one voucher and its entries atomically.
 *
 * Invariants enforced here:
 * <ol>
 *   <li>debits equal credits within {@link LedgerAmounts#TOLERANCE}</li>
 *   <li>every account belongs to the voucher's company</li>
 *   <li>nothing is posted into a closed financial year</li>
 *   <li>the persisted totals equal the requested ones</li>
 * </ol>
 * The database re-checks the balance at commit and rejects updates or deletes of
 * entries. No pledge or settlement logic lives here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String ENTRY_COLUMNS =
        "id, voucher_id, company_id, account_id, direction, amount, narration, " +
        "reference_kind, reference_id, transaction_date, sequence_number";

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Posts a voucher.
     *
     * @throws LedgerValidationException   on empty, unbalanced or malformed requests, or inactive accounts
     * @throws LedgerReferenceException    if the company or an account does not exist in the company
     * @throws PeriodClosedException       if the voucher date falls in a closed financial year
     * @throws LedgerInvariantViolationException if the stored totals differ from the request
     */
    @Transactional
    public Voucher post(PostingRequest request) {
        Instant started = Instant.now();
        // Callers such as the year-end run may already have set the company key.
        String outerCompanyId = MDC.get(CorrelationContext.COMPANY_ID_MDC_KEY);
        MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, String.valueOf(request.getCompanyId()));
        try {
            validateRequest(request);
            lockCompanyShared(request.getCompanyId());
            guardClosedPeriod(request);
            validateAccounts(request);

            Voucher voucher = write(request);
            outboxService.record(VoucherPostedEvent.from(voucher));

            metrics.recordVoucherPosted(request.getVoucherType().name());
            metrics.recordPostingDuration(Duration.between(started, Instant.now()));
            log.info("Posted voucher {} ({}) dated {}: {} entries, total {}",
                voucher.getVoucherNumber(), voucher.getId(), voucher.getVoucherDate(),
                voucher.getEntries().size(), voucher.getTotalDebits());
            return voucher;
        } catch (LedgerException e) {
            metrics.recordVoucherRejected(e.getErrorCode());
            throw e;
        } finally {
            if (outerCompanyId == null) {
                MDC.remove(CorrelationContext.COMPANY_ID_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.COMPANY_ID_MDC_KEY, outerCompanyId);
            }
        }
    }

    @Transactional(readOnly = true)
    public Voucher getVoucher(UUID voucherId, UUID companyId) {
        return findVoucher(voucherId, companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Voucher", voucherId));
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findVoucher(UUID voucherId, UUID companyId) {
        List<Voucher> headers = jdbcTemplate.query(
            "SELECT id, sequence_number, company_id, voucher_type, voucher_date, narration, created_by, " +
            "created_at, reverses_voucher_id FROM vouchers WHERE id = ? AND company_id = ?",
            (rs, rowNum) -> new Voucher(
                rs.getObject("id", UUID.class),
                rs.getLong("sequence_number"),
                rs.getObject("company_id", UUID.class),
                VoucherType.valueOf(rs.getString("voucher_type")),
                rs.getObject("voucher_date", LocalDate.class),
                rs.getString("narration"),
                rs.getString("created_by"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getObject("reverses_voucher_id", UUID.class),
                List.of()),
            voucherId, companyId);

        return headers.stream().findFirst().map(header -> withEntries(header, findEntries(header.getId())));
    }

    /**
     * Entries of one voucher in insertion order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> findEntries(UUID voucherId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE voucher_id = ? ORDER BY sequence_number",
            entryRowMapper(), voucherId);
    }

    /**
     * The voucher that reverses the given one, if any.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findReversalOf(UUID voucherId) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM vouchers WHERE reverses_voucher_id = ?", UUID.class, voucherId)
            .stream()
            .findFirst();
    }

    /**
     * Vouchers of the company dated within the window that carry no entries.
     */
    @Transactional(readOnly = true)
    public long countUnpostedVouchers(UUID companyId, LocalDate from, LocalDate to) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vouchers v WHERE v.company_id = ? AND v.voucher_date BETWEEN ? AND ? " +
            "AND NOT EXISTS (SELECT 1 FROM ledger_entries e WHERE e.voucher_id = v.id)",
            Long.class, companyId, from, to);
        return count != null ? count : 0L;
    }

    /**
     * Vouchers without entries across all companies.
     */
    @Transactional(readOnly = true)
    public long countUnpostedVouchers() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vouchers v " +
            "WHERE NOT EXISTS (SELECT 1 FROM ledger_entries e WHERE e.voucher_id = v.id)",
            Long.class);
        return count != null ? count : 0L;
    }

    private void validateRequest(PostingRequest request) {
        if (request.getCompanyId() == null || request.getVoucherType() == null || request.getVoucherDate() == null) {
            throw new LedgerValidationException("INVALID_VOUCHER", "Company, voucher type and date are required");
        }
        if (request.getActor() == null || request.getActor().isBlank()) {
            throw new LedgerValidationException("MISSING_ACTOR", "Every voucher must record the acting user");
        }
        if (request.getLines().isEmpty()) {
            throw new LedgerValidationException("EMPTY_VOUCHER", "A voucher needs at least one entry");
        }
        if (!request.isBalanced()) {
            log.warn("Rejected unbalanced {} voucher: debits={}, credits={}",
                request.getVoucherType(), request.getDebitTotal(), request.getCreditTotal());
            throw new UnbalancedVoucherException(request.getDebitTotal(), request.getCreditTotal());
        }
    }

    /**
     * Waits while a year close or open holds the company row exclusively.
     */
    private void lockCompanyShared(UUID companyId) {
        List<UUID> locked = jdbcTemplate.queryForList(
            "SELECT id FROM companies WHERE id = ? FOR SHARE", UUID.class, companyId);
        if (locked.isEmpty()) {
            throw LedgerReferenceException.notFound("Company", companyId);
        }
    }

    /**
     * Rejects any date up to the end of the latest closed year, unclosed years
     * before it included. Balances restart at the carry-forward voucher, so an
     * entry dated behind it would never be counted again.
     */
    private void guardClosedPeriod(PostingRequest request) {
        if (request.getVoucherType() == VoucherType.YEAR_END_CLOSING) {
            return;
        }
        List<Integer> closedYears = jdbcTemplate.queryForList(
            "SELECT financial_year FROM financial_year_closings " +
            "WHERE company_id = ? AND period_end >= ? ORDER BY period_end LIMIT 1",
            Integer.class, request.getCompanyId(), request.getVoucherDate());
        if (!closedYears.isEmpty()) {
            throw new PeriodClosedException(request.getVoucherDate(), FinancialYear.labelOf(closedYears.get(0)));
        }
    }

    private void validateAccounts(PostingRequest request) {
        Set<UUID> accountIds = new LinkedHashSet<>();
        request.getLines().forEach(line -> accountIds.add(line.getAccountId()));

        Map<UUID, Account> accounts = accountService.findAccounts(request.getCompanyId(), accountIds);
        boolean inactiveAllowed = request.getVoucherType().isYearEnd() || request.getReversesVoucherId() != null;

        for (UUID accountId : accountIds) {
            Account account = accounts.get(accountId);
            if (account == null) {
                throw new LedgerReferenceException("ACCOUNT_NOT_FOUND",
                    "Account " + accountId + " not found in company " + request.getCompanyId());
            }
            if (!account.isActive() && !inactiveAllowed) {
                throw new LedgerValidationException("INACTIVE_ACCOUNT",
                    "Account " + account.getCode() + " is inactive");
            }
        }
    }

    private Voucher write(PostingRequest request) {
        UUID voucherId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO vouchers (id, company_id, voucher_type, voucher_date, narration, created_by, reverses_voucher_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            voucherId, request.getCompanyId(), request.getVoucherType().name(), request.getVoucherDate(),
            request.getNarration(), request.getActor(), request.getReversesVoucherId());

        for (PostingRequest.Line line : request.getLines()) {
            EntryReference reference = line.getReference();
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, voucher_id, company_id, account_id, direction, amount, narration, " +
                "reference_kind, reference_id, transaction_date) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(), voucherId, request.getCompanyId(), line.getAccountId(),
                line.getDirection().name(), line.getAmount(), line.getNarration(),
                reference != null ? reference.getKind().name() : null,
                reference != null ? reference.getId() : null,
                request.getVoucherDate());
        }

        Voucher persisted = getVoucher(voucherId, request.getCompanyId());
        if (persisted.getEntries().size() != request.getLines().size()
            || !LedgerAmounts.sameAmount(persisted.getTotalDebits(), request.getDebitTotal())
            || !LedgerAmounts.sameAmount(persisted.getTotalCredits(), request.getCreditTotal())) {
            log.error("Persisted totals of voucher {} differ from request: debits {} vs {}, credits {} vs {}",
                voucherId, persisted.getTotalDebits(), request.getDebitTotal(),
                persisted.getTotalCredits(), request.getCreditTotal());
            throw new LedgerInvariantViolationException("Persisted totals of voucher " + voucherId + " do not match");
        }
        return persisted;
    }

    private Voucher withEntries(Voucher header, List<LedgerEntry> entries) {
        return new Voucher(header.getId(), header.getSequenceNumber(), header.getCompanyId(), header.getType(),
            header.getVoucherDate(), header.getNarration(), header.getCreatedBy(), header.getCreatedAt(),
            header.getReversesVoucherId(), List.copyOf(entries));
    }

    static RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            String kind = rs.getString("reference_kind");
            EntryReference reference = kind == null ? null
                : EntryReference.of(ReferenceKind.valueOf(kind), rs.getObject("reference_id", UUID.class));
            return new LedgerEntry(
                rs.getObject("id", UUID.class),
                rs.getObject("voucher_id", UUID.class),
                rs.getObject("company_id", UUID.class),
                rs.getObject("account_id", UUID.class),
                EntryDirection.valueOf(rs.getString("direction")),
                rs.getBigDecimal("amount"),
                rs.getString("narration"),
                reference,
                rs.getObject("transaction_date", LocalDate.class),
                rs.getLong("sequence_number"));
        };
    }
}
