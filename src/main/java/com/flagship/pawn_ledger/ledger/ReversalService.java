package com.flagship.pawn_ledger.ledger;

import com.flagship.pawn_ledger.exception.LedgerInvariantViolationException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.NothingToReverseException;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Cancels a posted voucher with its mirror image.
 *
 * The reversal is a JOURNAL voucher dated today whose entries swap the
 * direction of every original entry. A voucher is reversed at most once; the
 * database enforces this with a unique key on {@code reverses_voucher_id}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReversalService {

    public static final String ALREADY_REVERSED = "ALREADY_REVERSED";

    private final LedgerService ledgerService;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Posts the reversal of a voucher.
     *
     * @throws NothingToReverseException   if the voucher has no entries
     * @throws LedgerStateConflictException if the voucher was already reversed
     */
    @Transactional
    public Voucher reverse(UUID voucherId, UUID companyId, String actor, String reason) {
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
        try {
            Voucher original = ledgerService.getVoucher(voucherId, companyId);
            if (original.getEntries().isEmpty()) {
                throw new NothingToReverseException(voucherId);
            }
            if (ledgerService.findReversalOf(voucherId).isPresent()) {
                throw alreadyReversed(original);
            }

            PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
                .companyId(companyId)
                .voucherType(VoucherType.JOURNAL)
                .voucherDate(LocalDate.now(clock))
                .narration("Reversal of " + original.getVoucherNumber() + ": " + reason)
                .actor(actor)
                .reversesVoucherId(voucherId);

            for (LedgerEntry entry : original.getEntries()) {
                request.line(PostingRequest.Line.of(
                    entry.getAccountId(),
                    entry.getDirection().opposite(),
                    entry.getAmount(),
                    "Reversal: " + (entry.getNarration() != null ? entry.getNarration() : original.getNarration()),
                    entry.getReference() != null ? entry.getReference().reversal() : null));
            }

            Voucher reversal;
            try {
                reversal = ledgerService.post(request.build());
            } catch (DuplicateKeyException e) {
                throw alreadyReversed(original);
            }

            if (!LedgerAmounts.sameAmount(reversal.getTotalDebits(), original.getTotalCredits())
                || !LedgerAmounts.sameAmount(reversal.getTotalCredits(), original.getTotalDebits())) {
                log.error("Reversal {} of voucher {} does not mirror it: debits {} vs {}, credits {} vs {}",
                    reversal.getVoucherNumber(), original.getVoucherNumber(),
                    reversal.getTotalDebits(), original.getTotalCredits(),
                    reversal.getTotalCredits(), original.getTotalDebits());
                throw new LedgerInvariantViolationException(
                    "Reversal totals of voucher " + original.getVoucherNumber() + " do not mirror the original");
            }

            log.info("Reversed voucher {} with {} by {}: {}",
                original.getVoucherNumber(), reversal.getVoucherNumber(), actor, reason);
            return reversal;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Reversal vouchers created during the last {@code days} days, newest first.
     */
    @Transactional(readOnly = true)
    public List<ReversalSummary> recentModifications(UUID companyId, int days) {
        if (days <= 0) {
            throw new LedgerValidationException("INVALID_PARAMETER", "days must be positive");
        }
        Instant since = Instant.now(clock).minus(days, ChronoUnit.DAYS);

        return jdbcTemplate.query(
            "SELECT r.id, r.sequence_number, r.voucher_type, r.voucher_date, r.narration, r.created_by, r.created_at, " +
            "o.id AS original_id, o.sequence_number AS original_sequence, o.voucher_type AS original_type, " +
            "(SELECT COALESCE(SUM(e.amount), 0) FROM ledger_entries e " +
            " WHERE e.voucher_id = r.id AND e.direction = 'DEBIT') AS amount " +
            "FROM vouchers r JOIN vouchers o ON o.id = r.reverses_voucher_id " +
            "WHERE r.company_id = ? AND r.created_at >= ? " +
            "ORDER BY r.created_at DESC, r.sequence_number DESC",
            (rs, rowNum) -> {
                VoucherType type = VoucherType.valueOf(rs.getString("voucher_type"));
                VoucherType originalType = VoucherType.valueOf(rs.getString("original_type"));
                return new ReversalSummary(
                    rs.getObject("id", UUID.class),
                    type.voucherNumber(rs.getLong("sequence_number")),
                    rs.getObject("original_id", UUID.class),
                    originalType.voucherNumber(rs.getLong("original_sequence")),
                    originalType,
                    rs.getObject("voucher_date", LocalDate.class),
                    LedgerAmounts.normalize(rs.getBigDecimal("amount")),
                    rs.getString("narration"),
                    rs.getString("created_by"),
                    rs.getTimestamp("created_at").toInstant());
            },
            companyId, Timestamp.from(since));
    }

    private LedgerStateConflictException alreadyReversed(Voucher original) {
        return new LedgerStateConflictException(ALREADY_REVERSED,
            "Voucher " + original.getVoucherNumber() + " has already been reversed");
    }
}
