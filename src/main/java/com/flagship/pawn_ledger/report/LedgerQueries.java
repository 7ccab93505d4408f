package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.account.AccountType;
import com.flagship.pawn_ledger.ledger.EntryDirection;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.VoucherType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregations over the entry log shared by the report services.
 *
 * Carry-forward rule: a YEAR_OPENING voucher already holds every prior balance,
 * so a balance as of D sums entries from the latest opening voucher dated on or
 * before D, that voucher included. Without one, all entries up to D count.
 */
@Component
@RequiredArgsConstructor
class LedgerQueries {

    static final LocalDate EPOCH = LocalDate.of(1900, 1, 1);

    private final NamedParameterJdbcTemplate jdbc;

    LocalDate carryForwardStart(UUID companyId, LocalDate asOf) {
        LocalDate latestOpening = jdbc.queryForObject(
            "SELECT MAX(voucher_date) FROM vouchers " +
            "WHERE company_id = :companyId AND voucher_type = 'YEAR_OPENING' AND voucher_date <= :asOf",
            new MapSqlParameterSource().addValue("companyId", companyId).addValue("asOf", asOf),
            LocalDate.class);
        return latestOpening != null ? latestOpening : EPOCH;
    }

    /**
     * Balance totals of every account of the company as of a date.
     */
    Map<UUID, AccountTotals> balancesAsOf(UUID companyId, LocalDate asOf) {
        return totalsByAccount(companyId, null, carryForwardStart(companyId, asOf), asOf, List.of());
    }

    AccountTotals balanceAsOf(UUID companyId, UUID accountId, LocalDate asOf) {
        return totalsByAccount(companyId, accountId, carryForwardStart(companyId, asOf), asOf, List.of())
            .getOrDefault(accountId, AccountTotals.NONE);
    }

    /**
     * Debit and credit sums per account for entries dated within [from, to].
     *
     * @param accountId    restricts to one account when not null
     * @param excludedTypes voucher types whose entries are left out
     */
    Map<UUID, AccountTotals> totalsByAccount(UUID companyId, UUID accountId, LocalDate from, LocalDate to,
                                             Collection<VoucherType> excludedTypes) {
        StringBuilder sql = new StringBuilder(
            "SELECT e.account_id, " +
            "COALESCE(SUM(CASE WHEN e.direction = 'DEBIT' THEN e.amount END), 0) AS debits, " +
            "COALESCE(SUM(CASE WHEN e.direction = 'CREDIT' THEN e.amount END), 0) AS credits " +
            "FROM ledger_entries e JOIN vouchers v ON v.id = e.voucher_id " +
            "WHERE e.company_id = :companyId AND e.transaction_date BETWEEN :from AND :to");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("from", from)
            .addValue("to", to);

        if (accountId != null) {
            sql.append(" AND e.account_id = :accountId");
            params.addValue("accountId", accountId);
        }
        if (!excludedTypes.isEmpty()) {
            sql.append(" AND v.voucher_type NOT IN (:excluded)");
            params.addValue("excluded", excludedTypes.stream().map(Enum::name).toList());
        }
        sql.append(" GROUP BY e.account_id");

        Map<UUID, AccountTotals> totals = new HashMap<>();
        jdbc.query(sql.toString(), params, (RowCallbackHandler) rs -> {
            totals.put(rs.getObject("account_id", UUID.class), new AccountTotals(
                LedgerAmounts.normalize(rs.getBigDecimal("debits")),
                LedgerAmounts.normalize(rs.getBigDecimal("credits"))));
        });
        return totals;
    }

    /**
     * Movements dated within [from, to] ordered by date, voucher sequence and entry
     * sequence. Carry-forward vouchers are not movements and are left out.
     */
    List<Movement> movements(UUID companyId, UUID accountId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT e.id, e.sequence_number, e.transaction_date, e.direction, e.amount, e.narration, " +
            "v.id AS voucher_id, v.sequence_number AS voucher_sequence, v.voucher_type, " +
            "v.narration AS voucher_narration, v.created_by, " +
            "a.id AS account_id, a.code, a.name, a.account_type " +
            "FROM ledger_entries e " +
            "JOIN vouchers v ON v.id = e.voucher_id " +
            "JOIN accounts a ON a.id = e.account_id " +
            "WHERE e.company_id = :companyId AND e.transaction_date BETWEEN :from AND :to " +
            "AND v.voucher_type <> 'YEAR_OPENING'");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("from", from)
            .addValue("to", to);

        if (accountId != null) {
            sql.append(" AND e.account_id = :accountId");
            params.addValue("accountId", accountId);
        }
        sql.append(" ORDER BY e.transaction_date, v.sequence_number, e.sequence_number");

        return jdbc.query(sql.toString(), params, (rs, rowNum) -> new Movement(
            rs.getObject("id", UUID.class),
            rs.getLong("sequence_number"),
            rs.getObject("transaction_date", LocalDate.class),
            rs.getObject("voucher_id", UUID.class),
            rs.getLong("voucher_sequence"),
            VoucherType.valueOf(rs.getString("voucher_type")),
            rs.getString("voucher_narration"),
            rs.getString("created_by"),
            rs.getObject("account_id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            EntryDirection.valueOf(rs.getString("direction")),
            LedgerAmounts.normalize(rs.getBigDecimal("amount")),
            rs.getString("narration")));
    }
}
