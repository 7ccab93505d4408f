package com.flagship.pawn_ledger.ledger;

import com.flagship.pawn_ledger.exception.LedgerValidationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Request to post one voucher.
 *
 * Invariant: sum of debit lines equals sum of credit lines within
 * {@link LedgerAmounts#TOLERANCE}. The request itself may be unbalanced; the
 * posting engine rejects it.
 */
@Value
@Builder
public class PostingRequest {
    UUID companyId;
    VoucherType voucherType;
    LocalDate voucherDate;
    String narration;
    String actor;
    UUID reversesVoucherId;
    @Singular
    List<Line> lines;

    public BigDecimal getDebitTotal() {
        return total(EntryDirection.DEBIT);
    }

    public BigDecimal getCreditTotal() {
        return total(EntryDirection.CREDIT);
    }

    public boolean isBalanced() {
        return LedgerAmounts.sameAmount(getDebitTotal(), getCreditTotal());
    }

    private BigDecimal total(EntryDirection direction) {
        return lines.stream()
            .filter(line -> line.getDirection() == direction)
            .map(Line::getAmount)
            .reduce(LedgerAmounts.ZERO, BigDecimal::add);
    }

    /**
     * A single debit or credit line. Amounts are normalized to two decimals and
     * must be strictly positive.
     */
    @Value
    public static class Line {
        UUID accountId;
        EntryDirection direction;
        BigDecimal amount;
        String narration;
        EntryReference reference;

        private Line(UUID accountId, EntryDirection direction, BigDecimal amount,
                     String narration, EntryReference reference) {
            this.accountId = Objects.requireNonNull(accountId, "accountId");
            this.direction = Objects.requireNonNull(direction, "direction");
            if (amount == null || LedgerAmounts.normalize(amount).signum() <= 0) {
                throw new LedgerValidationException("INVALID_AMOUNT",
                    "Amount must be positive, got " + amount + " for account " + accountId);
            }
            this.amount = LedgerAmounts.normalize(amount);
            this.narration = narration;
            this.reference = reference;
        }

        public static Line of(UUID accountId, EntryDirection direction, BigDecimal amount,
                              String narration, EntryReference reference) {
            return new Line(accountId, direction, amount, narration, reference);
        }

        public static Line debit(UUID accountId, BigDecimal amount, String narration, EntryReference reference) {
            return new Line(accountId, EntryDirection.DEBIT, amount, narration, reference);
        }

        public static Line credit(UUID accountId, BigDecimal amount, String narration, EntryReference reference) {
            return new Line(accountId, EntryDirection.CREDIT, amount, narration, reference);
        }
    }
}
