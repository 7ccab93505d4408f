package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.pledge.PaymentTotals;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * The money of one payment, normalized to two decimals. Missing components are zero.
 */
@Value
class PaymentAmounts {
    BigDecimal amount;
    BigDecimal interest;
    BigDecimal principal;
    BigDecimal penalty;
    BigDecimal discount;

    static PaymentAmounts of(BigDecimal amount, BigDecimal interest, BigDecimal principal,
                             BigDecimal penalty, BigDecimal discount) {
        return new PaymentAmounts(LedgerAmounts.normalize(amount), LedgerAmounts.normalize(interest),
            LedgerAmounts.normalize(principal), LedgerAmounts.normalize(penalty), LedgerAmounts.normalize(discount));
    }

    static PaymentAmounts of(PledgePayment payment) {
        return of(payment.getAmount(), payment.getInterestAmount(), payment.getPrincipalAmount(),
            payment.getPenaltyAmount(), payment.getDiscountAmount());
    }

    BigDecimal getPrincipalReduction() {
        return principal.add(discount);
    }

    /**
     * @throws LedgerValidationException if the amount is not positive, a component
     *                                   is negative or the components do not add up
     */
    void validate() {
        if (!LedgerAmounts.isPositive(amount)) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Payment amount must be positive");
        }
        if (interest.signum() < 0 || principal.signum() < 0 || penalty.signum() < 0 || discount.signum() < 0) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Payment components cannot be negative");
        }
        BigDecimal components = interest.add(principal).add(penalty);
        if (!LedgerAmounts.sameAmount(amount, components)) {
            throw new LedgerValidationException("AMOUNT_BREAKDOWN_MISMATCH",
                "Payment amount " + amount + " does not equal interest + principal + penalty " + components,
                Map.of("amount", amount.toPlainString(), "components", components.toPlainString()));
        }
    }

    PaymentTotals addTo(PaymentTotals totals) {
        return new PaymentTotals(
            totals.getInterest().add(interest),
            totals.getPrincipal().add(principal),
            totals.getPenalty().add(penalty),
            totals.getDiscount().add(discount),
            totals.getPaymentCount() + 1);
    }

    PaymentTotals removeFrom(PaymentTotals totals) {
        return new PaymentTotals(
            LedgerAmounts.nonNegative(totals.getInterest().subtract(interest)),
            LedgerAmounts.nonNegative(totals.getPrincipal().subtract(principal)),
            LedgerAmounts.nonNegative(totals.getPenalty().subtract(penalty)),
            LedgerAmounts.nonNegative(totals.getDiscount().subtract(discount)),
            Math.max(0, totals.getPaymentCount() - 1));
    }
}
