package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A pawn loan.
 *
 * Invariant: {@code finalAmount == principal + firstMonthInterest + documentCharges}.
 * The final amount is always derived, never taken from the caller.
 */
@Value
public class Pledge {
    UUID id;
    UUID companyId;
    UUID customerId;
    UUID schemeId;
    String pledgeNo;
    BigDecimal principal;
    BigDecimal monthlyRate;
    BigDecimal firstMonthInterest;
    BigDecimal documentCharges;
    BigDecimal finalAmount;
    PledgeStatus status;
    LocalDate pledgeDate;
    LocalDate dueDate;
    UUID disbursalVoucherId;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A freshly disbursed pledge in ACTIVE status.
     */
    public static Pledge disbursed(UUID id, UUID companyId, UUID customerId, UUID schemeId, String pledgeNo,
                                   BigDecimal principal, BigDecimal monthlyRate,
                                   BigDecimal firstMonthInterest, BigDecimal documentCharges,
                                   LocalDate pledgeDate, LocalDate dueDate,
                                   UUID disbursalVoucherId, String createdBy) {
        BigDecimal normalizedPrincipal = LedgerAmounts.normalize(principal);
        BigDecimal fmi = LedgerAmounts.normalize(firstMonthInterest);
        BigDecimal charges = LedgerAmounts.normalize(documentCharges);
        Instant now = Instant.now();
        return new Pledge(id, companyId, customerId, schemeId, pledgeNo,
            normalizedPrincipal, monthlyRate, fmi, charges,
            normalizedPrincipal.add(fmi).add(charges),
            PledgeStatus.ACTIVE, pledgeDate, dueDate, disbursalVoucherId, createdBy, now, now);
    }

    /**
     * Interest for one full month: {@code principal × monthlyRate / 100}.
     */
    public BigDecimal getMonthlyInterest() {
        return LedgerAmounts.percentOf(principal, monthlyRate);
    }

    public boolean isRedeemed() {
        return status == PledgeStatus.REDEEMED;
    }
}
