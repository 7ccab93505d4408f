package com.flagship.pawn_ledger.pledge;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * What a pledge owes as of a date.
 *
 * {@code totalInterest} is exactly the sum of the breakdown amounts, and
 * {@code finalAmount} is the remaining principal plus the remaining interest.
 */
@Value
@Builder
public class SettlementQuote {
    UUID pledgeId;
    String pledgeNo;
    LocalDate pledgeDate;
    LocalDate asOf;
    BigDecimal principal;
    BigDecimal monthlyRate;
    BigDecimal monthlyInterest;
    int completedMonths;
    BigDecimal totalInterest;
    BigDecimal paidInterest;
    BigDecimal paidPrincipal;
    BigDecimal discountAllowed;
    BigDecimal remainingInterest;
    BigDecimal remainingPrincipal;
    BigDecimal finalAmount;
    BigDecimal netOutstanding;
    PledgeStatus status;
    List<InterestPeriod> breakdown;
}
