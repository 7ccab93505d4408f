package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Pledge interest arithmetic.
 *
 * The first month is mandatory and collected at disbursal. Beyond it interest
 * accrues per fully completed calendar month from the pledge date, never for a
 * fraction of a month. A month that would end on a day the shorter month does
 * not have is only complete once the pledge day-of-month is reached.
 *
 * Pure: the same pledge, payment totals and date always give the same quote.
 */
@Component
public class InterestCalculator {

    /**
     * Default first-month interest: one month at the scheme rate.
     */
    public BigDecimal firstMonthInterest(BigDecimal principal, BigDecimal monthlyRate) {
        return LedgerAmounts.percentOf(principal, monthlyRate);
    }

    public int completedMonths(LocalDate pledgeDate, LocalDate asOf) {
        return (int) Math.max(0, ChronoUnit.MONTHS.between(pledgeDate, asOf));
    }

    /**
     * @throws LedgerValidationException if {@code asOf} is before the pledge date
     */
    public SettlementQuote quote(Pledge pledge, PaymentTotals payments, LocalDate asOf) {
        if (asOf.isBefore(pledge.getPledgeDate())) {
            throw new LedgerValidationException("INVALID_AS_OF_DATE",
                "Settlement date " + asOf + " is before pledge date " + pledge.getPledgeDate());
        }

        int completedMonths = completedMonths(pledge.getPledgeDate(), asOf);
        BigDecimal monthlyInterest = pledge.getMonthlyInterest();
        BigDecimal paidInterest = pledge.getFirstMonthInterest().add(payments.getInterest());

        List<InterestPeriod> breakdown = new ArrayList<>();
        breakdown.add(period(pledge, 0, pledge.getFirstMonthInterest(), true, InterestPeriod.Status.PAID));

        BigDecimal totalInterest = pledge.getFirstMonthInterest();
        BigDecimal unallocated = payments.getInterest();
        for (int month = 1; month <= completedMonths; month++) {
            InterestPeriod.Status status;
            if (unallocated.compareTo(monthlyInterest) >= 0) {
                status = InterestPeriod.Status.PAID;
                unallocated = unallocated.subtract(monthlyInterest);
            } else if (unallocated.signum() > 0) {
                status = InterestPeriod.Status.PARTIAL;
                unallocated = LedgerAmounts.ZERO;
            } else {
                status = InterestPeriod.Status.DUE;
            }
            breakdown.add(period(pledge, month, monthlyInterest, false, status));
            totalInterest = totalInterest.add(monthlyInterest);
        }

        BigDecimal settledPrincipal = payments.getPrincipal().add(payments.getDiscount());
        BigDecimal remainingInterest = LedgerAmounts.nonNegative(totalInterest.subtract(paidInterest));
        BigDecimal remainingPrincipal = LedgerAmounts.nonNegative(pledge.getPrincipal().subtract(settledPrincipal));

        BigDecimal totalDue = pledge.getPrincipal().add(totalInterest);
        BigDecimal totalPaid = paidInterest.add(settledPrincipal);
        BigDecimal netOutstanding = LedgerAmounts.normalize(totalDue.subtract(totalPaid));

        return SettlementQuote.builder()
            .pledgeId(pledge.getId())
            .pledgeNo(pledge.getPledgeNo())
            .pledgeDate(pledge.getPledgeDate())
            .asOf(asOf)
            .principal(pledge.getPrincipal())
            .monthlyRate(pledge.getMonthlyRate())
            .monthlyInterest(monthlyInterest)
            .completedMonths(completedMonths)
            .totalInterest(LedgerAmounts.normalize(totalInterest))
            .paidInterest(LedgerAmounts.normalize(paidInterest))
            .paidPrincipal(LedgerAmounts.normalize(payments.getPrincipal()))
            .discountAllowed(LedgerAmounts.normalize(payments.getDiscount()))
            .remainingInterest(remainingInterest)
            .remainingPrincipal(remainingPrincipal)
            .finalAmount(remainingPrincipal.add(remainingInterest))
            .netOutstanding(netOutstanding)
            .status(statusFor(netOutstanding, payments))
            .breakdown(List.copyOf(breakdown))
            .build();
    }

    /**
     * REDEEMED once nothing is outstanding, PARTIAL_PAID once any payment exists,
     * ACTIVE otherwise.
     */
    public PledgeStatus statusFor(BigDecimal netOutstanding, PaymentTotals payments) {
        if (netOutstanding.compareTo(LedgerAmounts.TOLERANCE) <= 0) {
            return PledgeStatus.REDEEMED;
        }
        return payments.hasPayments() ? PledgeStatus.PARTIAL_PAID : PledgeStatus.ACTIVE;
    }

    private InterestPeriod period(Pledge pledge, int index, BigDecimal amount, boolean mandatory,
                                  InterestPeriod.Status status) {
        LocalDate from = pledge.getPledgeDate().plusMonths(index);
        LocalDate to = pledge.getPledgeDate().plusMonths(index + 1L).minusDays(1);
        return new InterestPeriod(
            "Month " + (index + 1),
            from,
            to,
            ChronoUnit.DAYS.between(from, to) + 1,
            pledge.getMonthlyRate(),
            LedgerAmounts.normalize(amount),
            mandatory,
            status);
    }
}
