package com.flagship.pawn_ledger.pledge;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One month of interest in a settlement breakdown.
 */
@Value
public class InterestPeriod {
    String label;
    LocalDate from;
    LocalDate to;
    long days;
    BigDecimal rate;
    BigDecimal amount;
    boolean mandatory;
    Status status;

    public enum Status {
        PAID,
        PARTIAL,
        DUE
    }
}
