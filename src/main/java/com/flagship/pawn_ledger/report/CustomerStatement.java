package com.flagship.pawn_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Movements on a customer's sub-account over a period, with a running balance
 * (credit minus debit) and a cross-check against the ledger balance.
 */
@Value
@Builder
public class CustomerStatement {
    UUID customerId;
    String customerName;
    UUID accountId;
    String accountCode;
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    List<Line> entries;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    BigDecimal closingBalance;
    Verification balanceVerification;

    @Value
    @Builder
    public static class Line {
        LocalDate date;
        UUID voucherId;
        String voucherNumber;
        String voucherType;
        String narration;
        BigDecimal debit;
        BigDecimal credit;
        BigDecimal runningBalance;
    }

    @Value
    public static class Verification {
        BigDecimal statementBalance;
        BigDecimal ledgerBalance;
        BigDecimal difference;
        boolean matches;
    }
}
