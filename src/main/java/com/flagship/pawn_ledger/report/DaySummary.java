package com.flagship.pawn_ledger.report;

import com.flagship.pawn_ledger.ledger.EntryDirection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Day book: every movement of one day with the running cash balance.
 */
@Value
@Builder
public class DaySummary {
    UUID companyId;
    LocalDate date;
    BigDecimal openingBalance;
    BigDecimal closingBalance;
    List<Entry> entries;
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    BigDecimal cashReceipts;
    BigDecimal cashPayments;
    long voucherCount;
    Map<String, Long> voucherTypeCounts;

    @Value
    @Builder
    public static class Entry {
        UUID voucherId;
        String voucherNumber;
        String voucherType;
        UUID entryId;
        UUID accountId;
        String accountCode;
        String accountName;
        EntryDirection direction;
        BigDecimal debit;
        BigDecimal credit;
        String narration;
        BigDecimal runningBalance;
    }
}
