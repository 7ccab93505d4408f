package com.flagship.pawn_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class VoucherDaySummary {
    UUID companyId;
    LocalDate date;
    List<Line> vouchers;

    @Value
    public static class Line {
        UUID voucherId;
        String voucherNumber;
        String voucherType;
        String narration;
        String createdBy;
        BigDecimal totalDebits;
        BigDecimal totalCredits;
        long entryCount;

        @JsonProperty("is_balanced")
        boolean balanced;
    }
}
