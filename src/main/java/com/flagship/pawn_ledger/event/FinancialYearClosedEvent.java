package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.fiscal.YearEndClosing;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class FinancialYearClosedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "FinancialYearClosed";

    UUID eventId;
    UUID companyId;
    String financialYear;
    LocalDate periodEnd;
    UUID voucherId;
    BigDecimal netProfit;
    String closedBy;
    Instant occurredAt;

    public static FinancialYearClosedEvent from(YearEndClosing closing) {
        return new FinancialYearClosedEvent(
            UUID.randomUUID(),
            closing.getCompanyId(),
            closing.getFinancialYear(),
            closing.getPeriodEnd(),
            closing.getVoucherId(),
            closing.getNetProfit(),
            closing.getClosedBy(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return companyId;
    }

    @Override
    public String getAggregateType() {
        return "Company";
    }
}
