package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.fiscal.YearOpening;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class FinancialYearOpenedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "FinancialYearOpened";

    UUID eventId;
    UUID companyId;
    String financialYear;
    LocalDate openingDate;
    UUID voucherId;
    int accountsCarried;
    BigDecimal totalCarried;
    String openedBy;
    Instant occurredAt;

    public static FinancialYearOpenedEvent from(YearOpening opening) {
        return new FinancialYearOpenedEvent(
            UUID.randomUUID(),
            opening.getCompanyId(),
            opening.getFinancialYear(),
            opening.getOpeningDate(),
            opening.getVoucherId(),
            opening.getAccountsCarried(),
            opening.getTotalCarried(),
            opening.getOpenedBy(),
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
