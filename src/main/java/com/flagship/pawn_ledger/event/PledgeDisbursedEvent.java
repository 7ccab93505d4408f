package com.flagship.pawn_ledger.event;

import com.flagship.pawn_ledger.pledge.Pledge;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class PledgeDisbursedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PledgeDisbursed";

    UUID eventId;
    UUID companyId;
    UUID pledgeId;
    String pledgeNo;
    UUID customerId;
    BigDecimal principal;
    BigDecimal firstMonthInterest;
    BigDecimal documentCharges;
    BigDecimal finalAmount;
    LocalDate pledgeDate;
    LocalDate dueDate;
    UUID voucherId;
    Instant occurredAt;

    public static PledgeDisbursedEvent from(Pledge pledge) {
        return new PledgeDisbursedEvent(
            UUID.randomUUID(),
            pledge.getCompanyId(),
            pledge.getId(),
            pledge.getPledgeNo(),
            pledge.getCustomerId(),
            pledge.getPrincipal(),
            pledge.getFirstMonthInterest(),
            pledge.getDocumentCharges(),
            pledge.getFinalAmount(),
            pledge.getPledgeDate(),
            pledge.getDueDate(),
            pledge.getDisbursalVoucherId(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return pledgeId;
    }

    @Override
    public String getAggregateType() {
        return "Pledge";
    }
}
