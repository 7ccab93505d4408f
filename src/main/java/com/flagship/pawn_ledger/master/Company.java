package com.flagship.pawn_ledger.master;

import lombok.Value;

import java.time.MonthDay;
import java.util.UUID;

/**
 * Tenant root. Every ledger row belongs to exactly one company.
 */
@Value
public class Company {
    UUID id;
    String name;
    int fiscalStartMonth;
    int fiscalStartDay;

    public MonthDay getFiscalStart() {
        return MonthDay.of(fiscalStartMonth, fiscalStartDay);
    }
}
