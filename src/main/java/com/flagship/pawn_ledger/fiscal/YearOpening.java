package com.flagship.pawn_ledger.fiscal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Outcome of opening a financial year. {@code voucherId} is null when there was
 * no balance to carry forward.
 */
@Value
@Builder
public class YearOpening {
    UUID companyId;
    String financialYear;
    LocalDate openingDate;
    UUID voucherId;
    String voucherNumber;
    int accountsCarried;
    BigDecimal totalCarried;
    String openedBy;
}
