package com.flagship.pawn_ledger.pledge;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input of a disbursal. {@code pledgeNo} and {@code firstMonthInterest} are
 * optional; a missing document charge counts as zero.
 */
@Value
@Builder
public class DisbursePledgeCommand {
    UUID companyId;
    UUID customerId;
    UUID schemeId;
    String pledgeNo;
    BigDecimal principal;
    BigDecimal firstMonthInterest;
    BigDecimal documentCharges;
    LocalDate pledgeDate;
    String actor;
}
