package com.flagship.pawn_ledger.master;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Loan scheme. The monthly rate is a percentage; pledges copy it at disbursal,
 * so later scheme edits never change existing pledges.
 */
@Value
public class Scheme {
    UUID id;
    UUID companyId;
    String name;
    BigDecimal monthlyRate;
    int durationMonths;
}
