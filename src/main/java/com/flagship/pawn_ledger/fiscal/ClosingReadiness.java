package com.flagship.pawn_ledger.fiscal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pawn_ledger.report.ProfitAndLoss;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Read-only checklist shown before a year is closed.
 */
@Value
@Builder
public class ClosingReadiness {
    String financialYear;
    LocalDate periodStart;
    LocalDate periodEnd;
    boolean yearEnded;
    boolean alreadyClosed;
    long unpostedVoucherCount;
    boolean trialBalanceBalanced;
    ProfitAndLoss profitAndLoss;

    @JsonProperty("is_ready")
    public boolean isReady() {
        return yearEnded && !alreadyClosed && unpostedVoucherCount == 0 && trialBalanceBalanced;
    }
}
