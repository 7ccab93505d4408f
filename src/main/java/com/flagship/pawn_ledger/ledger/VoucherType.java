package com.flagship.pawn_ledger.ledger;

/**
 * Closed set of voucher types. The prefix is used to render voucher numbers.
 */
public enum VoucherType {
    LOAN_DISBURSAL("LD"),
    RECEIPT("RV"),
    PAYMENT("PV"),
    JOURNAL("JV"),
    AUCTION("AV"),
    YEAR_END_CLOSING("YC"),
    YEAR_OPENING("YO");

    private final String prefix;

    VoucherType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String voucherNumber(long sequenceNumber) {
        return String.format("%s-%06d", prefix, sequenceNumber);
    }

    /**
     * Closing and opening vouchers are produced by the year-end process and may
     * touch inactive accounts that still carry a balance.
     */
    public boolean isYearEnd() {
        return this == YEAR_END_CLOSING || this == YEAR_OPENING;
    }
}
