package com.flagship.pawn_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger configuration bound from {@code ledger.*}.
 *
 * Account codes name the well-known accounts of the standard pawn chart that
 * postings are routed to; the payment windows bound how long a recorded
 * payment may still be corrected.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Accounts accounts = new Accounts();
    private Payments payments = new Payments();
    private Pledges pledges = new Pledges();

    @Getter
    @Setter
    public static class Accounts {
        private String cash = "1001";
        private String bank = "1002";
        private String customerParent = "2001";
        private String capitalGroup = "3000";
        private String retainedEarnings = "3002";
        private String interestIncome = "4001";
        private String serviceCharges = "4003";
        private String latePaymentCharges = "4004";
        private String customerDiscount = "5008";
    }

    @Getter
    @Setter
    public static class Payments {
        private int updateWindowDays = 30;
        private int deleteWindowDays = 7;
        private String receiptPrefix = "RCPT";
    }

    @Getter
    @Setter
    public static class Pledges {
        private String numberPrefix = "PL";
    }
}
