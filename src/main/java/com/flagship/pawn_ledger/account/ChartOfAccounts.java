package com.flagship.pawn_ledger.account;

import lombok.Value;

import java.util.List;

/**
 * Standard chart of accounts for a pawn-lending company.
 *
 * Group accounts come before their leaves so a parent always exists when a
 * child is created.
 */
public final class ChartOfAccounts {

    public static final List<Template> STANDARD_PAWN_CHART = List.of(
        new Template("1000", "Current Assets", AccountType.ASSET, null),
        new Template("1001", "Cash in Hand", AccountType.ASSET, "1000"),
        new Template("1002", "Cash at Bank", AccountType.ASSET, "1000"),
        new Template("1003", "Gold Inventory", AccountType.ASSET, "1000"),
        new Template("1004", "Silver Inventory", AccountType.ASSET, "1000"),
        new Template("1005", "Pledged Ornaments", AccountType.ASSET, "1000"),
        new Template("1006", "Auction Inventory", AccountType.ASSET, "1000"),
        new Template("1100", "Fixed Assets", AccountType.ASSET, null),
        new Template("1101", "Furniture & Fixtures", AccountType.ASSET, "1100"),
        new Template("1102", "Computer Equipment", AccountType.ASSET, "1100"),
        new Template("1103", "Safe & Security Equipment", AccountType.ASSET, "1100"),

        new Template("2000", "Current Liabilities", AccountType.LIABILITY, null),
        new Template("2001", "Customer Pledge Accounts", AccountType.LIABILITY, "2000"),
        new Template("2002", "Interest Payable", AccountType.LIABILITY, "2000"),
        new Template("2003", "Auction Proceeds Payable", AccountType.LIABILITY, "2000"),
        new Template("2100", "Long-term Liabilities", AccountType.LIABILITY, null),
        new Template("2101", "Bank Loans", AccountType.LIABILITY, "2100"),

        new Template("3000", "Capital", AccountType.EQUITY, null),
        new Template("3001", "Owner's Capital", AccountType.EQUITY, "3000"),
        new Template("3002", "Retained Earnings", AccountType.EQUITY, "3000"),

        new Template("4000", "Revenue", AccountType.INCOME, null),
        new Template("4001", "Pledge Interest Income", AccountType.INCOME, "4000"),
        new Template("4002", "Auction Income", AccountType.INCOME, "4000"),
        new Template("4003", "Service Charges", AccountType.INCOME, "4000"),
        new Template("4004", "Late Payment Charges", AccountType.INCOME, "4000"),

        new Template("5000", "Operating Expenses", AccountType.EXPENSE, null),
        new Template("5001", "Rent Expense", AccountType.EXPENSE, "5000"),
        new Template("5002", "Salary Expense", AccountType.EXPENSE, "5000"),
        new Template("5003", "Electricity Expense", AccountType.EXPENSE, "5000"),
        new Template("5004", "Telephone Expense", AccountType.EXPENSE, "5000"),
        new Template("5005", "Insurance Expense", AccountType.EXPENSE, "5000"),
        new Template("5006", "Security Expense", AccountType.EXPENSE, "5000"),
        new Template("5007", "Bank Charges", AccountType.EXPENSE, "5000"),
        new Template("5008", "Customer Discount", AccountType.EXPENSE, "5000")
    );

    private ChartOfAccounts() {
    }

    @Value
    public static class Template {
        String code;
        String name;
        AccountType type;
        String parentCode;
    }
}
