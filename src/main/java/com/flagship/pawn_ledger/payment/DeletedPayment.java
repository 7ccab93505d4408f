package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.pledge.PledgeStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class DeletedPayment {
    UUID paymentId;
    String receiptNumber;
    UUID reversalVoucherId;
    String reversalVoucherNumber;
    PledgeStatus pledgeStatus;
}
