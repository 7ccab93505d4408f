package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.PaymentTooOldException;
import com.flagship.pawn_ledger.ledger.EntryDirection;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerEntry;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.ReferenceKind;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.pledge.Pledge;
import com.flagship.pawn_ledger.pledge.PledgeStatus;
import com.flagship.pawn_ledger.report.BalanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payments against pledges: recording, correction by reversal, deletion and
 * the age windows that bound both.
 */
class PaymentServiceTest extends IntegrationTestSupport {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BalanceService balanceService;

    private final LocalDate today = LocalDate.now();

    private UUID companyId;
    private UUID customerId;
    private UUID schemeId;
    private Pledge pledge;

    @BeforeEach
    void setUp() {
        companyId = newCompany().getId();
        customerId = newCustomer(companyId).getId();
        schemeId = twoPercentScheme(companyId).getId();
        pledge = disburse(companyId, customerId, schemeId, "90000", today.minusDays(10));
    }

    private RecordPaymentCommand.RecordPaymentCommandBuilder principalPayment(UUID pledgeId, String principal) {
        return RecordPaymentCommand.builder()
            .companyId(companyId)
            .pledgeId(pledgeId)
            .paymentDate(today)
            .amount(amount(principal))
            .principalAmount(amount(principal))
            .paymentMethod(PaymentMethod.CASH)
            .actor(ACTOR);
    }

    private BigDecimal customerBalance(UUID customer) {
        return balanceService.customerBalance(customer, companyId, today).getBalance();
    }

    @Test
    @DisplayName("Recording a payment posts a RECEIPT voucher and marks the pledge partially paid")
    void testRecord_PostsReceipt() {
        PledgePayment payment = paymentService.record(principalPayment(pledge.getId(), "5000").build());

        assertTrue(payment.getReceiptNumber().startsWith("RCPT-" + today.getYear() + "-"));
        assertEquals(new BigDecimal("5000.00"), payment.getAmount());
        assertEquals(PledgeStatus.PARTIAL_PAID, pledgeService.getPledge(pledge.getId(), companyId).getStatus());
        assertEquals(pledgeService.settlementQuote(pledge.getId(), companyId, today).getFinalAmount(),
            payment.getBalanceAmount());

        Voucher voucher = ledgerService.getVoucher(payment.getVoucherId(), companyId);
        assertEquals(VoucherType.RECEIPT, voucher.getType());
        assertEquals(2, voucher.getEntries().size());
        LedgerEntry cash = voucher.getEntries().get(0);
        assertEquals(EntryDirection.DEBIT, cash.getDirection());
        assertEquals(accountService.requireByCode(companyId, "1001").getId(), cash.getAccountId());
        assertEquals(ReferenceKind.PAYMENT, cash.getReference().getKind());
        assertEquals(payment.getId(), cash.getReference().getId());

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-85000.00"), customerBalance(customerId)));
    }

    @Test
    @DisplayName("Bank transfers are received into the bank account")
    void testRecord_BankTransfer() {
        PledgePayment payment = paymentService.record(principalPayment(pledge.getId(), "1000")
            .paymentMethod(PaymentMethod.BANK_TRANSFER)
            .bankReference("UTR-778812")
            .build());

        Voucher voucher = ledgerService.getVoucher(payment.getVoucherId(), companyId);
        assertEquals(accountService.requireByCode(companyId, "1002").getId(),
            voucher.getEntries().get(0).getAccountId());
    }

    @Test
    @DisplayName("Interest, penalty and discount are routed to their own accounts")
    void testRecord_FullBreakdown() {
        PledgePayment payment = paymentService.record(RecordPaymentCommand.builder()
            .companyId(companyId)
            .pledgeId(pledge.getId())
            .paymentDate(today)
            .amount(amount("11900"))
            .interestAmount(amount("1800"))
            .principalAmount(amount("10000"))
            .penaltyAmount(amount("100"))
            .discountAmount(amount("500"))
            .paymentMethod(PaymentMethod.CASH)
            .actor(ACTOR)
            .build());

        Voucher voucher = ledgerService.getVoucher(payment.getVoucherId(), companyId);
        assertEquals(5, voucher.getEntries().size());
        assertTrue(voucher.isBalanced());
        assertEquals(new BigDecimal("12400.00"), voucher.getTotalDebits());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-79500.00"), customerBalance(customerId)));
    }

    @Test
    @DisplayName("Amount must equal interest plus principal plus penalty")
    void testRecord_BreakdownMismatch() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> paymentService.record(principalPayment(pledge.getId(), "5000")
                .principalAmount(amount("4000"))
                .build()));

        assertEquals("AMOUNT_BREAKDOWN_MISMATCH", e.getErrorCode());
        assertTrue(paymentService.paymentsOfPledge(pledge.getId(), companyId).isEmpty());
    }

    @Test
    @DisplayName("Principal beyond the remaining balance is rejected")
    void testRecord_PrincipalExceedsBalance() {
        paymentService.record(principalPayment(pledge.getId(), "60000").build());

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> paymentService.record(principalPayment(pledge.getId(), "30000.01").build()));
        assertEquals("PRINCIPAL_EXCEEDS_BALANCE", e.getErrorCode());
    }

    @Test
    @DisplayName("A payment cannot predate its pledge")
    void testRecord_BeforePledgeDate() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> paymentService.record(principalPayment(pledge.getId(), "100")
                .paymentDate(pledge.getPledgeDate().minusDays(1))
                .build()));

        assertEquals("INVALID_PAYMENT_DATE", e.getErrorCode());
    }

    @Test
    @DisplayName("Receipt numbers are unique")
    void testRecord_DuplicateReceipt() {
        String receipt = "R-" + UUID.randomUUID().toString().substring(0, 8);
        paymentService.record(principalPayment(pledge.getId(), "100").receiptNumber(receipt).build());

        LedgerStateConflictException e = assertThrows(LedgerStateConflictException.class,
            () -> paymentService.record(principalPayment(pledge.getId(), "200").receiptNumber(receipt).build()));
        assertEquals(PaymentService.DUPLICATE_RECEIPT_NUMBER, e.getErrorCode());
        assertEquals(1, paymentService.paymentsOfPledge(pledge.getId(), companyId).size());
    }

    @Test
    @DisplayName("Paying the whole principal inside the first month redeems the pledge")
    void testRecord_RedeemsPledge() {
        paymentService.record(principalPayment(pledge.getId(), "90000").build());

        assertEquals(PledgeStatus.REDEEMED, pledgeService.getPledge(pledge.getId(), companyId).getStatus());

        LedgerStateConflictException e = assertThrows(LedgerStateConflictException.class,
            () -> paymentService.record(principalPayment(pledge.getId(), "1").build()));
        assertEquals("PLEDGE_REDEEMED", e.getErrorCode());
    }

    @Test
    @DisplayName("Updating a payment reverses its voucher and leaves balances as if it had been entered correctly")
    void testUpdate_ReversesAndReposts() {
        PledgePayment original = paymentService.record(principalPayment(pledge.getId(), "5000").build());
        Voucher originalVoucher = ledgerService.getVoucher(original.getVoucherId(), companyId);
        assertEquals(2, originalVoucher.getEntries().size());

        PledgePayment updated = paymentService.update(UpdatePaymentCommand.builder()
            .paymentId(original.getId())
            .companyId(companyId)
            .amount(amount("7000"))
            .principalAmount(amount("7000"))
            .reason("Cashier keyed the wrong amount")
            .actor(ACTOR)
            .build());

        assertEquals(original.getId(), updated.getId());
        assertEquals(original.getReceiptNumber(), updated.getReceiptNumber());
        assertEquals(new BigDecimal("7000.00"), updated.getAmount());
        assertNotEquals(original.getVoucherId(), updated.getVoucherId());

        UUID reversalId = ledgerService.findReversalOf(original.getVoucherId()).orElseThrow();
        Voucher reversal = ledgerService.getVoucher(reversalId, companyId);
        assertEquals(2, reversal.getEntries().size());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("5000.00"), reversal.getTotalDebits()));

        Voucher replacement = ledgerService.getVoucher(updated.getVoucherId(), companyId);
        assertEquals(2, replacement.getEntries().size());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("7000.00"), replacement.getTotalDebits()));

        UUID otherCustomer = newCustomer(companyId).getId();
        Pledge twin = disburse(companyId, otherCustomer, schemeId, "90000", today.minusDays(10));
        paymentService.record(principalPayment(twin.getId(), "7000").build());

        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-83000.00"), customerBalance(customerId)));
        assertTrue(LedgerAmounts.sameAmount(customerBalance(otherCustomer), customerBalance(customerId)));
    }

    @Test
    @DisplayName("Payments older than the update window cannot be updated")
    void testUpdate_TooOld() {
        Pledge old = disburse(companyId, customerId, schemeId, "20000", today.minusDays(60));
        PledgePayment payment = paymentService.record(principalPayment(old.getId(), "1000")
            .paymentDate(today.minusDays(40))
            .build());

        PaymentTooOldException e = assertThrows(PaymentTooOldException.class,
            () -> paymentService.update(UpdatePaymentCommand.builder()
                .paymentId(payment.getId())
                .companyId(companyId)
                .notes("late fix")
                .actor(ACTOR)
                .build()));

        assertEquals(PaymentTooOldException.ERROR_CODE, e.getErrorCode());
        assertTrue(ledgerService.findReversalOf(payment.getVoucherId()).isEmpty());
    }

    @Test
    @DisplayName("Deleting a payment reverses its voucher, removes it and restores the pledge status")
    void testDelete_WithinWindow() {
        PledgePayment payment = paymentService.record(principalPayment(pledge.getId(), "5000").build());

        DeletedPayment deleted = paymentService.delete(payment.getId(), companyId, true, "Duplicate entry", ACTOR);

        assertEquals(payment.getReceiptNumber(), deleted.getReceiptNumber());
        assertEquals(PledgeStatus.ACTIVE, deleted.getPledgeStatus());
        assertTrue(paymentService.findPayment(payment.getId(), companyId).isEmpty());
        assertEquals(deleted.getReversalVoucherId(), ledgerService.findReversalOf(payment.getVoucherId()).orElseThrow());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-90000.00"), customerBalance(customerId)));
    }

    @Test
    @DisplayName("Deletion needs explicit confirmation")
    void testDelete_RequiresConfirmation() {
        PledgePayment payment = paymentService.record(principalPayment(pledge.getId(), "5000").build());

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> paymentService.delete(payment.getId(), companyId, false, null, ACTOR));

        assertEquals("CONFIRMATION_REQUIRED", e.getErrorCode());
        assertTrue(paymentService.findPayment(payment.getId(), companyId).isPresent());
    }

    @Test
    @DisplayName("Payments older than the delete window can still be updated but not deleted")
    void testModificationWindows() {
        PledgePayment payment = paymentService.record(principalPayment(pledge.getId(), "2500")
            .paymentDate(today.minusDays(9))
            .build());

        ModificationStatus status = paymentService.modificationStatus(payment.getId(), companyId);
        assertEquals(9, status.getAgeDays());
        assertTrue(status.isCanUpdate());
        assertFalse(status.isCanDelete());
        assertEquals(2, status.getVoucherEntryCount());

        assertThrows(PaymentTooOldException.class,
            () -> paymentService.delete(payment.getId(), companyId, true, null, ACTOR));
    }

    @Test
    @DisplayName("Concurrent payments on one pledge are applied one after the other")
    void testRecord_ConcurrentPaymentsSerialized() throws InterruptedException {
        int threadCount = 2;
        AtomicInteger recorded = new AtomicInteger(0);
        ConcurrentLinkedQueue<Exception> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    paymentService.record(principalPayment(pledge.getId(), "60000").build());
                    recorded.incrementAndGet();
                } catch (Exception e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, recorded.get());
        assertEquals(1, failures.size());
        Exception failure = failures.peek();
        assertInstanceOf(LedgerValidationException.class, failure);
        assertEquals("PRINCIPAL_EXCEEDS_BALANCE", ((LedgerValidationException) failure).getErrorCode());

        List<PledgePayment> payments = paymentService.paymentsOfPledge(pledge.getId(), companyId);
        assertEquals(1, payments.size());
        assertTrue(LedgerAmounts.sameAmount(new BigDecimal("-30000.00"), customerBalance(customerId)));
    }
}
