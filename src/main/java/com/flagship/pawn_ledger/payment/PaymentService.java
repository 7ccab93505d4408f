package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.config.LedgerProperties;
import com.flagship.pawn_ledger.event.PaymentRecordedEvent;
import com.flagship.pawn_ledger.event.PaymentReversedEvent;
import com.flagship.pawn_ledger.exception.LedgerReferenceException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.exception.PaymentTooOldException;
import com.flagship.pawn_ledger.ledger.EntryReference;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.ReferenceKind;
import com.flagship.pawn_ledger.ledger.ReversalService;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.outbox.OutboxService;
import com.flagship.pawn_ledger.pledge.InterestCalculator;
import com.flagship.pawn_ledger.pledge.PaymentTotals;
import com.flagship.pawn_ledger.pledge.Pledge;
import com.flagship.pawn_ledger.pledge.PledgeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Payments against pledges.
 *
 * Every payment is represented by exactly one RECEIPT voucher. Correcting a
 * payment never touches that voucher: it is reversed and a new one is posted,
 * and the payment row is re-pointed to the new voucher. The pledge row is
 * locked for the whole operation so concurrent payments on one pledge queue up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    public static final String DUPLICATE_RECEIPT_NUMBER = "DUPLICATE_RECEIPT_NUMBER";

    private final PaymentRepository paymentRepository;
    private final PledgeService pledgeService;
    private final InterestCalculator interestCalculator;
    private final LedgerService ledgerService;
    private final ReversalService reversalService;
    private final AccountService accountService;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Records a payment and posts its RECEIPT voucher.
     *
     * @throws LedgerStateConflictException if the pledge is redeemed or the receipt number is taken
     * @throws LedgerValidationException    if the amounts do not add up or exceed the remaining principal
     */
    @Transactional
    public PledgePayment record(RecordPaymentCommand command) {
        if (command.getCompanyId() == null || command.getPledgeId() == null || command.getPaymentMethod() == null) {
            throw new LedgerValidationException("INVALID_PAYMENT", "Company, pledge and payment method are required");
        }
        PaymentAmounts amounts = PaymentAmounts.of(command.getAmount(), command.getInterestAmount(),
            command.getPrincipalAmount(), command.getPenaltyAmount(), command.getDiscountAmount());
        amounts.validate();

        UUID companyId = command.getCompanyId();
        Pledge pledge = pledgeService.lockPledge(command.getPledgeId(), companyId);
        UUID paymentId = UUID.randomUUID();

        MDC.put(CorrelationContext.PLEDGE_ID_MDC_KEY, pledge.getId().toString());
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            if (pledge.isRedeemed()) {
                throw new LedgerStateConflictException("PLEDGE_REDEEMED",
                    "Pledge " + pledge.getPledgeNo() + " is already redeemed");
            }

            LocalDate paymentDate = command.getPaymentDate() != null ? command.getPaymentDate() : LocalDate.now(clock);
            PaymentTotals earlier = pledgeService.paymentTotals(pledge.getId());
            checkAgainstPledge(pledge, paymentDate, amounts, earlier);

            String receiptNumber = command.getReceiptNumber() != null && !command.getReceiptNumber().isBlank()
                ? command.getReceiptNumber()
                : nextReceiptNumber(paymentDate);
            if (paymentRepository.existsByReceiptNumber(receiptNumber)) {
                throw new LedgerStateConflictException(DUPLICATE_RECEIPT_NUMBER,
                    "Receipt number " + receiptNumber + " is already used");
            }

            boolean bankReceipt = isBankReceipt(command.getPaymentMethod(), command.getBankReference());
            Voucher voucher = postPaymentVoucher(pledge, paymentId, receiptNumber, paymentDate, amounts,
                bankReceipt, command.getActor());

            Instant now = Instant.now(clock);
            PledgePayment payment = new PledgePayment(paymentId, companyId, pledge.getId(), paymentDate,
                amounts.getAmount(), amounts.getInterest(), amounts.getPrincipal(), amounts.getPenalty(),
                amounts.getDiscount(), balanceAfter(pledge, amounts.addTo(earlier), paymentDate),
                command.getPaymentMethod(), command.getBankReference(), receiptNumber, command.getNotes(),
                voucher.getId(), command.getActor(), now, now);
            PledgePayment saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment)).toDomain();

            pledgeService.recomputeStatus(pledge.getId(), companyId);
            outboxService.record(PaymentRecordedEvent.from(saved, pledge.getPledgeNo()));
            metrics.recordPaymentAction("recorded");

            log.info("Recorded payment {} of {} on pledge {} ({}), voucher {}",
                receiptNumber, saved.getAmount(), pledge.getPledgeNo(), command.getPaymentMethod(),
                voucher.getVoucherNumber());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PLEDGE_ID_MDC_KEY);
        }
    }

    /**
     * Corrects a payment inside the update window: reverses its voucher, posts a
     * new one with the corrected figures and re-points the payment to it.
     *
     * @throws PaymentTooOldException if the payment is older than the update window
     */
    @Transactional
    public PledgePayment update(UpdatePaymentCommand command) {
        UUID companyId = command.getCompanyId();
        PaymentEntity entity = paymentRepository.findByIdAndCompanyId(command.getPaymentId(), companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Payment", command.getPaymentId()));
        PledgePayment current = entity.toDomain();

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, current.getId().toString());
        MDC.put(CorrelationContext.PLEDGE_ID_MDC_KEY, current.getPledgeId().toString());
        try {
            Pledge pledge = pledgeService.lockPledge(current.getPledgeId(), companyId);
            int window = properties.getPayments().getUpdateWindowDays();
            long ageDays = current.ageInDays(LocalDate.now(clock));
            if (ageDays > window) {
                throw new PaymentTooOldException(current.getId(), "update", ageDays, window);
            }

            PaymentAmounts amounts = PaymentAmounts.of(
                valueOrCurrent(command.getAmount(), current.getAmount()),
                valueOrCurrent(command.getInterestAmount(), current.getInterestAmount()),
                valueOrCurrent(command.getPrincipalAmount(), current.getPrincipalAmount()),
                valueOrCurrent(command.getPenaltyAmount(), current.getPenaltyAmount()),
                valueOrCurrent(command.getDiscountAmount(), current.getDiscountAmount()));
            amounts.validate();

            LocalDate paymentDate = valueOrCurrent(command.getPaymentDate(), current.getPaymentDate());
            PaymentMethod method = valueOrCurrent(command.getPaymentMethod(), current.getPaymentMethod());
            String bankReference = valueOrCurrent(command.getBankReference(), current.getBankReference());
            String notes = valueOrCurrent(command.getNotes(), current.getNotes());
            String reason = command.getReason() != null && !command.getReason().isBlank()
                ? command.getReason()
                : "Payment " + current.getReceiptNumber() + " updated";

            PaymentTotals others = PaymentAmounts.of(current).removeFrom(pledgeService.paymentTotals(pledge.getId()));
            checkAgainstPledge(pledge, paymentDate, amounts, others);

            Voucher reversal = reversalService.reverse(current.getVoucherId(), companyId, command.getActor(), reason);
            Voucher voucher = postPaymentVoucher(pledge, current.getId(), current.getReceiptNumber(), paymentDate,
                amounts, isBankReceipt(method, bankReference), command.getActor());

            PledgePayment revised = new PledgePayment(current.getId(), companyId, pledge.getId(), paymentDate,
                amounts.getAmount(), amounts.getInterest(), amounts.getPrincipal(), amounts.getPenalty(),
                amounts.getDiscount(), balanceAfter(pledge, amounts.addTo(others), paymentDate),
                method, bankReference, current.getReceiptNumber(), notes, voucher.getId(),
                current.getCreatedBy(), current.getCreatedAt(), Instant.now(clock));
            entity.revise(revised);
            PledgePayment saved = paymentRepository.saveAndFlush(entity).toDomain();

            pledgeService.recomputeStatus(pledge.getId(), companyId);
            outboxService.record(PaymentReversedEvent.of(current, reversal, PaymentReversedEvent.Action.UPDATED, reason));
            outboxService.record(PaymentRecordedEvent.from(saved, pledge.getPledgeNo()));
            metrics.recordPaymentAction("updated");

            log.info("Updated payment {}: amount {} -> {}, voucher {} reversed by {}, new voucher {}",
                current.getReceiptNumber(), current.getAmount(), saved.getAmount(),
                current.getVoucherId(), reversal.getVoucherNumber(), voucher.getVoucherNumber());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.PLEDGE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Deletes a payment inside the delete window: reverses its voucher and removes the row.
     *
     * @throws LedgerValidationException if {@code confirm} is false
     * @throws PaymentTooOldException    if the payment is older than the delete window
     */
    @Transactional
    public DeletedPayment delete(UUID paymentId, UUID companyId, boolean confirm, String reason, String actor) {
        if (!confirm) {
            throw new LedgerValidationException("CONFIRMATION_REQUIRED",
                "Deleting a payment requires confirm=true");
        }
        PaymentEntity entity = paymentRepository.findByIdAndCompanyId(paymentId, companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Payment", paymentId));
        PledgePayment payment = entity.toDomain();

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        MDC.put(CorrelationContext.PLEDGE_ID_MDC_KEY, payment.getPledgeId().toString());
        try {
            pledgeService.lockPledge(payment.getPledgeId(), companyId);
            int window = properties.getPayments().getDeleteWindowDays();
            long ageDays = payment.ageInDays(LocalDate.now(clock));
            if (ageDays > window) {
                throw new PaymentTooOldException(paymentId, "delete", ageDays, window);
            }

            String effectiveReason = reason != null && !reason.isBlank()
                ? reason
                : "Payment " + payment.getReceiptNumber() + " deleted";
            Voucher reversal = reversalService.reverse(payment.getVoucherId(), companyId, actor, effectiveReason);

            paymentRepository.delete(entity);
            paymentRepository.flush();

            Pledge pledge = pledgeService.recomputeStatus(payment.getPledgeId(), companyId);
            outboxService.record(PaymentReversedEvent.of(payment, reversal, PaymentReversedEvent.Action.DELETED,
                effectiveReason));
            idempotencyService.forget(payment.getReceiptNumber());
            metrics.recordPaymentAction("deleted");

            log.info("Deleted payment {} of {} on pledge {}; voucher reversed by {}",
                payment.getReceiptNumber(), payment.getAmount(), pledge.getPledgeNo(), reversal.getVoucherNumber());
            return new DeletedPayment(paymentId, payment.getReceiptNumber(), reversal.getId(),
                reversal.getVoucherNumber(), pledge.getStatus());
        } finally {
            MDC.remove(CorrelationContext.PLEDGE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public PledgePayment getPayment(UUID paymentId, UUID companyId) {
        return findPayment(paymentId, companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public Optional<PledgePayment> findPayment(UUID paymentId, UUID companyId) {
        return paymentRepository.findByIdAndCompanyId(paymentId, companyId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<PledgePayment> paymentsOfPledge(UUID pledgeId, UUID companyId) {
        pledgeService.getPledge(pledgeId, companyId);
        return paymentRepository.findByPledgeIdAndCompanyIdOrderByPaymentDateAscCreatedAtAsc(pledgeId, companyId)
            .stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Reports whether the payment is still inside its update and delete windows.
     */
    @Transactional(readOnly = true)
    public ModificationStatus modificationStatus(UUID paymentId, UUID companyId) {
        PledgePayment payment = getPayment(paymentId, companyId);
        Voucher voucher = ledgerService.getVoucher(payment.getVoucherId(), companyId);
        long ageDays = payment.ageInDays(LocalDate.now(clock));
        int updateWindow = properties.getPayments().getUpdateWindowDays();
        int deleteWindow = properties.getPayments().getDeleteWindowDays();

        return ModificationStatus.builder()
            .paymentId(paymentId)
            .receiptNumber(payment.getReceiptNumber())
            .paymentDate(payment.getPaymentDate())
            .ageDays(ageDays)
            .canUpdate(ageDays <= updateWindow)
            .canDelete(ageDays <= deleteWindow)
            .updateWindowDays(updateWindow)
            .deleteWindowDays(deleteWindow)
            .voucherId(voucher.getId())
            .voucherNumber(voucher.getVoucherNumber())
            .voucherEntryCount(voucher.getEntries().size())
            .build();
    }

    /**
     * Dr cash or bank with the amount and customer discount with the discount;
     * Cr the customer with principal plus discount, interest income and late
     * payment charges. Zero lines are left out.
     */
    private Voucher postPaymentVoucher(Pledge pledge, UUID paymentId, String receiptNumber, LocalDate paymentDate,
                                       PaymentAmounts amounts, boolean bankReceipt, String actor) {
        UUID companyId = pledge.getCompanyId();
        LedgerProperties.Accounts codes = properties.getAccounts();
        UUID customerAccount = accountService.getOrCreateCustomerSubAccount(pledge.getCustomerId(), companyId).getId();
        UUID receivingAccount = accountService.requireByCode(companyId,
            bankReceipt ? codes.getBank() : codes.getCash()).getId();
        EntryReference reference = EntryReference.of(ReferenceKind.PAYMENT, paymentId);
        String label = "Payment " + receiptNumber + " for pledge " + pledge.getPledgeNo();

        PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.RECEIPT)
            .voucherDate(paymentDate)
            .narration(label)
            .actor(actor)
            .line(PostingRequest.Line.debit(receivingAccount, amounts.getAmount(),
                bankReceipt ? "Received in bank" : "Received in cash", reference));

        if (LedgerAmounts.isPositive(amounts.getDiscount())) {
            request.line(PostingRequest.Line.debit(
                accountService.requireByCode(companyId, codes.getCustomerDiscount()).getId(),
                amounts.getDiscount(), "Discount allowed", reference));
        }
        if (LedgerAmounts.isPositive(amounts.getPrincipalReduction())) {
            request.line(PostingRequest.Line.credit(customerAccount, amounts.getPrincipalReduction(),
                "Principal repaid", reference));
        }
        if (LedgerAmounts.isPositive(amounts.getInterest())) {
            request.line(PostingRequest.Line.credit(
                accountService.requireByCode(companyId, codes.getInterestIncome()).getId(),
                amounts.getInterest(), "Interest received", reference));
        }
        if (LedgerAmounts.isPositive(amounts.getPenalty())) {
            request.line(PostingRequest.Line.credit(
                accountService.requireByCode(companyId, codes.getLatePaymentCharges()).getId(),
                amounts.getPenalty(), "Late payment charges", reference));
        }
        return ledgerService.post(request.build());
    }

    private void checkAgainstPledge(Pledge pledge, LocalDate paymentDate, PaymentAmounts amounts,
                                    PaymentTotals otherPayments) {
        if (paymentDate.isBefore(pledge.getPledgeDate())) {
            throw new LedgerValidationException("INVALID_PAYMENT_DATE",
                "Payment date " + paymentDate + " is before pledge date " + pledge.getPledgeDate());
        }
        BigDecimal remainingPrincipal = LedgerAmounts.nonNegative(pledge.getPrincipal()
            .subtract(otherPayments.getPrincipal())
            .subtract(otherPayments.getDiscount()));
        if (amounts.getPrincipalReduction().subtract(remainingPrincipal).compareTo(LedgerAmounts.TOLERANCE) >= 0) {
            throw new LedgerValidationException("PRINCIPAL_EXCEEDS_BALANCE",
                "Principal " + amounts.getPrincipal() + " plus discount " + amounts.getDiscount()
                    + " exceeds the remaining principal " + remainingPrincipal,
                Map.of("remaining_principal", remainingPrincipal.toPlainString()));
        }
    }

    /**
     * Settlement balance once this payment is included, as of today or the
     * payment date if that is later.
     */
    private BigDecimal balanceAfter(Pledge pledge, PaymentTotals totals, LocalDate paymentDate) {
        LocalDate today = LocalDate.now(clock);
        LocalDate asOf = paymentDate.isAfter(today) ? paymentDate : today;
        return interestCalculator.quote(pledge, totals, asOf).getFinalAmount();
    }

    private boolean isBankReceipt(PaymentMethod method, String bankReference) {
        return !method.isCash() || (bankReference != null && !bankReference.isBlank());
    }

    private String nextReceiptNumber(LocalDate paymentDate) {
        Long sequence = jdbcTemplate.queryForObject("SELECT nextval('receipt_number_seq')", Long.class);
        return String.format("%s-%d-%05d", properties.getPayments().getReceiptPrefix(), paymentDate.getYear(), sequence);
    }

    private static <T> T valueOrCurrent(T value, T current) {
        return value != null ? value : current;
    }
}
