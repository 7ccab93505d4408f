package com.flagship.pawn_ledger.pledge;

import com.flagship.pawn_ledger.account.Account;
import com.flagship.pawn_ledger.account.AccountService;
import com.flagship.pawn_ledger.config.LedgerProperties;
import com.flagship.pawn_ledger.event.PledgeDisbursedEvent;
import com.flagship.pawn_ledger.exception.LedgerReferenceException;
import com.flagship.pawn_ledger.exception.LedgerStateConflictException;
import com.flagship.pawn_ledger.exception.LedgerValidationException;
import com.flagship.pawn_ledger.ledger.EntryReference;
import com.flagship.pawn_ledger.ledger.LedgerAmounts;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.ReferenceKind;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import com.flagship.pawn_ledger.master.Customer;
import com.flagship.pawn_ledger.master.MasterDataService;
import com.flagship.pawn_ledger.master.Scheme;
import com.flagship.pawn_ledger.observability.CorrelationContext;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Pledge disbursal, settlement quotes and status.
 *
 * Status is recomputed from the payment totals after every payment change; it
 * is never set directly by a caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PledgeService {

    private final PledgeRepository pledgeRepository;
    private final LedgerService ledgerService;
    private final AccountService accountService;
    private final MasterDataService masterDataService;
    private final InterestCalculator interestCalculator;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Disburses a pledge and posts its LOAN_DISBURSAL voucher.
     *
     * The voucher debits the customer with the final amount and credits cash with
     * the principal, interest income with the first-month interest and service
     * charges with the document charges. The deductions are then collected in
     * cash against the customer in the same voucher. Zero lines are left out.
     */
    @Transactional
    public Pledge disburse(DisbursePledgeCommand command) {
        validate(command);
        Customer customer = masterDataService.getCustomer(command.getCustomerId(), command.getCompanyId());
        Scheme scheme = masterDataService.getScheme(command.getSchemeId(), command.getCompanyId());

        UUID companyId = command.getCompanyId();
        UUID pledgeId = UUID.randomUUID();
        MDC.put(CorrelationContext.PLEDGE_ID_MDC_KEY, pledgeId.toString());
        try {
            BigDecimal principal = LedgerAmounts.normalize(command.getPrincipal());
            BigDecimal firstMonthInterest = command.getFirstMonthInterest() != null
                ? LedgerAmounts.normalize(command.getFirstMonthInterest())
                : interestCalculator.firstMonthInterest(principal, scheme.getMonthlyRate());
            BigDecimal documentCharges = LedgerAmounts.normalize(command.getDocumentCharges());
            BigDecimal deductions = firstMonthInterest.add(documentCharges);
            BigDecimal finalAmount = principal.add(deductions);

            String pledgeNo = command.getPledgeNo() != null && !command.getPledgeNo().isBlank()
                ? command.getPledgeNo()
                : nextPledgeNumber(command.getPledgeDate());
            if (pledgeRepository.existsByCompanyIdAndPledgeNo(companyId, pledgeNo)) {
                throw new LedgerStateConflictException("DUPLICATE_PLEDGE_NUMBER",
                    "Pledge number " + pledgeNo + " already exists");
            }

            Account customerAccount = accountService.getOrCreateCustomerSubAccount(customer.getId(), companyId);
            LedgerProperties.Accounts codes = properties.getAccounts();
            UUID cash = accountService.requireByCode(companyId, codes.getCash()).getId();
            EntryReference reference = EntryReference.of(ReferenceKind.PLEDGE, pledgeId);

            PostingRequest.PostingRequestBuilder request = PostingRequest.builder()
                .companyId(companyId)
                .voucherType(VoucherType.LOAN_DISBURSAL)
                .voucherDate(command.getPledgeDate())
                .narration("Pledge " + pledgeNo + " disbursed to " + customer.getName())
                .actor(command.getActor())
                .line(PostingRequest.Line.debit(customerAccount.getId(), finalAmount,
                    "Pledge " + pledgeNo + " final amount", reference))
                .line(PostingRequest.Line.credit(cash, principal, "Cash paid to customer", reference));

            if (LedgerAmounts.isPositive(firstMonthInterest)) {
                request.line(PostingRequest.Line.credit(
                    accountService.requireByCode(companyId, codes.getInterestIncome()).getId(),
                    firstMonthInterest, "First month interest", reference));
            }
            if (LedgerAmounts.isPositive(documentCharges)) {
                request.line(PostingRequest.Line.credit(
                    accountService.requireByCode(companyId, codes.getServiceCharges()).getId(),
                    documentCharges, "Document charges", reference));
            }
            if (LedgerAmounts.isPositive(deductions)) {
                request.line(PostingRequest.Line.debit(cash, deductions, "Deductions collected at disbursal", reference));
                request.line(PostingRequest.Line.credit(customerAccount.getId(), deductions,
                    "Deductions collected at disbursal", reference));
            }

            Voucher voucher = ledgerService.post(request.build());

            Pledge pledge = Pledge.disbursed(pledgeId, companyId, customer.getId(), scheme.getId(), pledgeNo,
                principal, scheme.getMonthlyRate(), firstMonthInterest, documentCharges,
                command.getPledgeDate(), command.getPledgeDate().plusMonths(scheme.getDurationMonths()),
                voucher.getId(), command.getActor());
            Pledge saved = pledgeRepository.saveAndFlush(PledgeEntity.fromDomain(pledge)).toDomain();

            outboxService.record(PledgeDisbursedEvent.from(saved));
            metrics.recordPledgeDisbursed();
            log.info("Disbursed pledge {} to customer {}: principal={}, final amount={}, voucher={}",
                pledgeNo, customer.getId(), principal, saved.getFinalAmount(), voucher.getVoucherNumber());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.PLEDGE_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Pledge getPledge(UUID pledgeId, UUID companyId) {
        return pledgeRepository.findByIdAndCompanyId(pledgeId, companyId)
            .map(PledgeEntity::toDomain)
            .orElseThrow(() -> LedgerReferenceException.notFound("Pledge", pledgeId));
    }

    @Transactional(readOnly = true)
    public List<Pledge> pledgesOfCustomer(UUID customerId, UUID companyId) {
        return pledgeRepository.findByCompanyIdAndCustomerIdOrderByPledgeDateAsc(companyId, customerId)
            .stream()
            .map(PledgeEntity::toDomain)
            .toList();
    }

    /**
     * Locks the pledge row until the surrounding transaction ends.
     */
    @Transactional
    public Pledge lockPledge(UUID pledgeId, UUID companyId) {
        return pledgeRepository.findForUpdate(pledgeId, companyId)
            .map(PledgeEntity::toDomain)
            .orElseThrow(() -> LedgerReferenceException.notFound("Pledge", pledgeId));
    }

    @Transactional(readOnly = true)
    public SettlementQuote settlementQuote(UUID pledgeId, UUID companyId, LocalDate asOf) {
        Pledge pledge = getPledge(pledgeId, companyId);
        return interestCalculator.quote(pledge, paymentTotals(pledgeId), asOf);
    }

    /**
     * Re-derives the status as of today from the recorded payments.
     */
    @Transactional
    public Pledge recomputeStatus(UUID pledgeId, UUID companyId) {
        PledgeEntity entity = pledgeRepository.findByIdAndCompanyId(pledgeId, companyId)
            .orElseThrow(() -> LedgerReferenceException.notFound("Pledge", pledgeId));
        Pledge pledge = entity.toDomain();
        LocalDate today = LocalDate.now(clock);
        LocalDate asOf = today.isBefore(pledge.getPledgeDate()) ? pledge.getPledgeDate() : today;

        SettlementQuote quote = interestCalculator.quote(pledge, paymentTotals(pledgeId), asOf);
        if (quote.getStatus() != pledge.getStatus()) {
            log.info("Pledge {} status {} -> {} (net outstanding {})",
                pledge.getPledgeNo(), pledge.getStatus(), quote.getStatus(), quote.getNetOutstanding());
            entity.changeStatus(quote.getStatus());
            pledgeRepository.saveAndFlush(entity);
        }
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public PaymentTotals paymentTotals(UUID pledgeId) {
        PledgeRepository.PaymentTotalsView view = pledgeRepository.sumPayments(pledgeId);
        if (view == null) {
            return PaymentTotals.NONE;
        }
        return new PaymentTotals(
            LedgerAmounts.normalize(view.getInterest()),
            LedgerAmounts.normalize(view.getPrincipal()),
            LedgerAmounts.normalize(view.getPenalty()),
            LedgerAmounts.normalize(view.getDiscount()),
            view.getPaymentCount() != null ? view.getPaymentCount() : 0L);
    }

    private void validate(DisbursePledgeCommand command) {
        if (command.getCompanyId() == null || command.getCustomerId() == null || command.getSchemeId() == null
            || command.getPledgeDate() == null) {
            throw new LedgerValidationException("INVALID_PLEDGE", "Company, customer, scheme and pledge date are required");
        }
        if (!LedgerAmounts.isPositive(LedgerAmounts.normalize(command.getPrincipal()))) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Principal must be positive");
        }
        if (isNegative(command.getFirstMonthInterest()) || isNegative(command.getDocumentCharges())) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Interest and charges cannot be negative");
        }
    }

    private boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }

    private String nextPledgeNumber(LocalDate pledgeDate) {
        Long sequence = jdbcTemplate.queryForObject("SELECT nextval('pledge_number_seq')", Long.class);
        return String.format("%s-%d-%d", properties.getPledges().getNumberPrefix(), pledgeDate.getYear(), sequence);
    }
}
