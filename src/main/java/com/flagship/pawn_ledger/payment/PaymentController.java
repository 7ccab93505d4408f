package com.flagship.pawn_ledger.payment;

import com.flagship.pawn_ledger.ledger.ReversalService;
import com.flagship.pawn_ledger.ledger.ReversalSummary;
import com.flagship.pawn_ledger.observability.LedgerMetrics;
import com.flagship.pawn_ledger.payment.dto.PaymentResponse;
import com.flagship.pawn_ledger.payment.dto.RecordPaymentRequest;
import com.flagship.pawn_ledger.payment.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Payment endpoints.
 *
 * Recording is idempotent on the receipt number: repeating a request with a
 * receipt number that already belongs to a payment of the same pledge returns
 * that payment with 200 instead of recording it twice.
 */
@RestController
@RequestMapping("/api/companies/{companyId}")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final PaymentService paymentService;
    private final ReversalService reversalService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping("/pledges/{pledgeId}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("pledgeId") UUID pledgeId,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(ACTOR_HEADER) String actor) {

        return metrics.timeApi("record_payment", () -> {
            String receiptNumber = request.getReceiptNumber();
            Optional<PledgePayment> existing = idempotencyService.findPaymentId(receiptNumber)
                .flatMap(paymentId -> paymentService.findPayment(paymentId, companyId))
                .filter(payment -> payment.getPledgeId().equals(pledgeId));

            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Receipt {} already recorded as payment {}, returning it",
                    receiptNumber, existing.get().getId());
                return ResponseEntity.ok(PaymentResponse.from(existing.get()));
            }
            if (receiptNumber != null && !receiptNumber.isBlank()) {
                metrics.recordIdempotencyMiss();
            }

            PledgePayment payment = paymentService.record(request.toCommand(companyId, pledgeId, actor));
            idempotencyService.remember(payment.getReceiptNumber(), payment.getId());
            return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
        });
    }

    @GetMapping("/pledges/{pledgeId}/payments")
    public List<PaymentResponse> paymentsOfPledge(@PathVariable("companyId") UUID companyId,
                                                  @PathVariable("pledgeId") UUID pledgeId) {
        return paymentService.paymentsOfPledge(pledgeId, companyId).stream()
            .map(PaymentResponse::from)
            .toList();
    }

    @GetMapping("/payments/{paymentId}")
    public PaymentResponse getPayment(@PathVariable("companyId") UUID companyId,
                                      @PathVariable("paymentId") UUID paymentId) {
        return PaymentResponse.from(paymentService.getPayment(paymentId, companyId));
    }

    @PutMapping("/payments/{paymentId}")
    public PaymentResponse updatePayment(@PathVariable("companyId") UUID companyId,
                                         @PathVariable("paymentId") UUID paymentId,
                                         @Valid @RequestBody UpdatePaymentRequest request,
                                         @RequestHeader(ACTOR_HEADER) String actor) {
        return metrics.timeApi("update_payment",
            () -> PaymentResponse.from(paymentService.update(request.toCommand(paymentId, companyId, actor))));
    }

    @DeleteMapping("/payments/{paymentId}")
    public DeletedPayment deletePayment(@PathVariable("companyId") UUID companyId,
                                        @PathVariable("paymentId") UUID paymentId,
                                        @RequestParam(name = "confirm", defaultValue = "false") boolean confirm,
                                        @RequestParam(name = "reason", required = false) String reason,
                                        @RequestHeader(ACTOR_HEADER) String actor) {
        return metrics.timeApi("delete_payment",
            () -> paymentService.delete(paymentId, companyId, confirm, reason, actor));
    }

    @GetMapping("/payments/{paymentId}/modification-status")
    public ModificationStatus modificationStatus(@PathVariable("companyId") UUID companyId,
                                                 @PathVariable("paymentId") UUID paymentId) {
        return paymentService.modificationStatus(paymentId, companyId);
    }

    @GetMapping("/payments/recent-modifications")
    public List<ReversalSummary> recentModifications(@PathVariable("companyId") UUID companyId,
                                                     @RequestParam(name = "days", defaultValue = "7") int days) {
        return reversalService.recentModifications(companyId, days);
    }
}
