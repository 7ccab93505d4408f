package com.flagship.pawn_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Row of {@code pledge_payments}.
 *
 * No setters: a payment changes only through {@link #revise(PledgePayment)},
 * which the payment service calls after the old voucher has been reversed and
 * the new one posted.
 */
@Entity
@Table(name = "pledge_payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "pledge_id", nullable = false, updatable = false)
    private UUID pledgeId;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "interest_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "principal_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "penalty_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal penaltyAmount;

    @Column(name = "discount_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "balance_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal balanceAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "bank_reference", length = 100)
    private String bankReference;

    @Column(name = "receipt_number", nullable = false, updatable = false, unique = true, length = 50)
    private String receiptNumber;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "voucher_id", nullable = false)
    private UUID voucherId;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PaymentEntity fromDomain(PledgePayment payment) {
        PaymentEntity entity = new PaymentEntity();
        entity.id = payment.getId();
        entity.companyId = payment.getCompanyId();
        entity.pledgeId = payment.getPledgeId();
        entity.receiptNumber = payment.getReceiptNumber();
        entity.createdBy = payment.getCreatedBy();
        entity.createdAt = payment.getCreatedAt();
        entity.copyMutableFields(payment);
        return entity;
    }

    public PledgePayment toDomain() {
        return new PledgePayment(id, companyId, pledgeId, paymentDate, amount, interestAmount, principalAmount,
            penaltyAmount, discountAmount, balanceAmount, paymentMethod, bankReference, receiptNumber, notes,
            voucherId, createdBy, createdAt, updatedAt);
    }

    /**
     * Takes over the revised amounts and the voucher that now represents them.
     * Identity, receipt number and creation data stay unchanged.
     */
    void revise(PledgePayment revised) {
        if (!revised.getId().equals(id)) {
            throw new IllegalArgumentException("Cannot revise payment " + id + " from " + revised.getId());
        }
        copyMutableFields(revised);
    }

    private void copyMutableFields(PledgePayment payment) {
        this.paymentDate = payment.getPaymentDate();
        this.amount = payment.getAmount();
        this.interestAmount = payment.getInterestAmount();
        this.principalAmount = payment.getPrincipalAmount();
        this.penaltyAmount = payment.getPenaltyAmount();
        this.discountAmount = payment.getDiscountAmount();
        this.balanceAmount = payment.getBalanceAmount();
        this.paymentMethod = payment.getPaymentMethod();
        this.bankReference = payment.getBankReference();
        this.notes = payment.getNotes();
        this.voucherId = payment.getVoucherId();
        this.updatedAt = payment.getUpdatedAt();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
