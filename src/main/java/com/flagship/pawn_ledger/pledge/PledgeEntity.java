package com.flagship.pawn_ledger.pledge;

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
 * Row of {@code pledges}. Only the status changes after disbursal.
 */
@Entity
@Table(name = "pledges")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PledgeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "scheme_id", nullable = false, updatable = false)
    private UUID schemeId;

    @Column(name = "pledge_no", nullable = false, updatable = false, length = 40)
    private String pledgeNo;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principal;

    @Column(name = "monthly_rate", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal monthlyRate;

    @Column(name = "first_month_interest", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal firstMonthInterest;

    @Column(name = "document_charges", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal documentCharges;

    @Column(name = "final_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal finalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PledgeStatus status;

    @Column(name = "pledge_date", nullable = false, updatable = false)
    private LocalDate pledgeDate;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "disbursal_voucher_id", updatable = false)
    private UUID disbursalVoucherId;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PledgeEntity fromDomain(Pledge pledge) {
        PledgeEntity entity = new PledgeEntity();
        entity.id = pledge.getId();
        entity.companyId = pledge.getCompanyId();
        entity.customerId = pledge.getCustomerId();
        entity.schemeId = pledge.getSchemeId();
        entity.pledgeNo = pledge.getPledgeNo();
        entity.principal = pledge.getPrincipal();
        entity.monthlyRate = pledge.getMonthlyRate();
        entity.firstMonthInterest = pledge.getFirstMonthInterest();
        entity.documentCharges = pledge.getDocumentCharges();
        entity.finalAmount = pledge.getFinalAmount();
        entity.status = pledge.getStatus();
        entity.pledgeDate = pledge.getPledgeDate();
        entity.dueDate = pledge.getDueDate();
        entity.disbursalVoucherId = pledge.getDisbursalVoucherId();
        entity.createdBy = pledge.getCreatedBy();
        entity.createdAt = pledge.getCreatedAt();
        entity.updatedAt = pledge.getUpdatedAt();
        return entity;
    }

    public Pledge toDomain() {
        return new Pledge(id, companyId, customerId, schemeId, pledgeNo, principal, monthlyRate,
            firstMonthInterest, documentCharges, finalAmount, status, pledgeDate, dueDate,
            disbursalVoucherId, createdBy, createdAt, updatedAt);
    }

    void changeStatus(PledgeStatus newStatus) {
        this.status = newStatus;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
