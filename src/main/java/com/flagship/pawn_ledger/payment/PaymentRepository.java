package com.flagship.pawn_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Receipt numbers are unique system-wide.
     */
    Optional<PaymentEntity> findByReceiptNumber(String receiptNumber);

    boolean existsByReceiptNumber(String receiptNumber);

    List<PaymentEntity> findByPledgeIdAndCompanyIdOrderByPaymentDateAscCreatedAtAsc(UUID pledgeId, UUID companyId);
}
