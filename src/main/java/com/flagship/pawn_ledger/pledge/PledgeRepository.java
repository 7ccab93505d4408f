package com.flagship.pawn_ledger.pledge;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PledgeRepository extends JpaRepository<PledgeEntity, UUID> {

    Optional<PledgeEntity> findByIdAndCompanyId(UUID id, UUID companyId);

    /**
     * Loads the pledge with {@code SELECT ... FOR UPDATE}; payment changes on the
     * same pledge queue behind the holder.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PledgeEntity p WHERE p.id = :id AND p.companyId = :companyId")
    Optional<PledgeEntity> findForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    boolean existsByCompanyIdAndPledgeNo(UUID companyId, String pledgeNo);

    List<PledgeEntity> findByCompanyIdAndCustomerIdOrderByPledgeDateAsc(UUID companyId, UUID customerId);

    @Query(value = """
        SELECT COALESCE(SUM(interest_amount), 0) AS interest,
               COALESCE(SUM(principal_amount), 0) AS principal,
               COALESCE(SUM(penalty_amount), 0) AS penalty,
               COALESCE(SUM(discount_amount), 0) AS discount,
               COUNT(*) AS "paymentCount"
        FROM pledge_payments
        WHERE pledge_id = :pledgeId
        """, nativeQuery = true)
    PaymentTotalsView sumPayments(@Param("pledgeId") UUID pledgeId);

    /**
     * Projection of {@link #sumPayments(UUID)}.
     */
    interface PaymentTotalsView {
        BigDecimal getInterest();

        BigDecimal getPrincipal();

        BigDecimal getPenalty();

        BigDecimal getDiscount();

        Long getPaymentCount();
    }
}
