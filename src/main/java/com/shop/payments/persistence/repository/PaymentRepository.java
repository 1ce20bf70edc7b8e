package com.shop.payments.persistence.repository;

import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.persistence.entity.PaymentEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for ledger entries. Status changes go through {@link #resolvePending} only.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    Optional<PaymentEntity> findByReference(String reference);

    Optional<PaymentEntity> findByActiveOrderId(String activeOrderId);

    /**
     * Moves a PENDING payment to its verdict. Returns the number of rows changed: 0 means the
     * reference is unknown or somebody else already resolved it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.status = :status, p.channel = :channel, "
            + "p.gatewayResponse = :gatewayResponse, p.rawPayload = :rawPayload, p.paidAt = :paidAt, "
            + "p.activeOrderId = :activeOrderId, p.updatedAt = :now "
            + "WHERE p.reference = :reference AND p.status = :expected")
    int resolvePending(@Param("reference") String reference,
                       @Param("expected") PaymentStatus expected,
                       @Param("status") PaymentStatus status,
                       @Param("channel") String channel,
                       @Param("gatewayResponse") String gatewayResponse,
                       @Param("rawPayload") String rawPayload,
                       @Param("paidAt") Instant paidAt,
                       @Param("activeOrderId") String activeOrderId,
                       @Param("now") Instant now);

    @Query("SELECT p FROM PaymentEntity p WHERE (:userId IS NULL OR p.userId = :userId) "
            + "AND (:status IS NULL OR p.status = :status) "
            + "AND (:startDate IS NULL OR p.createdAt >= :startDate) "
            + "AND (:endDate IS NULL OR p.createdAt <= :endDate)")
    Page<PaymentEntity> search(@Param("userId") String userId,
                               @Param("status") PaymentStatus status,
                               @Param("startDate") Instant startDate,
                               @Param("endDate") Instant endDate,
                               Pageable pageable);
}
