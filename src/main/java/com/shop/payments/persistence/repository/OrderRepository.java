package com.shop.payments.persistence.repository;

import com.shop.payments.domain.OrderStatus;
import com.shop.payments.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/** Spring Data repository for orders. */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<OrderEntity> findAllByOrderByCreatedAtDesc();

    /**
     * Marks the order paid unless it already is. Returns 0 when the order is missing or
     * was paid before.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.paid = true, o.paidAt = :paidAt, o.paymentMethod = COALESCE(:paymentMethod, o.paymentMethod), "
            + "o.paymentReference = :reference, o.paymentResultId = :resultId, "
            + "o.paymentResultStatus = :resultStatus, o.paymentResultUpdateTime = :resultUpdateTime, "
            + "o.paymentResultEmail = :resultEmail, o.updatedAt = :now "
            + "WHERE o.id = :orderId AND o.paid = false")
    int markPaid(@Param("orderId") String orderId,
                 @Param("paidAt") Instant paidAt,
                 @Param("paymentMethod") String paymentMethod,
                 @Param("reference") String reference,
                 @Param("resultId") String resultId,
                 @Param("resultStatus") String resultStatus,
                 @Param("resultUpdateTime") String resultUpdateTime,
                 @Param("resultEmail") String resultEmail,
                 @Param("now") Instant now);

    /**
     * Moves the order to a new status only if its current status is one of {@code from}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :to, o.updatedAt = :now "
            + "WHERE o.id = :orderId AND o.status IN :from")
    int transitionStatus(@Param("orderId") String orderId,
                         @Param("from") Collection<OrderStatus> from,
                         @Param("to") OrderStatus to,
                         @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :to, o.deliveredAt = :deliveredAt, o.updatedAt = :now "
            + "WHERE o.id = :orderId AND o.status IN :from")
    int transitionToDelivered(@Param("orderId") String orderId,
                              @Param("from") Collection<OrderStatus> from,
                              @Param("to") OrderStatus to,
                              @Param("deliveredAt") Instant deliveredAt,
                              @Param("now") Instant now);
}
