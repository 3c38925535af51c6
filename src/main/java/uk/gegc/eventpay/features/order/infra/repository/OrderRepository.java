package uk.gegc.eventpay.features.order.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.eventpay.features.order.domain.model.Order;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookups used by webhook transitions take a pessimistic write lock so two deliveries of the
 * same payment serialise on the order row.
 */
public interface OrderRepository extends JpaRepository<Order, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM TicketOrder o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findFirstByStripePaymentIntentIdOrderByCreatedAtAsc(String stripePaymentIntentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findFirstByPaypalOrderIdOrderByCreatedAtAsc(String paypalOrderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findFirstByPaypalCaptureIdOrderByCreatedAtAsc(String paypalCaptureId);

    /**
     * Non-locking lookup for linking records (disputes) to an order by any provider id.
     */
    @Query("""
            SELECT o.id FROM TicketOrder o
            WHERE o.stripePaymentIntentId = :paymentIntentId
               OR o.paypalOrderId = :paypalOrderId
               OR o.paypalCaptureId = :paypalCaptureId
            ORDER BY o.createdAt ASC
            """)
    List<UUID> findIdsByProviderIds(@Param("paymentIntentId") String paymentIntentId,
                                    @Param("paypalOrderId") String paypalOrderId,
                                    @Param("paypalCaptureId") String paypalCaptureId);
}
