package uk.gegc.eventpay.features.settlement.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import uk.gegc.eventpay.features.settlement.domain.model.EventPromotion;
import uk.gegc.eventpay.features.settlement.domain.model.PromotionStatus;
import uk.gegc.eventpay.features.settlement.domain.model.PromotionType;

import java.util.Optional;
import java.util.UUID;

public interface EventPromotionRepository extends JpaRepository<EventPromotion, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<EventPromotion> findFirstByPaymentReference(String paymentReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<EventPromotion> findFirstByEventIdAndPromotionTypeAndStatusOrderByCreatedAtAsc(
            String eventId, PromotionType promotionType, PromotionStatus status);
}
