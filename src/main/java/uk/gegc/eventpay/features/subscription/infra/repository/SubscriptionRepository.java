package uk.gegc.eventpay.features.subscription.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import uk.gegc.eventpay.features.subscription.domain.model.Subscription;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionState;

import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Subscription> findByStripeSubscriptionId(String stripeSubscriptionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Subscription> findFirstByUserIdAndStatusOrderByCreatedAtDesc(String userId, SubscriptionState status);
}
