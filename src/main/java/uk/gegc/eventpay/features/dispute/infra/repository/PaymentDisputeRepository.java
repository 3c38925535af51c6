package uk.gegc.eventpay.features.dispute.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import uk.gegc.eventpay.features.dispute.domain.model.PaymentDispute;

import java.util.Optional;
import java.util.UUID;

public interface PaymentDisputeRepository extends JpaRepository<PaymentDispute, UUID> {

    boolean existsByDisputeId(String disputeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<PaymentDispute> findByDisputeId(String disputeId);
}
