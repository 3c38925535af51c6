package uk.gegc.eventpay.features.settlement.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import uk.gegc.eventpay.features.settlement.domain.model.CreditTransaction;

import java.util.Optional;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<CreditTransaction> findByPaymentReference(String paymentReference);
}
