package uk.gegc.eventpay.features.settlement.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.eventpay.features.settlement.domain.model.PlatformDebtSettlement;

import java.util.List;
import java.util.UUID;

public interface PlatformDebtSettlementRepository extends JpaRepository<PlatformDebtSettlement, UUID> {

    boolean existsByOrderId(String orderId);

    List<PlatformDebtSettlement> findByOrganizerIdOrderByCreatedAtAsc(String organizerId);
}
