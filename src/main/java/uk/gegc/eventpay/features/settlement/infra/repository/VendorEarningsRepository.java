package uk.gegc.eventpay.features.settlement.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.eventpay.features.settlement.domain.model.VendorEarnings;

import java.util.Optional;
import java.util.UUID;

public interface VendorEarningsRepository extends JpaRepository<VendorEarnings, UUID> {

    boolean existsByProductOrderId(UUID productOrderId);

    Optional<VendorEarnings> findByProductOrderId(UUID productOrderId);
}
