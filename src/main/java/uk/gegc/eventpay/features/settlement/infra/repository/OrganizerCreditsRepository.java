package uk.gegc.eventpay.features.settlement.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import uk.gegc.eventpay.features.settlement.domain.model.OrganizerCredits;

import java.util.Optional;
import java.util.UUID;

public interface OrganizerCreditsRepository extends JpaRepository<OrganizerCredits, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<OrganizerCredits> findByOrganizerId(String organizerId);
}
