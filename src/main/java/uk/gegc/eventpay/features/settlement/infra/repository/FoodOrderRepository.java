package uk.gegc.eventpay.features.settlement.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.eventpay.features.settlement.domain.model.FoodOrder;

import java.util.Optional;
import java.util.UUID;

public interface FoodOrderRepository extends JpaRepository<FoodOrder, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FoodOrder f WHERE f.id = :id")
    Optional<FoodOrder> findByIdForUpdate(@Param("id") UUID id);
}
