package uk.gegc.eventpay.features.account.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.eventpay.features.account.domain.model.ConnectedAccount;

import java.util.Optional;
import java.util.UUID;

public interface ConnectedAccountRepository extends JpaRepository<ConnectedAccount, UUID> {

    Optional<ConnectedAccount> findByStripeAccountId(String stripeAccountId);
}
