package uk.gegc.eventpay.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.account.application.AccountStatusService;
import uk.gegc.eventpay.features.account.domain.model.ConnectedAccount;
import uk.gegc.eventpay.features.account.infra.repository.ConnectedAccountRepository;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountStatusServiceImpl implements AccountStatusService {

    private final ConnectedAccountRepository connectedAccountRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<Boolean> updateStatus(WebhookIntent.AccountStatusChanged change) {
        if (change.accountId() == null) {
            log.warn("Account update without an account id");
            return Optional.empty();
        }
        Optional<ConnectedAccount> found = connectedAccountRepository.findByStripeAccountId(change.accountId());
        if (found.isEmpty()) {
            log.warn("Account update for unknown connected account {}", change.accountId());
            return Optional.empty();
        }

        ConnectedAccount account = found.get();
        boolean complete = change.detailsSubmitted()
                && change.chargesEnabled()
                && change.payoutsEnabled()
                && !change.requirementsDue();
        account.setChargesEnabled(change.chargesEnabled());
        account.setPayoutsEnabled(change.payoutsEnabled());
        account.setDetailsSubmitted(change.detailsSubmitted());
        account.setRequirementsDue(change.requirementsDue());
        account.setOnboardingComplete(complete);
        account.setUpdatedAt(LocalDateTime.now(clock));
        connectedAccountRepository.save(account);

        log.info("Connected account {} updated: charges={}, payouts={}, onboardingComplete={}",
                change.accountId(), change.chargesEnabled(), change.payoutsEnabled(), complete);
        return Optional.of(complete);
    }
}
