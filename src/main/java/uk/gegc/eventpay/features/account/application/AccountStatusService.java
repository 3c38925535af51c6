package uk.gegc.eventpay.features.account.application;

import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;

import java.util.Optional;

public interface AccountStatusService {

    /**
     * Stores the capability flags reported for a connected account.
     *
     * @return whether onboarding is now complete, or empty when the account is not known here
     */
    Optional<Boolean> updateStatus(WebhookIntent.AccountStatusChanged change);
}
