package uk.gegc.eventpay.features.webhook.application.verification;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Authenticity check for one provider. Implementations never throw: malformed input,
 * transport failures and provider rejections all come back as {@link VerificationResult#INVALID}.
 */
public interface WebhookVerifier {

    WebhookProvider provider();

    VerificationResult verify(WebhookRequest request);
}
