package uk.gegc.eventpay.features.webhook.application.verification;

/**
 * Outcome of checking a delivery's authenticity.
 */
public enum VerificationResult {
    /** Signature checked and genuine. */
    VALID,
    /** Signature missing, malformed, stale or rejected by the provider. */
    INVALID,
    /** Credentials missing in production; the delivery must be refused. */
    UNCONFIGURED,
    /** Credentials missing outside production; processed unverified and logged. */
    UNVERIFIED_ALLOWED;

    public boolean permitsProcessing() {
        return this == VALID || this == UNVERIFIED_ALLOWED;
    }
}
