package uk.gegc.eventpay.features.webhook.application.classification;

/**
 * Raised by {@link PaymentPurposeDecoder} for a purpose tag this service does not know.
 * Classifiers turn it into an ignored intent.
 */
public class UnknownPaymentPurposeException extends RuntimeException {

    public UnknownPaymentPurposeException(String message) {
        super(message);
    }
}
