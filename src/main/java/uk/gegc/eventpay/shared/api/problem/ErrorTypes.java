package uk.gegc.eventpay.shared.api.problem;

import java.net.URI;

/**
 * Problem Detail {@code type} values returned by EventPay. Payment providers ignore the body,
 * but operators replaying failed deliveries rely on the type to tell rejections from outages.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://eventpay.gegc.uk/docs/errors";

    /** Stripe signature mismatch (400) or PayPal verification failure (401). */
    public static final URI WEBHOOK_INVALID_SIGNATURE = type("webhook-invalid-signature");

    /** Production deployment without the provider's signing secret or webhook id (403). */
    public static final URI WEBHOOK_VERIFICATION_UNCONFIGURED = type("webhook-verification-unconfigured");

    /** Body parsed, but it is not an event: not an object, or no id or type (400). */
    public static final URI WEBHOOK_MALFORMED_PAYLOAD = type("webhook-malformed-payload");

    /** Provider endpoint switched off with a feature flag (404). */
    public static final URI WEBHOOK_ENDPOINT_DISABLED = type("webhook-endpoint-disabled");

    public static final URI WEBHOOK_PROCESSING_ERROR = type("webhook-processing-error");
    public static final URI DATA_ACCESS_ERROR = type("data-access-error");
    public static final URI MALFORMED_JSON = type("malformed-json");

    public static final URI UNAUTHORIZED = type("unauthorized");
    public static final URI ACCESS_DENIED = type("access-denied");

    private ErrorTypes() {
    }

    private static URI type(String slug) {
        return URI.create(BASE_URL + "/" + slug);
    }
}
