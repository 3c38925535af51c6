package uk.gegc.eventpay.features.webhook.infra.paypal;

/**
 * The five {@code paypal-*} transmission headers PayPal signs each delivery with.
 */
public record PayPalSignatureHeaders(
        String transmissionId,
        String transmissionTime,
        String certUrl,
        String authAlgo,
        String transmissionSig
) {
    public boolean isComplete() {
        return notBlank(transmissionId) && notBlank(transmissionTime) && notBlank(certUrl)
                && notBlank(authAlgo) && notBlank(transmissionSig);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
