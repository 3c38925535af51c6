package uk.gegc.eventpay.features.dispute.domain.model;

import java.util.Locale;

public enum DisputeStatus {
    OPEN,
    RESOLVED_BUYER_FAVOUR,
    RESOLVED_SELLER_FAVOUR,
    RESOLVED_OTHER;

    /**
     * Maps a provider outcome to a resolved status. Accepts PayPal outcome codes
     * (either spelling of favour) and Stripe's closed-dispute statuses.
     */
    public static DisputeStatus fromOutcome(String outcomeCode) {
        if (outcomeCode == null) {
            return RESOLVED_OTHER;
        }
        String code = outcomeCode.trim().toUpperCase(Locale.ROOT).replace("FAVOR", "FAVOUR");
        return switch (code) {
            case "RESOLVED_SELLER_FAVOUR", "WON" -> RESOLVED_SELLER_FAVOUR;
            case "RESOLVED_BUYER_FAVOUR", "LOST" -> RESOLVED_BUYER_FAVOUR;
            default -> RESOLVED_OTHER;
        };
    }

    public boolean isResolved() {
        return this != OPEN;
    }
}
