package uk.gegc.eventpay.features.webhook.application.classification;

import java.util.Locale;
import java.util.Optional;

/**
 * Things the platform itself sells to organizers.
 */
public enum PlatformProductType {
    CREDITS,
    SUBSCRIPTION,
    PROMOTION,
    PREMIUM_FEATURE;

    public static Optional<PlatformProductType> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
