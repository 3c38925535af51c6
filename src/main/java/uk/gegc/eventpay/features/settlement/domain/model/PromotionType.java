package uk.gegc.eventpay.features.settlement.domain.model;

import java.util.Locale;

public enum PromotionType {
    FEATURED(7),
    HOMEPAGE(3),
    CATEGORY(7),
    SEARCH_BOOST(14);

    private final int durationDays;

    PromotionType(int durationDays) {
        this.durationDays = durationDays;
    }

    public int getDurationDays() {
        return durationDays;
    }

    /**
     * Lenient lookup for checkout metadata; anything unrecognised is a featured listing.
     */
    public static PromotionType fromMetadata(String value) {
        if (value == null || value.isBlank()) {
            return FEATURED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FEATURED;
        }
    }
}
