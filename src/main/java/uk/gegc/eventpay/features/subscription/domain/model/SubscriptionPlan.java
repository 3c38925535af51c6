package uk.gegc.eventpay.features.subscription.domain.model;

import java.util.Locale;

/**
 * Organizer subscription tiers and the limits each one grants. {@code null} limits mean unlimited;
 * a {@code null} duration means the plan never expires.
 */
public enum SubscriptionPlan {
    FREE(3, 100, 0, null),
    BASIC(10, 500, 100, 30),
    PRO(50, 2000, 500, 30),
    ENTERPRISE(null, null, 2000, 30);

    /** Plan assumed when metadata names no plan or one we do not sell. */
    public static final SubscriptionPlan FALLBACK = BASIC;

    private final Integer maxEventsPerMonth;
    private final Integer maxTicketsPerEvent;
    private final int includedCredits;
    private final Integer durationDays;

    SubscriptionPlan(Integer maxEventsPerMonth, Integer maxTicketsPerEvent, int includedCredits, Integer durationDays) {
        this.maxEventsPerMonth = maxEventsPerMonth;
        this.maxTicketsPerEvent = maxTicketsPerEvent;
        this.includedCredits = includedCredits;
        this.durationDays = durationDays;
    }

    public Integer getMaxEventsPerMonth() {
        return maxEventsPerMonth;
    }

    public Integer getMaxTicketsPerEvent() {
        return maxTicketsPerEvent;
    }

    public int getIncludedCredits() {
        return includedCredits;
    }

    public Integer getDurationDays() {
        return durationDays;
    }

    /**
     * Case-insensitive plan lookup for checkout and subscription metadata.
     */
    public static SubscriptionPlan fromMetadata(String value) {
        if (value == null || value.isBlank()) {
            return FALLBACK;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FALLBACK;
        }
    }
}
