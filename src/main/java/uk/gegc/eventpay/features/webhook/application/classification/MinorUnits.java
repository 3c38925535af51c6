package uk.gegc.eventpay.features.webhook.application.classification;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;

/**
 * Converts provider decimal amount strings ({@code "25.00"}) to integer minor units using the
 * currency's fraction digits, two when the currency is unknown.
 */
@Slf4j
public final class MinorUnits {

    private static final int DEFAULT_FRACTION_DIGITS = 2;

    private MinorUnits() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @return amount in minor units, 0 for a missing or unparseable value
     */
    public static long fromDecimal(String amount, String currencyCode) {
        if (amount == null || amount.isBlank()) {
            return 0L;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            log.warn("Unparseable provider amount '{}' ({}), treating as 0", amount, currencyCode);
            return 0L;
        }
        BigDecimal scaled = value.movePointRight(fractionDigits(currencyCode));
        BigDecimal rounded = scaled.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(scaled) != 0) {
            log.warn("Provider amount {} {} has sub-minor-unit precision, rounded to {}", amount, currencyCode, rounded);
        }
        return rounded.longValueExact();
    }

    static int fractionDigits(String currencyCode) {
        if (currencyCode == null || currencyCode.isBlank()) {
            return DEFAULT_FRACTION_DIGITS;
        }
        try {
            int digits = Currency.getInstance(currencyCode.trim().toUpperCase(Locale.ROOT)).getDefaultFractionDigits();
            return digits < 0 ? DEFAULT_FRACTION_DIGITS : digits;
        } catch (IllegalArgumentException e) {
            return DEFAULT_FRACTION_DIGITS;
        }
    }
}
