package uk.gegc.eventpay.features.webhook.application.classification;

import java.util.Locale;
import java.util.Map;

/**
 * Decodes the purpose tag written into Stripe {@code metadata} or PayPal {@code custom_id}
 * when the checkout was created.
 */
public final class PaymentPurposeDecoder {

    public static final String CHARGE_TYPE = "chargeType";
    public static final String PRODUCT_TYPE = "productType";
    static final String PAYPAL_TYPE = "type";
    static final String PAYPAL_CREDIT_PURCHASE = "CREDIT_PURCHASE";
    static final int DEFAULT_COMMISSION_PERCENT = 15;

    private PaymentPurposeDecoder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static PaymentPurpose decode(Map<String, String> metadata) {
        Map<String, String> meta = metadata == null ? Map.of() : metadata;

        if (PAYPAL_CREDIT_PURCHASE.equalsIgnoreCase(meta.get(PAYPAL_TYPE))) {
            return platformProduct(PlatformProductType.CREDITS, meta);
        }

        String chargeType = meta.get(CHARGE_TYPE);
        if (chargeType == null || chargeType.isBlank()) {
            return ticketOrder(meta);
        }

        return switch (chargeType.trim().toUpperCase(Locale.ROOT)) {
            case "TICKET_ORDER" -> ticketOrder(meta);
            case "PRODUCT_ORDER" -> new PaymentPurpose.ProductOrder(
                    blankToNull(meta.get("orderId")),
                    blankToNull(meta.get("vendorId")),
                    (int) parseLong(meta.get("commissionPercent"), DEFAULT_COMMISSION_PERCENT),
                    parseLong(meta.get("applicationFee"), 0L));
            case "FOOD_ORDER" -> new PaymentPurpose.FoodOrder(blankToNull(meta.get("orderId")));
            case "PLATFORM" -> platformProduct(PlatformProductType.fromTag(meta.get(PRODUCT_TYPE))
                    .orElseThrow(() -> new UnknownPaymentPurposeException(
                            "Unknown platform product type: " + meta.get(PRODUCT_TYPE))), meta);
            default -> throw new UnknownPaymentPurposeException("Unknown charge type: " + chargeType);
        };
    }

    private static PaymentPurpose.TicketOrder ticketOrder(Map<String, String> meta) {
        return new PaymentPurpose.TicketOrder(
                blankToNull(meta.get("orderId")),
                parseLong(meta.get("settlementAmount"), 0L),
                blankToNull(meta.get("organizerId")),
                blankToNull(meta.get("eventId")));
    }

    private static PaymentPurpose.PlatformProduct platformProduct(PlatformProductType type, Map<String, String> meta) {
        return new PaymentPurpose.PlatformProduct(
                type,
                blankToNull(meta.get("userId")),
                blankToNull(meta.get("eventId")),
                (int) parseLong(meta.get("ticketQuantity"), 0L),
                parseLong(meta.get("pricePerTicket"), 0L),
                blankToNull(meta.get("subscriptionPlan")),
                blankToNull(meta.get("stripeCustomerId")),
                blankToNull(meta.get("stripePriceId")),
                blankToNull(meta.get("stripeSubscriptionId")),
                blankToNull(meta.get("promotionType")));
    }

    static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank() || "null".equals(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            // Some clients send "12.0"; keep the integral part
            try {
                return (long) Double.parseDouble(value.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() || "null".equals(value) ? null : value;
    }
}
