package uk.gegc.eventpay.features.settlement.application;

/**
 * @param paymentReference provider payment id; makes the confirmation idempotent
 */
public record CreditPurchase(
        String organizerId,
        String paymentReference,
        int ticketsPurchased,
        long amountPaidCents,
        long pricePerTicketCents
) {
}
