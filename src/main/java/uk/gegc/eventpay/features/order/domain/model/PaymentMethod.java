package uk.gegc.eventpay.features.order.domain.model;

public enum PaymentMethod {
    STRIPE,
    PAYPAL,
    CASH,
    FREE
}
