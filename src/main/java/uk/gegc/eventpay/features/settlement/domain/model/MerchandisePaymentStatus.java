package uk.gegc.eventpay.features.settlement.domain.model;

/**
 * Payment status shared by marketplace product orders and food orders.
 */
public enum MerchandisePaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED
}
