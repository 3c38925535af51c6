package uk.gegc.eventpay.features.settlement.domain.model;

public enum CreditTransactionStatus {
    PENDING,
    COMPLETED
}
