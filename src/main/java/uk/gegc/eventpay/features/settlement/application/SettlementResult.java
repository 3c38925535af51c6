package uk.gegc.eventpay.features.settlement.application;

/**
 * Outcome of settling one successful payment.
 *
 * @param targetId id of the order, subscription or product record the payment settled, when known
 */
public record SettlementResult(Outcome outcome, String targetId) {

    public enum Outcome {
        APPLIED,
        ALREADY_APPLIED,
        REJECTED,
        NOT_FOUND,
        SKIPPED
    }

    public static SettlementResult applied(Object targetId) {
        return new SettlementResult(Outcome.APPLIED, targetId == null ? null : targetId.toString());
    }

    public static SettlementResult alreadyApplied(Object targetId) {
        return new SettlementResult(Outcome.ALREADY_APPLIED, targetId == null ? null : targetId.toString());
    }

    public static SettlementResult rejected(Object targetId) {
        return new SettlementResult(Outcome.REJECTED, targetId == null ? null : targetId.toString());
    }

    public static SettlementResult notFound() {
        return new SettlementResult(Outcome.NOT_FOUND, null);
    }

    public static SettlementResult skipped() {
        return new SettlementResult(Outcome.SKIPPED, null);
    }
}
