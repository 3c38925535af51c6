package uk.gegc.eventpay.features.webhook.application;

/**
 * What routing an intent did to the store.
 */
public enum RoutingOutcome {
    /** A state change was written. */
    APPLIED,
    /** Target found but already in the requested state, or the move was refused. */
    NO_CHANGE,
    /** No stored record matches the event; logged for manual reconciliation. */
    UNMATCHED
}
