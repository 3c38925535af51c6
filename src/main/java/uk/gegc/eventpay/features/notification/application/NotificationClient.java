package uk.gegc.eventpay.features.notification.application;

public interface NotificationClient {

    /**
     * Asks the web app to email a refund confirmation.
     *
     * @return whether the request was accepted
     */
    boolean sendRefundNotification(RefundNotification notification);
}
