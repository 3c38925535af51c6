package uk.gegc.eventpay.features.dispute.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.dispute.application.DisputeOpenResult;
import uk.gegc.eventpay.features.dispute.application.DisputeResolution;
import uk.gegc.eventpay.features.dispute.application.DisputeTracker;
import uk.gegc.eventpay.features.dispute.domain.model.DisputeStatus;
import uk.gegc.eventpay.features.dispute.domain.model.PaymentDispute;
import uk.gegc.eventpay.features.dispute.infra.repository.PaymentDisputeRepository;
import uk.gegc.eventpay.features.order.infra.repository.OrderRepository;
import uk.gegc.eventpay.features.webhook.application.classification.PaymentCorrelation;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DisputeTrackerImpl implements DisputeTracker {

    private final PaymentDisputeRepository disputeRepository;
    private final OrderRepository orderRepository;
    private final Clock clock;

    @Override
    @Transactional
    public DisputeOpenResult open(WebhookProvider provider, WebhookIntent.DisputeOpened opened) {
        Optional<PaymentDispute> existing = disputeRepository.findByDisputeId(opened.disputeId());
        if (existing.isPresent()) {
            log.info("Dispute {} already recorded", opened.disputeId());
            return new DisputeOpenResult(existing.get().getId(), true, existing.get().getOrderId());
        }

        PaymentCorrelation correlation = opened.correlation();
        UUID orderId = linkOrder(provider, correlation, opened.transactionId());
        LocalDateTime now = LocalDateTime.now(clock);

        PaymentDispute dispute = new PaymentDispute();
        dispute.setDisputeId(opened.disputeId());
        dispute.setProvider(provider);
        dispute.setOrderId(orderId);
        dispute.setTransactionId(opened.transactionId());
        dispute.setStripePaymentIntentId(correlation.stripePaymentIntentId());
        dispute.setPaypalOrderId(correlation.paypalOrderId());
        dispute.setReason(opened.reason());
        dispute.setAmountCents(opened.amountCents());
        dispute.setCurrency(opened.currency());
        dispute.setBuyerEmail(opened.buyerEmail());
        dispute.setResponseDeadline(opened.responseDeadline());
        dispute.setStatus(DisputeStatus.OPEN);
        dispute.setCreatedAt(now);
        dispute.setUpdatedAt(now);
        PaymentDispute saved = disputeRepository.save(dispute);

        if (orderId == null) {
            log.warn("Dispute {} recorded without a linked order", opened.disputeId());
        } else {
            log.info("Dispute {} recorded against order {} ({} {} minor units, reason {})",
                    opened.disputeId(), orderId, opened.amountCents(), opened.currency(), opened.reason());
        }
        return new DisputeOpenResult(saved.getId(), false, orderId);
    }

    @Override
    @Transactional
    public DisputeResolution resolve(String disputeId, String outcomeCode, String outcomeReason) {
        Optional<PaymentDispute> found = disputeRepository.findByDisputeId(disputeId);
        if (found.isEmpty()) {
            log.warn("Resolution received for unknown dispute {}", disputeId);
            return DisputeResolution.notFound();
        }

        PaymentDispute dispute = found.get();
        if (dispute.getStatus().isResolved()) {
            log.info("Dispute {} already resolved as {}", disputeId, dispute.getStatus());
            return new DisputeResolution(DisputeResolution.Outcome.ALREADY_RESOLVED,
                    dispute.getId(), dispute.getStatus(), dispute.getOrderId());
        }

        DisputeStatus status = DisputeStatus.fromOutcome(outcomeCode);
        dispute.setStatus(status);
        dispute.setOutcomeCode(outcomeCode);
        dispute.setOutcomeReason(outcomeReason);
        LocalDateTime now = LocalDateTime.now(clock);
        dispute.setResolvedAt(now);
        dispute.setUpdatedAt(now);
        disputeRepository.save(dispute);

        log.info("Dispute {} resolved: {} ({})", disputeId, status, outcomeCode);
        return new DisputeResolution(DisputeResolution.Outcome.RESOLVED, dispute.getId(), status, dispute.getOrderId());
    }

    private UUID linkOrder(WebhookProvider provider, PaymentCorrelation correlation, String transactionId) {
        // PayPal disputes name the capture as the seller transaction
        String captureId = provider == WebhookProvider.PAYPAL ? transactionId : correlation.paypalCaptureId();
        if (correlation.stripePaymentIntentId() != null || correlation.paypalOrderId() != null || captureId != null) {
            List<UUID> ids = orderRepository.findIdsByProviderIds(
                    correlation.stripePaymentIntentId(), correlation.paypalOrderId(), captureId);
            if (!ids.isEmpty()) {
                return ids.get(0);
            }
        }
        if (correlation.orderId() != null) {
            try {
                UUID orderId = UUID.fromString(correlation.orderId());
                if (orderRepository.existsById(orderId)) {
                    return orderId;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Dispute metadata order id '{}' is not a valid id", correlation.orderId());
            }
        }
        return null;
    }
}
