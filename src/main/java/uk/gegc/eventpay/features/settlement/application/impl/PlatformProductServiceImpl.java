package uk.gegc.eventpay.features.settlement.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.settlement.application.CreditPurchase;
import uk.gegc.eventpay.features.settlement.application.CreditPurchaseResult;
import uk.gegc.eventpay.features.settlement.application.PlatformProductService;
import uk.gegc.eventpay.features.settlement.application.PromotionActivationResult;
import uk.gegc.eventpay.features.settlement.domain.model.*;
import uk.gegc.eventpay.features.settlement.infra.repository.CreditTransactionRepository;
import uk.gegc.eventpay.features.settlement.infra.repository.EventPromotionRepository;
import uk.gegc.eventpay.features.settlement.infra.repository.OrganizerCreditsRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlatformProductServiceImpl implements PlatformProductService {

    private final CreditTransactionRepository creditTransactionRepository;
    private final OrganizerCreditsRepository organizerCreditsRepository;
    private final EventPromotionRepository eventPromotionRepository;
    private final Clock clock;

    @Override
    @Transactional
    public CreditPurchaseResult confirmCreditPurchase(CreditPurchase purchase) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<CreditTransaction> existing = creditTransactionRepository.findByPaymentReference(purchase.paymentReference());

        if (existing.isPresent() && existing.get().getStatus() == CreditTransactionStatus.COMPLETED) {
            log.info("Credit purchase {} already completed", purchase.paymentReference());
            int remaining = organizerCreditsRepository.findByOrganizerId(purchase.organizerId())
                    .map(OrganizerCredits::getCreditsRemaining)
                    .orElse(0);
            return new CreditPurchaseResult(true, remaining);
        }

        CreditTransaction transaction = existing.orElseGet(() -> {
            // Payment confirmed before the checkout recorded a pending purchase
            CreditTransaction created = new CreditTransaction();
            created.setOrganizerId(purchase.organizerId());
            created.setPaymentReference(purchase.paymentReference());
            created.setTicketsPurchased(purchase.ticketsPurchased());
            created.setAmountPaidCents(purchase.amountPaidCents());
            created.setPricePerTicketCents(purchase.pricePerTicketCents());
            created.setPurchasedAt(now);
            return created;
        });
        transaction.setStatus(CreditTransactionStatus.COMPLETED);
        creditTransactionRepository.save(transaction);

        OrganizerCredits credits = organizerCreditsRepository.findByOrganizerId(purchase.organizerId())
                .orElseGet(() -> {
                    OrganizerCredits created = new OrganizerCredits();
                    created.setOrganizerId(purchase.organizerId());
                    created.setCreatedAt(now);
                    return created;
                });
        credits.addCredits(transaction.getTicketsPurchased(), now);
        organizerCreditsRepository.save(credits);

        log.info("Credit purchase {} confirmed for organizer {}: {} tickets",
                purchase.paymentReference(), purchase.organizerId(), transaction.getTicketsPurchased());
        return new CreditPurchaseResult(false, credits.getCreditsRemaining());
    }

    @Override
    @Transactional
    public PromotionActivationResult activatePromotion(String eventId, String organizerId, PromotionType type,
                                                       String paymentReference, long amountPaidCents) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusDays(type.getDurationDays());

        Optional<EventPromotion> found = eventPromotionRepository.findFirstByPaymentReference(paymentReference)
                .or(() -> eventPromotionRepository.findFirstByEventIdAndPromotionTypeAndStatusOrderByCreatedAtAsc(
                        eventId, type, PromotionStatus.PENDING));

        if (found.isEmpty()) {
            EventPromotion promotion = new EventPromotion();
            promotion.setEventId(eventId);
            promotion.setOrganizerId(organizerId);
            promotion.setPromotionType(type);
            promotion.setStatus(PromotionStatus.ACTIVE);
            promotion.setPaymentReference(paymentReference);
            promotion.setAmountPaidCents(amountPaidCents);
            promotion.setStartedAt(now);
            promotion.setExpiresAt(expiresAt);
            promotion.setCreatedAt(now);
            promotion.setUpdatedAt(now);
            EventPromotion saved = eventPromotionRepository.save(promotion);
            log.info("Created and activated {} promotion {} for event {}", type, saved.getId(), eventId);
            return new PromotionActivationResult(PromotionActivationResult.Outcome.CREATED, saved.getId(), expiresAt);
        }

        EventPromotion promotion = found.get();
        if (promotion.getStatus() == PromotionStatus.ACTIVE) {
            log.info("Promotion {} already active", promotion.getId());
            return new PromotionActivationResult(PromotionActivationResult.Outcome.ALREADY_ACTIVE,
                    promotion.getId(), promotion.getExpiresAt());
        }

        promotion.setStatus(PromotionStatus.ACTIVE);
        promotion.setStartedAt(now);
        promotion.setExpiresAt(expiresAt);
        promotion.setPaymentReference(paymentReference);
        if (amountPaidCents > 0) {
            promotion.setAmountPaidCents(amountPaidCents);
        }
        promotion.setUpdatedAt(now);
        eventPromotionRepository.save(promotion);

        log.info("Activated promotion {} for event {}, expires {}", promotion.getId(), eventId, expiresAt);
        return new PromotionActivationResult(PromotionActivationResult.Outcome.ACTIVATED, promotion.getId(), expiresAt);
    }
}
