package uk.gegc.eventpay.features.webhook.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.eventpay.features.webhook.domain.model.ProcessedWebhookEvent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.features.webhook.infra.repository.ProcessedWebhookEventRepository;
import uk.gegc.eventpay.shared.config.ClockConfig;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({WebhookEventLedgerImpl.class, ClockConfig.class})
class WebhookEventLedgerImplTest {

    @Autowired
    private WebhookEventLedgerImpl ledger;

    @Autowired
    private ProcessedWebhookEventRepository repository;

    @Test
    @DisplayName("First mark records the event, second mark reports it as already processed")
    void markProcessed_onlyOnce() {
        assertThat(ledger.isProcessed(WebhookProvider.STRIPE, "evt_1")).isFalse();

        assertThat(ledger.markProcessed(WebhookProvider.STRIPE, "evt_1", "charge.refunded", "O1")).isTrue();
        assertThat(ledger.markProcessed(WebhookProvider.STRIPE, "evt_1", "charge.refunded", "O1")).isFalse();

        assertThat(ledger.isProcessed(WebhookProvider.STRIPE, "evt_1")).isTrue();
        assertThat(repository.countByProviderAndProviderEventId(WebhookProvider.STRIPE, "evt_1")).isEqualTo(1);
        ProcessedWebhookEvent row = repository.findByProviderAndProviderEventId(WebhookProvider.STRIPE, "evt_1")
                .orElseThrow();
        assertThat(row.getEventType()).isEqualTo("charge.refunded");
        assertThat(row.getLinkedOrderId()).isEqualTo("O1");
        assertThat(row.getProcessedAt()).isNotNull();
    }

    @Test
    @DisplayName("Event ids are scoped per provider")
    void sameId_differentProviders() {
        assertThat(ledger.markProcessed(WebhookProvider.STRIPE, "WH-1", "invoice.paid", null)).isTrue();
        assertThat(ledger.markProcessed(WebhookProvider.PAYPAL, "WH-1", "PAYMENT.CAPTURE.COMPLETED", null)).isTrue();

        assertThat(ledger.isProcessed(WebhookProvider.PAYPAL, "WH-1")).isTrue();
    }

    @Test
    @DisplayName("Unique key rejects a second row for the same provider event")
    void uniqueKey_rejectsTwin() {
        repository.saveAndFlush(new ProcessedWebhookEvent(
                WebhookProvider.PAYPAL, "WH-2", "CUSTOMER.DISPUTE.CREATED", null, LocalDateTime.now()));

        assertThatThrownBy(() -> repository.saveAndFlush(new ProcessedWebhookEvent(
                WebhookProvider.PAYPAL, "WH-2", "CUSTOMER.DISPUTE.CREATED", null, LocalDateTime.now())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
