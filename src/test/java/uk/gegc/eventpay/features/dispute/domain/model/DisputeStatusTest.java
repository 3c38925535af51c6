package uk.gegc.eventpay.features.dispute.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DisputeStatus")
class DisputeStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "RESOLVED_BUYER_FAVOUR, RESOLVED_BUYER_FAVOUR",
            "RESOLVED_BUYER_FAVOR, RESOLVED_BUYER_FAVOUR",
            "resolved_seller_favor, RESOLVED_SELLER_FAVOUR",
            "lost, RESOLVED_BUYER_FAVOUR",
            "won, RESOLVED_SELLER_FAVOUR",
            "CANCELED_BY_BUYER, RESOLVED_OTHER",
            "warning_closed, RESOLVED_OTHER"
    })
    @DisplayName("Provider outcomes map to a resolved status")
    void fromOutcome(String outcome, DisputeStatus expected) {
        assertThat(DisputeStatus.fromOutcome(outcome)).isEqualTo(expected);
        assertThat(expected.isResolved()).isTrue();
    }
}
