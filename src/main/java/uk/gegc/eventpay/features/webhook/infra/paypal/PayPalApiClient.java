package uk.gegc.eventpay.features.webhook.infra.paypal;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.eventpay.features.webhook.application.PayPalProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The two PayPal REST calls needed to authenticate a webhook: a client-credentials token and
 * the {@code verify-webhook-signature} check. A fresh token is fetched per verification so no
 * state is shared between requests.
 */
@Slf4j
public class PayPalApiClient {

    static final String TOKEN_PATH = "/v1/oauth2/token";
    static final String VERIFY_SIGNATURE_PATH = "/v1/notifications/verify-webhook-signature";
    static final String VERIFICATION_SUCCESS = "SUCCESS";

    private final RestClient restClient;
    private final PayPalProperties properties;

    public PayPalApiClient(RestClient restClient, PayPalProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    public String fetchAccessToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        try {
            JsonNode body = restClient.post()
                    .uri(TOKEN_PATH)
                    .headers(h -> h.setBasicAuth(properties.getClientId(), properties.getClientSecret()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
            String token = body == null ? null : body.path("access_token").asText(null);
            if (token == null || token.isBlank()) {
                throw new PayPalApiException("PayPal token response did not contain an access_token");
            }
            return token;
        } catch (RestClientException e) {
            throw new PayPalApiException("Failed to obtain PayPal access token: " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} only when PayPal answers {@code verification_status = SUCCESS}
     */
    public boolean verifyWebhookSignature(PayPalSignatureHeaders headers, JsonNode webhookEvent) {
        String accessToken = fetchAccessToken();

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("auth_algo", headers.authAlgo());
        request.put("cert_url", headers.certUrl());
        request.put("transmission_id", headers.transmissionId());
        request.put("transmission_sig", headers.transmissionSig());
        request.put("transmission_time", headers.transmissionTime());
        request.put("webhook_id", properties.getWebhookId());
        request.put("webhook_event", webhookEvent);

        try {
            JsonNode body = restClient.post()
                    .uri(VERIFY_SIGNATURE_PATH)
                    .headers(h -> h.setBearerAuth(accessToken))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
            String status = body == null ? null : body.path("verification_status").asText(null);
            log.debug("PayPal verification_status={} transmissionId={}", status, headers.transmissionId());
            return VERIFICATION_SUCCESS.equals(status);
        } catch (RestClientException e) {
            throw new PayPalApiException("PayPal signature verification call failed: " + e.getMessage(), e);
        }
    }
}
