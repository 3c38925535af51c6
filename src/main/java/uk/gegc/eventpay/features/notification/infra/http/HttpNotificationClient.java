package uk.gegc.eventpay.features.notification.infra.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.eventpay.features.notification.application.NotificationClient;
import uk.gegc.eventpay.features.notification.application.NotificationProperties;
import uk.gegc.eventpay.features.notification.application.RefundNotification;

@Slf4j
@Component
public class HttpNotificationClient implements NotificationClient {

    private final RestClient restClient;
    private final NotificationProperties properties;

    public HttpNotificationClient(NotificationProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getTimeout().toMillis());
        this.restClient = RestClient.builder()
                .baseUrl(properties.getAppBaseUrl())
                .requestFactory(requestFactory)
                .build();
        this.properties = properties;
    }

    @Override
    public boolean sendRefundNotification(RefundNotification notification) {
        try {
            restClient.post()
                    .uri(properties.getRefundPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(notification)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("Refund notification for order {} was not accepted: {}", notification.orderNumber(), e.getMessage());
            return false;
        }
    }
}
