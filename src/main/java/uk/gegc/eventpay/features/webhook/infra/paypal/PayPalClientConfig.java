package uk.gegc.eventpay.features.webhook.infra.paypal;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.eventpay.features.webhook.application.PayPalProperties;

@Configuration
public class PayPalClientConfig {

    @Bean
    public PayPalApiClient payPalApiClient(PayPalProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        RestClient restClient = RestClient.builder()
                .baseUrl(properties.getApiBaseUrl())
                .requestFactory(requestFactory)
                .build();
        return new PayPalApiClient(restClient, properties);
    }
}
