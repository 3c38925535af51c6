package uk.gegc.eventpay.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "eventpay.features")
public class FeatureFlags {

    private boolean stripeWebhooks = true;
    private boolean paypalWebhooks = true;

    public boolean isStripeWebhooks() {
        return stripeWebhooks;
    }

    public void setStripeWebhooks(boolean stripeWebhooks) {
        this.stripeWebhooks = stripeWebhooks;
    }

    public boolean isPaypalWebhooks() {
        return paypalWebhooks;
    }

    public void setPaypalWebhooks(boolean paypalWebhooks) {
        this.paypalWebhooks = paypalWebhooks;
    }
}
