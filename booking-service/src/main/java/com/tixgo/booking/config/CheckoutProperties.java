package com.tixgo.booking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "tixgo.checkout")
public class CheckoutProperties {

    private String secretKey;
    private String apiBaseUrl = "https://api.stripe.com";
    private String currency = "usd";

    /**
     * Public base URL of this service, used for the provider's success and cancel callbacks.
     */
    private String callbackBaseUrl = "http://localhost:8082";

    /**
     * Front end the browser is sent to after a callback.
     */
    private String siteBaseUrl = "http://localhost:5173";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    public String successCallbackUrl() {
        return callbackBaseUrl + "/api/payments/checkout/success?session_id={CHECKOUT_SESSION_ID}";
    }

    public String cancelCallbackUrl(Long bookingId) {
        return callbackBaseUrl + "/api/payments/checkout/cancel?booking_id=" + bookingId;
    }

    public String siteUrl(String page) {
        return siteBaseUrl + "/" + page;
    }
}
