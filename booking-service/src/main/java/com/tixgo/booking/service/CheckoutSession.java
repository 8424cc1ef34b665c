package com.tixgo.booking.service;

import lombok.*;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutSession {

    public static final String BOOKING_ID_KEY = "bookingId";

    private String id;
    private String url;
    private String paymentStatus;
    private Long amountTotal;
    private String currency;
    private String transactionRef;
    private Map<String, String> metadata;

    public boolean isPaid() {
        return "paid".equalsIgnoreCase(paymentStatus);
    }

    /**
     * External transaction id used as the payment idempotency key. Falls back to the
     * session id when the provider reports no separate transaction reference.
     */
    public String getTransactionKey() {
        return transactionRef != null && !transactionRef.isBlank() ? transactionRef : id;
    }
}
