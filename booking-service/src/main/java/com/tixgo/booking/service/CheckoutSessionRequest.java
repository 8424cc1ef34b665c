package com.tixgo.booking.service;

import lombok.*;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutSessionRequest {

    private String productName;

    // Minor currency units per ticket
    private long unitAmount;

    private int quantity;
    private String currency;
    private String successUrl;
    private String cancelUrl;

    // Returned unchanged by the provider on retrieval
    private Map<String, String> metadata;
}
