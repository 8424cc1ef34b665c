package com.tixgo.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentVerificationResult {

    private PaymentDto payment;
    private BookingDto booking;

    // True when an earlier delivery of the same transaction already recorded the payment
    private boolean alreadyProcessed;
}
