package com.tixgo.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutResponse {

    private Long bookingId;
    private String sessionId;
    private String url;
}
