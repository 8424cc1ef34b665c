package com.tixgo.common.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VendorVerificationRequest {

    @NotNull(message = "verify must be true or false")
    private Boolean verify;
}
