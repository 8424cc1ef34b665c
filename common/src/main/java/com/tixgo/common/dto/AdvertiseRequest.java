package com.tixgo.common.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdvertiseRequest {

    @NotNull(message = "advertised must be a boolean")
    private Boolean advertised;
}
