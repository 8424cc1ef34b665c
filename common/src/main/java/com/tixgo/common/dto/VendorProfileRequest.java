package com.tixgo.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VendorProfileRequest {

    @NotBlank(message = "User email is required")
    @Email(message = "Email must be valid")
    private String userEmail;

    @NotBlank(message = "Business name is required")
    @Size(max = 200)
    private String businessName;

    @Size(max = 30)
    private String phone;

    @Size(max = 300)
    private String address;

    @Size(max = 1000)
    private String description;

    @Size(max = 500)
    private String logoUrl;
}
