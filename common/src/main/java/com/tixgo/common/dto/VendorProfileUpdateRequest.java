package com.tixgo.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

/**
 * Owner edit of a vendor profile. Null fields are left untouched; the verified flag is not
 * settable here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VendorProfileUpdateRequest {

    @Size(min = 1, max = 200)
    private String businessName;

    @Size(max = 30)
    private String phone;

    @Size(max = 300)
    private String address;

    @Size(max = 1000)
    private String description;

    @Size(max = 500)
    private String logoUrl;

    public boolean isEmpty() {
        return businessName == null && phone == null && address == null
            && description == null && logoUrl == null;
    }
}
