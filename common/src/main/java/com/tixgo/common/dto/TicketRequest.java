package com.tixgo.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Vendor-supplied ticket fields. verificationStatus, advertised, hidden and
 * vendorEmail are moderation fields and are not accepted here: a request that
 * carries them fails deserialization.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketRequest {

    @Size(max = 200, message = "Vendor name must be at most 200 characters")
    private String vendorName;

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Origin is required")
    @Size(max = 100)
    private String from;

    @NotBlank(message = "Destination is required")
    @Size(max = 100)
    private String to;

    @NotNull(message = "Departure is required")
    @Future(message = "Departure must be in the future")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime departure;

    @Size(max = 50)
    private String transportType;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.01", message = "Price must be positive")
    private BigDecimal price;

    @NotNull(message = "Quantity is required")
    @PositiveOrZero(message = "Quantity must not be negative")
    private Integer quantity;

    private List<@NotBlank String> perks;

    @Size(max = 500)
    private String imageUrl;
}
