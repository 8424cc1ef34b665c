package com.tixgo.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Partial update of a vendor's ticket. Null fields are left untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketUpdateRequest {

    @Size(max = 200)
    private String title;

    @Size(max = 100)
    private String from;

    @Size(max = 100)
    private String to;

    @Future(message = "Departure must be in the future")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime departure;

    @Size(max = 50)
    private String transportType;

    @DecimalMin(value = "0.01", message = "Price must be positive")
    private BigDecimal price;

    @PositiveOrZero(message = "Quantity must not be negative")
    private Integer quantity;

    private List<@NotBlank String> perks;

    @Size(max = 500)
    private String imageUrl;

    public boolean isEmpty() {
        return title == null && from == null && to == null && departure == null
            && transportType == null && price == null && quantity == null
            && perks == null && imageUrl == null;
    }
}
