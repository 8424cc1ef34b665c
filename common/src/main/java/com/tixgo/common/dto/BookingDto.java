package com.tixgo.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingDto {

    private Long id;
    private Long ticketId;
    private String customerEmail;
    private String vendorEmail;
    private String title;
    private BigDecimal price;
    private Integer quantity;
    private BigDecimal totalAmount;
    private String status; // PENDING, ACCEPTED, REJECTED, PAID, CANCELLED

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime acceptedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime rejectedAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime paidAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime cancelledAt;

    public boolean isPaid() {
        return "PAID".equals(status);
    }

    public boolean isCancelled() {
        return "CANCELLED".equals(status);
    }
}
