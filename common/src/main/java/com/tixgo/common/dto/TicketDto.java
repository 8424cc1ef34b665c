package com.tixgo.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketDto implements Serializable {

    private Long id;
    private String vendorEmail;
    private String vendorName;
    private String title;
    private String from;
    private String to;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime departure;

    private String transportType;
    private BigDecimal price;
    private Integer quantity;
    private List<String> perks;
    private String imageUrl;
    private String verificationStatus; // PENDING, APPROVED, REJECTED
    private boolean advertised;
    private boolean hidden;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime updatedAt;

    public boolean isApproved() {
        return "APPROVED".equals(verificationStatus);
    }
}
