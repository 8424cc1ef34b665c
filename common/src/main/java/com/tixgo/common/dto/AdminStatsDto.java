package com.tixgo.common.dto;

import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminStatsDto {

    private long usersCount;
    private long vendorsCount;
    private long ticketsCount;
    private long bookingsCount;
    private BigDecimal totalRevenue;
    private long ticketsSold;
}
