package com.tixgo.booking.service;

import com.tixgo.booking.repository.BookingRepository;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Releases stock held by bookings the vendor never answered. Each booking is expired in
 * its own transaction through the conditional PENDING write used by vendor rejects.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "tixgo.booking.expiry.enabled", havingValue = "true")
public class PendingBookingExpiryJob {

    private final BookingRepository bookingRepository;
    private final BookingService bookingService;

    @Value("${tixgo.booking.expiry.pending-minutes:1440}")
    private long pendingMinutes;

    @Scheduled(fixedDelayString = "${tixgo.booking.expiry.interval-ms:300000}")
    public void expireStalePendingBookings() {
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(pendingMinutes);
        List<Booking> staleBookings = bookingRepository.findByStatusAndCreatedAtBefore(BookingStatus.PENDING, cutoff);

        if (staleBookings.isEmpty()) {
            return;
        }

        log.info("Pending expiry: found {} bookings created before {}", staleBookings.size(), cutoff);

        int expired = 0;
        for (Booking booking : staleBookings) {
            try {
                if (bookingService.expirePendingBooking(booking.getId())) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Failed to expire pending booking: {}", booking.getId(), e);
            }
        }

        if (expired > 0) {
            log.info("Pending expiry: released stock of {} bookings", expired);
        }
    }
}
