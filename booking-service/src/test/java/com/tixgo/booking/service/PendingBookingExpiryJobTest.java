package com.tixgo.booking.service;

import com.tixgo.booking.repository.BookingRepository;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.exception.MarketplaceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PendingBookingExpiryJobTest {

    @Mock private BookingRepository bookingRepository;
    @Mock private BookingService bookingService;

    private PendingBookingExpiryJob expiryJob;

    @BeforeEach
    void setUp() {
        expiryJob = new PendingBookingExpiryJob(bookingRepository, bookingService);
        ReflectionTestUtils.setField(expiryJob, "pendingMinutes", 60L);
    }

    private Booking pending(Long id) {
        return Booking.builder().id(id).ticketId(1L).quantity(1).status(BookingStatus.PENDING).build();
    }

    @Test
    void expireStalePendingBookings_NothingStale() {
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(List.of());

        expiryJob.expireStalePendingBookings();

        verifyNoInteractions(bookingService);
    }

    @Test
    void expireStalePendingBookings_ExpiresEachBooking() {
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(List.of(pending(1L), pending(2L)));
        when(bookingService.expirePendingBooking(1L)).thenReturn(true);
        when(bookingService.expirePendingBooking(2L)).thenReturn(false);

        expiryJob.expireStalePendingBookings();

        verify(bookingService).expirePendingBooking(1L);
        verify(bookingService).expirePendingBooking(2L);
    }

    @Test
    void expireStalePendingBookings_OneFailure_ContinuesWithOthers() {
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(List.of(pending(1L), pending(2L)));
        when(bookingService.expirePendingBooking(1L)).thenThrow(MarketplaceException.notFound("Booking", 1L));
        when(bookingService.expirePendingBooking(2L)).thenReturn(true);

        expiryJob.expireStalePendingBookings();

        verify(bookingService).expirePendingBooking(2L);
    }

    @Test
    void expireStalePendingBookings_CutoffUsesPendingWindow() {
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(List.of());

        LocalDateTime before = LocalDateTime.now().minusMinutes(60);
        expiryJob.expireStalePendingBookings();
        LocalDateTime after = LocalDateTime.now().minusMinutes(60);

        verify(bookingRepository).findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING),
            argThat(cutoff -> !cutoff.isBefore(before) && !cutoff.isAfter(after)));
    }
}
