package com.tixgo.catalog.repository;

import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;

/**
 * Read-only view of bookings and payments owned by the booking service.
 */
@Repository
public interface BookingLedgerRepository extends JpaRepository<Booking, Long> {

    long countByTicketIdAndStatusIn(Long ticketId, Collection<BookingStatus> statuses);
}
