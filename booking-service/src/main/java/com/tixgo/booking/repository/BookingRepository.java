package com.tixgo.booking.repository;

import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Status writes are compare-and-set: each update names the status it expects to replace
 * and returns the number of rows changed. Zero means the booking moved on concurrently
 * or the transition is not legal from its current state.
 */
@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByCustomerEmailIgnoreCaseOrderByCreatedAtDesc(String customerEmail);

    List<Booking> findByVendorEmailIgnoreCaseOrderByCreatedAtDesc(String vendorEmail);

    List<Booking> findByStatusAndCreatedAtBefore(BookingStatus status, LocalDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :target, b.acceptedAt = :at " +
           "WHERE b.id = :id AND b.status = :expected")
    int transitionAccepted(@Param("id") Long id,
                           @Param("expected") BookingStatus expected,
                           @Param("target") BookingStatus target,
                           @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :target, b.rejectedAt = :at " +
           "WHERE b.id = :id AND b.status = :expected")
    int transitionRejected(@Param("id") Long id,
                           @Param("expected") BookingStatus expected,
                           @Param("target") BookingStatus target,
                           @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :target, b.cancelledAt = :at " +
           "WHERE b.id = :id AND b.status = :expected")
    int transitionCancelled(@Param("id") Long id,
                            @Param("expected") BookingStatus expected,
                            @Param("target") BookingStatus target,
                            @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :target, b.paidAt = :at " +
           "WHERE b.id = :id AND b.status = :expected")
    int transitionPaid(@Param("id") Long id,
                       @Param("expected") BookingStatus expected,
                       @Param("target") BookingStatus target,
                       @Param("at") LocalDateTime at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.checkoutSessionId = :sessionId " +
           "WHERE b.id = :id AND b.status = :expected")
    int attachCheckoutSession(@Param("id") Long id,
                              @Param("sessionId") String sessionId,
                              @Param("expected") BookingStatus expected);

    default int markAccepted(Long id, LocalDateTime at) {
        return transitionAccepted(id, BookingStatus.PENDING, BookingStatus.ACCEPTED, at);
    }

    default int markRejected(Long id, LocalDateTime at) {
        return transitionRejected(id, BookingStatus.PENDING, BookingStatus.REJECTED, at);
    }

    default int markCancelled(Long id, LocalDateTime at) {
        return transitionCancelled(id, BookingStatus.ACCEPTED, BookingStatus.CANCELLED, at);
    }

    default int markPaid(Long id, LocalDateTime at) {
        return transitionPaid(id, BookingStatus.ACCEPTED, BookingStatus.PAID, at);
    }
}
