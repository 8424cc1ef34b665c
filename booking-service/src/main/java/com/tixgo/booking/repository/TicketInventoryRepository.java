package com.tixgo.booking.repository;

import com.tixgo.common.entity.Ticket;
import com.tixgo.common.enums.VerificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Stock counter writes. Each is a single conditional update with no preceding read.
 */
@Repository
public interface TicketInventoryRepository extends JpaRepository<Ticket, Long> {

    /**
     * Decrement available quantity only if the ticket is still approved, visible and has
     * enough stock left.
     * @return 1 if reserved, 0 if the ticket is missing, not bookable or short of stock
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.quantity = t.quantity - :qty, t.version = t.version + 1 " +
           "WHERE t.id = :ticketId AND t.quantity >= :qty " +
           "AND t.verificationStatus = :approved AND t.hidden = false")
    int reserve(@Param("ticketId") Long ticketId, @Param("qty") int qty,
                @Param("approved") VerificationStatus approved);

    /**
     * Return stock unconditionally.
     * @return 1 if returned, 0 if the ticket no longer exists
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.quantity = t.quantity + :qty, t.version = t.version + 1 " +
           "WHERE t.id = :ticketId")
    int release(@Param("ticketId") Long ticketId, @Param("qty") int qty);
}
