package com.tixgo.catalog.repository;

import com.tixgo.common.entity.Ticket;
import com.tixgo.common.enums.VerificationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    /**
     * Public listing: visible tickets in the given status, newest first
     */
    @Query("SELECT t FROM Ticket t WHERE " +
           "t.hidden = false AND t.verificationStatus = :status AND " +
           "(:vendorEmail IS NULL OR LOWER(t.vendorEmail) = LOWER(:vendorEmail)) AND " +
           "(:advertised IS NULL OR t.advertised = :advertised) " +
           "ORDER BY t.createdAt DESC")
    Page<Ticket> findVisible(@Param("status") VerificationStatus status,
                             @Param("vendorEmail") String vendorEmail,
                             @Param("advertised") Boolean advertised,
                             Pageable pageable);

    @Query("SELECT t FROM Ticket t WHERE t.advertised = true AND t.hidden = false " +
           "AND t.verificationStatus = :status ORDER BY t.updatedAt DESC")
    List<Ticket> findAdvertised(@Param("status") VerificationStatus status, Pageable pageable);

    List<Ticket> findByVendorEmailIgnoreCaseAndHiddenFalseOrderByCreatedAtDesc(String vendorEmail);

    Page<Ticket> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<Ticket> findByVerificationStatusOrderByCreatedAtDesc(VerificationStatus status, Pageable pageable);

    long countByAdvertisedTrueAndVerificationStatus(VerificationStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.verificationStatus = :target, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.verificationStatus = :expected")
    int transitionVerification(@Param("id") Long id,
                               @Param("expected") VerificationStatus expected,
                               @Param("target") VerificationStatus target);

    /**
     * Rejection also withdraws the ticket from the advertised slots.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.verificationStatus = :rejected, t.advertised = false, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.verificationStatus <> :rejected")
    int reject(@Param("id") Long id, @Param("rejected") VerificationStatus rejected);

    /**
     * Count and write in one statement. Runs in its own transaction so that it commits
     * before the caller releases the slot lock.
     * @return 1 if advertised, 0 if the slot pool is full or the ticket is not eligible
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.advertised = true, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.advertised = false AND t.hidden = false " +
           "AND t.verificationStatus = :approved " +
           "AND (SELECT COUNT(o) FROM Ticket o WHERE o.advertised = true " +
           "     AND o.verificationStatus = :approved) < :maxSlots")
    int advertiseIfSlotAvailable(@Param("id") Long id,
                                 @Param("approved") VerificationStatus approved,
                                 @Param("maxSlots") long maxSlots);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.advertised = false, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.advertised = true")
    int unadvertise(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ticket t SET t.hidden = true, t.advertised = false, t.version = t.version + 1 " +
           "WHERE LOWER(t.vendorEmail) = LOWER(:vendorEmail)")
    int hideAllByVendor(@Param("vendorEmail") String vendorEmail);
}
