package com.tixgo.booking.service;

import com.tixgo.booking.repository.BookingRepository;
import com.tixgo.booking.repository.TicketInventoryRepository;
import com.tixgo.booking.service.BookingEventPublisher.EventType;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.BookingRequest;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Booking lifecycle: PENDING to ACCEPTED or REJECTED, then ACCEPTED to PAID or CANCELLED.
 * Stock is reserved when the booking is created and released exactly once on REJECTED or
 * CANCELLED, by whichever caller wins the conditional status write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final TicketInventoryRepository ticketRepository;
    private final InventoryService inventoryService;
    private final BookingEventPublisher eventPublisher;

    @Value("${tixgo.booking.max-quantity:20}")
    private int maxQuantityPerBooking;

    /**
     * Customer books an approved ticket. Reserves stock and snapshots title, price and vendor.
     */
    @Transactional
    public BookingDto createBooking(BookingRequest request, String callerEmail) {
        log.info("Creating booking: ticket={} quantity={} customer={}",
                request.getTicketId(), request.getQuantity(), request.getCustomerEmail());

        validateBookingRequest(request);

        if (!request.getCustomerEmail().equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Bookings can only be created for the caller's own email");
        }

        Ticket ticket = ticketRepository.findById(request.getTicketId())
            .orElseThrow(() -> MarketplaceException.notFound("Ticket", request.getTicketId()));

        if (!ticket.isBookable()) {
            throw new MarketplaceException(ErrorKind.NOT_APPROVED,
                "Ticket " + ticket.getId() + " is not approved for booking");
        }

        if (ticket.getQuantity() < request.getQuantity()) {
            throw new MarketplaceException(ErrorKind.INSUFFICIENT_STOCK,
                "Not enough tickets available for ticket " + ticket.getId());
        }

        // The conditional decrement is authoritative; the check above only fails fast
        inventoryService.reserve(ticket.getId(), request.getQuantity());

        Booking booking = Booking.builder()
            .ticketId(ticket.getId())
            .customerEmail(request.getCustomerEmail().toLowerCase())
            .vendorEmail(ticket.getVendorEmail())
            .title(ticket.getTitle())
            .price(ticket.getPrice())
            .quantity(request.getQuantity())
            .status(BookingStatus.PENDING)
            .build();

        Booking savedBooking = bookingRepository.save(booking);
        BookingDto bookingDto = convertToDto(savedBooking);

        log.info("Booking created: id={} ticket={} quantity={} amount={}",
                savedBooking.getId(), ticket.getId(), savedBooking.getQuantity(), bookingDto.getTotalAmount());

        eventPublisher.publishAfterCommit(EventType.BOOKING_CREATED, bookingDto);
        return bookingDto;
    }

    /**
     * Vendor accepts a pending booking. Stock stays reserved.
     */
    @Transactional
    public BookingDto acceptBooking(Long bookingId, String callerEmail) {
        Booking booking = loadBooking(bookingId);
        requireVendor(booking, callerEmail);
        requireTransition(booking, BookingStatus.ACCEPTED);

        int updated = bookingRepository.markAccepted(bookingId, LocalDateTime.now());
        if (updated == 0) {
            throw transitionRefused(bookingId, BookingStatus.ACCEPTED);
        }

        BookingDto accepted = convertToDto(loadBooking(bookingId));
        log.info("Booking accepted: id={} vendor={}", bookingId, callerEmail);

        eventPublisher.publishAfterCommit(EventType.BOOKING_ACCEPTED, accepted);
        return accepted;
    }

    /**
     * Vendor rejects a pending booking and its reservation goes back to the ticket.
     */
    @Transactional
    public BookingDto rejectBooking(Long bookingId, String callerEmail) {
        Booking booking = loadBooking(bookingId);
        requireVendor(booking, callerEmail);
        requireTransition(booking, BookingStatus.REJECTED);

        int updated = bookingRepository.markRejected(bookingId, LocalDateTime.now());
        if (updated == 0) {
            throw transitionRefused(bookingId, BookingStatus.REJECTED);
        }

        inventoryService.release(booking.getTicketId(), booking.getQuantity());

        BookingDto rejected = convertToDto(loadBooking(bookingId));
        log.info("Booking rejected: id={} vendor={} released={}", bookingId, callerEmail, booking.getQuantity());

        eventPublisher.publishAfterCommit(EventType.BOOKING_REJECTED, rejected);
        return rejected;
    }

    /**
     * Cancel an accepted booking after the customer abandoned checkout. Provider callbacks
     * can repeat, so cancelling a booking that is already terminal returns it unchanged.
     */
    @Transactional
    public BookingDto cancelBooking(Long bookingId) {
        Booking booking = loadBooking(bookingId);

        if (booking.getStatus().isTerminal()) {
            log.info("Cancel ignored for booking {}: already {}", bookingId, booking.getStatus());
            return convertToDto(booking);
        }
        requireTransition(booking, BookingStatus.CANCELLED);

        int updated = bookingRepository.markCancelled(bookingId, LocalDateTime.now());
        if (updated == 0) {
            Booking current = loadBooking(bookingId);
            if (current.getStatus().isTerminal()) {
                log.info("Cancel ignored for booking {}: concurrently moved to {}", bookingId, current.getStatus());
                return convertToDto(current);
            }
            throw MarketplaceException.invalidTransition(
                "Only accepted bookings can be cancelled, booking " + bookingId + " is " + current.getStatus());
        }

        inventoryService.release(booking.getTicketId(), booking.getQuantity());

        BookingDto cancelled = convertToDto(loadBooking(bookingId));
        log.info("Booking cancelled: id={} released={}", bookingId, booking.getQuantity());

        eventPublisher.publishAfterCommit(EventType.BOOKING_CANCELLED, cancelled);
        return cancelled;
    }

    /**
     * Mark an accepted booking paid. Stock was reserved at creation and is not touched.
     * A booking that is already PAID is returned as is, so a retried verification can
     * re-run this safely.
     */
    @Transactional
    public BookingDto finalizePaid(Long bookingId) {
        int updated = bookingRepository.markPaid(bookingId, LocalDateTime.now());
        Booking current = loadBooking(bookingId);

        if (updated == 0) {
            if (current.getStatus() == BookingStatus.PAID) {
                log.debug("Booking {} already paid", bookingId);
                return convertToDto(current);
            }
            throw MarketplaceException.invalidTransition(
                "Booking " + bookingId + " cannot be marked paid from status " + current.getStatus());
        }

        BookingDto paid = convertToDto(current);
        log.info("Booking paid: id={} amount={}", bookingId, paid.getTotalAmount());

        eventPublisher.publishAfterCommit(EventType.BOOKING_PAID, paid);
        return paid;
    }

    /**
     * Reject a stale pending booking on behalf of the system and release its stock.
     * @return false if the booking left PENDING before the write
     */
    @Transactional
    public boolean expirePendingBooking(Long bookingId) {
        Booking booking = loadBooking(bookingId);

        int updated = bookingRepository.markRejected(bookingId, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Booking {} no longer pending, skipping expiry", bookingId);
            return false;
        }

        inventoryService.release(booking.getTicketId(), booking.getQuantity());

        BookingDto expired = convertToDto(loadBooking(bookingId));
        log.info("Booking expired: id={} released={}", bookingId, booking.getQuantity());

        eventPublisher.publishAfterCommit(EventType.BOOKING_EXPIRED, expired);
        return true;
    }

    @Transactional(readOnly = true)
    public BookingDto getBooking(Long bookingId, String callerEmail) {
        Booking booking = loadBooking(bookingId);

        if (!booking.isOwnedByCustomer(callerEmail) && !booking.isOwnedByVendor(callerEmail)) {
            throw MarketplaceException.forbidden("Booking " + bookingId + " belongs to another customer");
        }

        return convertToDto(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingDto> getCustomerBookings(String customerEmail, String callerEmail) {
        requireSelf(customerEmail, callerEmail);
        log.debug("Fetching bookings for customer: {}", customerEmail);

        return bookingRepository.findByCustomerEmailIgnoreCaseOrderByCreatedAtDesc(customerEmail).stream()
            .map(this::convertToDto)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<BookingDto> getVendorBookings(String vendorEmail, String callerEmail) {
        requireSelf(vendorEmail, callerEmail);
        log.debug("Fetching booking requests for vendor: {}", vendorEmail);

        return bookingRepository.findByVendorEmailIgnoreCaseOrderByCreatedAtDesc(vendorEmail).stream()
            .map(this::convertToDto)
            .toList();
    }

    // Private helper methods

    private void validateBookingRequest(BookingRequest request) {
        if (request.getTicketId() == null) {
            throw MarketplaceException.validation("Ticket ID is required");
        }
        if (request.getQuantity() == null || request.getQuantity() <= 0) {
            throw MarketplaceException.validation("Quantity must be positive");
        }
        if (request.getQuantity() > maxQuantityPerBooking) {
            throw MarketplaceException.validation("Cannot book more than " + maxQuantityPerBooking + " tickets at once");
        }
        if (request.getCustomerEmail() == null || request.getCustomerEmail().isBlank()) {
            throw MarketplaceException.validation("Customer email is required");
        }
    }

    private Booking loadBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
            .orElseThrow(() -> MarketplaceException.notFound("Booking", bookingId));
    }

    private void requireVendor(Booking booking, String callerEmail) {
        if (!booking.isOwnedByVendor(callerEmail)) {
            throw MarketplaceException.forbidden("Only the ticket's vendor can act on booking " + booking.getId());
        }
    }

    private void requireSelf(String email, String callerEmail) {
        if (email == null || !email.equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Cannot read bookings of another account");
        }
    }

    // Fails fast on a stale status; the conditional write still decides races
    private void requireTransition(Booking booking, BookingStatus target) {
        if (!booking.getStatus().canTransitionTo(target)) {
            log.warn("Refused transition of booking {} from {} to {}", booking.getId(), booking.getStatus(), target);
            throw MarketplaceException.invalidTransition(
                "Booking " + booking.getId() + " cannot move from " + booking.getStatus() + " to " + target);
        }
    }

    private MarketplaceException transitionRefused(Long bookingId, BookingStatus target) {
        BookingStatus current = bookingRepository.findById(bookingId)
            .map(Booking::getStatus)
            .orElseThrow(() -> MarketplaceException.notFound("Booking", bookingId));
        log.warn("Refused transition of booking {} from {} to {}", bookingId, current, target);
        return MarketplaceException.invalidTransition(
            "Booking " + bookingId + " cannot move from " + current + " to " + target);
    }

    BookingDto convertToDto(Booking booking) {
        return BookingDto.builder()
            .id(booking.getId())
            .ticketId(booking.getTicketId())
            .customerEmail(booking.getCustomerEmail())
            .vendorEmail(booking.getVendorEmail())
            .title(booking.getTitle())
            .price(booking.getPrice())
            .quantity(booking.getQuantity())
            .totalAmount(booking.getTotalAmount())
            .status(booking.getStatus().name())
            .createdAt(booking.getCreatedAt())
            .acceptedAt(booking.getAcceptedAt())
            .rejectedAt(booking.getRejectedAt())
            .paidAt(booking.getPaidAt())
            .cancelledAt(booking.getCancelledAt())
            .build();
    }
}
