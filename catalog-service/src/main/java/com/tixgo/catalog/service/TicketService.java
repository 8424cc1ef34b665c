package com.tixgo.catalog.service;

import com.tixgo.catalog.repository.BookingLedgerRepository;
import com.tixgo.catalog.repository.TicketRepository;
import com.tixgo.common.dto.TicketDto;
import com.tixgo.common.dto.TicketRequest;
import com.tixgo.common.dto.TicketUpdateRequest;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.enums.VerificationStatus;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.CallerRole;
import com.tixgo.common.identity.RoleLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TicketService {

    static final String ADVERTISED_CACHE = "advertised_tickets";
    static final String DETAILS_CACHE = "ticket_details";

    private static final EnumSet<BookingStatus> OPEN_BOOKINGS = EnumSet.of(BookingStatus.PENDING, BookingStatus.ACCEPTED);

    private final TicketRepository ticketRepository;
    private final BookingLedgerRepository bookingRepository;
    private final RoleLookup roleLookup;

    /**
     * Vendor lists a new ticket. It waits in PENDING until an admin approves it.
     */
    @CacheEvict(value = {ADVERTISED_CACHE, DETAILS_CACHE}, allEntries = true)
    @Transactional
    public TicketDto createTicket(TicketRequest request, String callerEmail) {
        CallerRole caller = roleLookup.lookup(callerEmail);

        if (!caller.isVendor()) {
            throw MarketplaceException.forbidden("Only vendors can create tickets");
        }
        if (caller.isFraud()) {
            throw new MarketplaceException(ErrorKind.VENDOR_SUSPENDED, "Vendor " + callerEmail + " is suspended");
        }

        Ticket ticket = Ticket.builder()
            .vendorEmail(callerEmail.toLowerCase())
            .vendorName(request.getVendorName())
            .title(request.getTitle())
            .fromLocation(request.getFrom())
            .toLocation(request.getTo())
            .departure(request.getDeparture())
            .transportType(request.getTransportType())
            .price(request.getPrice())
            .quantity(request.getQuantity())
            .perks(request.getPerks() != null ? new ArrayList<>(request.getPerks()) : new ArrayList<>())
            .imageUrl(request.getImageUrl())
            .verificationStatus(VerificationStatus.PENDING)
            .advertised(false)
            .hidden(false)
            .build();

        Ticket saved = ticketRepository.save(ticket);
        log.info("Ticket created: id={} vendor={} quantity={}", saved.getId(), saved.getVendorEmail(), saved.getQuantity());
        return convertToDto(saved);
    }

    /**
     * Partial update by the owning vendor. Null fields are left as they are.
     */
    @CacheEvict(value = {ADVERTISED_CACHE, DETAILS_CACHE}, allEntries = true)
    @Transactional
    public TicketDto updateTicket(Long ticketId, TicketUpdateRequest request, String callerEmail) {
        if (request.isEmpty()) {
            throw MarketplaceException.validation("No fields to update");
        }

        Ticket ticket = loadOwnedMutableTicket(ticketId, callerEmail);

        if (request.getTitle() != null) {
            ticket.setTitle(request.getTitle());
        }
        if (request.getFrom() != null) {
            ticket.setFromLocation(request.getFrom());
        }
        if (request.getTo() != null) {
            ticket.setToLocation(request.getTo());
        }
        if (request.getDeparture() != null) {
            ticket.setDeparture(request.getDeparture());
        }
        if (request.getTransportType() != null) {
            ticket.setTransportType(request.getTransportType());
        }
        if (request.getPrice() != null) {
            ticket.setPrice(request.getPrice());
        }
        if (request.getQuantity() != null) {
            ticket.setQuantity(request.getQuantity());
        }
        if (request.getPerks() != null) {
            ticket.setPerks(new ArrayList<>(request.getPerks()));
        }
        if (request.getImageUrl() != null) {
            ticket.setImageUrl(request.getImageUrl());
        }

        try {
            Ticket saved = ticketRepository.saveAndFlush(ticket);
            log.info("Ticket updated: id={} vendor={}", ticketId, callerEmail);
            return convertToDto(saved);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Concurrent update of ticket {} by {}", ticketId, callerEmail);
            throw new MarketplaceException(ErrorKind.CONCURRENT_UPDATE,
                "Ticket " + ticketId + " was modified concurrently, please retry", e);
        }
    }

    @CacheEvict(value = {ADVERTISED_CACHE, DETAILS_CACHE}, allEntries = true)
    @Transactional
    public void deleteTicket(Long ticketId, String callerEmail) {
        Ticket ticket = loadOwnedMutableTicket(ticketId, callerEmail);

        long openBookings = bookingRepository.countByTicketIdAndStatusIn(ticketId, OPEN_BOOKINGS);
        if (openBookings > 0) {
            throw MarketplaceException.invalidTransition(
                "Ticket " + ticketId + " has " + openBookings + " open bookings");
        }

        ticketRepository.delete(ticket);
        log.info("Ticket deleted: id={} vendor={}", ticketId, callerEmail);
    }

    /**
     * Approved, visible tickets, newest first
     */
    @Transactional(readOnly = true)
    public Page<TicketDto> getPublicTickets(String vendorEmail, Boolean advertised, int page, int size) {
        log.debug("Listing tickets: vendor={} advertised={} page={} size={}", vendorEmail, advertised, page, size);

        return ticketRepository.findVisible(VerificationStatus.APPROVED, vendorEmail, advertised, PageRequest.of(page, size))
            .map(this::convertToDto);
    }

    @Cacheable(value = ADVERTISED_CACHE, key = "#limit")
    @Transactional(readOnly = true)
    public List<TicketDto> getAdvertisedTickets(int limit) {
        log.debug("Fetching up to {} advertised tickets", limit);

        return ticketRepository.findAdvertised(VerificationStatus.APPROVED, PageRequest.of(0, limit)).stream()
            .map(this::convertToDto)
            .toList();
    }

    @Cacheable(value = DETAILS_CACHE, key = "#ticketId")
    @Transactional(readOnly = true)
    public TicketDto getTicket(Long ticketId) {
        return ticketRepository.findById(ticketId)
            .filter(ticket -> !ticket.isHidden())
            .map(this::convertToDto)
            .orElseThrow(() -> MarketplaceException.notFound("Ticket", ticketId));
    }

    @Transactional(readOnly = true)
    public List<TicketDto> getVendorTickets(String vendorEmail, String callerEmail) {
        if (vendorEmail == null || !vendorEmail.equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Cannot list tickets of another vendor");
        }

        return ticketRepository.findByVendorEmailIgnoreCaseAndHiddenFalseOrderByCreatedAtDesc(vendorEmail).stream()
            .map(this::convertToDto)
            .toList();
    }

    /**
     * Moderation queue. Includes hidden tickets.
     */
    @Transactional(readOnly = true)
    public Page<TicketDto> getAllTickets(VerificationStatus status, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size);
        Page<Ticket> tickets = status == null
            ? ticketRepository.findAllByOrderByCreatedAtDesc(pageable)
            : ticketRepository.findByVerificationStatusOrderByCreatedAtDesc(status, pageable);

        return tickets.map(this::convertToDto);
    }

    private Ticket loadOwnedMutableTicket(Long ticketId, String callerEmail) {
        Ticket ticket = ticketRepository.findById(ticketId)
            .orElseThrow(() -> MarketplaceException.notFound("Ticket", ticketId));

        if (!ticket.isOwnedBy(callerEmail)) {
            throw MarketplaceException.forbidden("Ticket " + ticketId + " belongs to another vendor");
        }
        if (ticket.isRejected()) {
            throw MarketplaceException.forbidden("Rejected ticket " + ticketId + " can no longer be changed");
        }
        return ticket;
    }

    TicketDto convertToDto(Ticket ticket) {
        return TicketDto.builder()
            .id(ticket.getId())
            .vendorEmail(ticket.getVendorEmail())
            .vendorName(ticket.getVendorName())
            .title(ticket.getTitle())
            .from(ticket.getFromLocation())
            .to(ticket.getToLocation())
            .departure(ticket.getDeparture())
            .transportType(ticket.getTransportType())
            .price(ticket.getPrice())
            .quantity(ticket.getQuantity())
            .perks(ticket.getPerks() != null ? new ArrayList<>(ticket.getPerks()) : new ArrayList<>())
            .imageUrl(ticket.getImageUrl())
            .verificationStatus(ticket.getVerificationStatus().name())
            .advertised(ticket.isAdvertised())
            .hidden(ticket.isHidden())
            .createdAt(ticket.getCreatedAt())
            .updatedAt(ticket.getUpdatedAt())
            .build();
    }
}
