package com.tixgo.catalog.service;

import com.tixgo.catalog.repository.TicketRepository;
import com.tixgo.catalog.repository.UserAccountRepository;
import com.tixgo.common.dto.TicketDto;
import com.tixgo.common.dto.UserDto;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.entity.UserAccount;
import com.tixgo.common.enums.UserRole;
import com.tixgo.common.enums.VerificationStatus;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;

/**
 * Admin moderation: ticket verification, the advertisement slot pool and vendor suspension.
 * Every operation requires the ADMIN role.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModerationService {

    private final TicketRepository ticketRepository;
    private final UserAccountRepository userRepository;
    private final UserAccountService userAccountService;
    private final TicketService ticketService;
    private final DistributedLockService lockService;

    @Value("${tixgo.advertise.max-slots:6}")
    private int maxAdvertisedSlots;

    @Value("${tixgo.advertise.lock-timeout-seconds:5}")
    private long lockTimeoutSeconds;

    /**
     * PENDING to APPROVED. Approving an approved ticket changes nothing.
     */
    @CacheEvict(value = {TicketService.ADVERTISED_CACHE, TicketService.DETAILS_CACHE}, allEntries = true)
    @Transactional
    public TicketDto approveTicket(Long ticketId, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        Ticket ticket = loadTicket(ticketId);

        if (ticket.getVerificationStatus() == VerificationStatus.APPROVED) {
            log.debug("Ticket {} already approved", ticketId);
            return ticketService.convertToDto(ticket);
        }

        int updated = ticketRepository.transitionVerification(ticketId, VerificationStatus.PENDING, VerificationStatus.APPROVED);
        Ticket current = loadTicket(ticketId);

        if (updated == 0 && current.getVerificationStatus() != VerificationStatus.APPROVED) {
            log.warn("Refused approval of ticket {} in status {}", ticketId, current.getVerificationStatus());
            throw MarketplaceException.invalidTransition(
                "Ticket " + ticketId + " cannot be approved from " + current.getVerificationStatus());
        }

        log.info("Ticket approved: id={} by {}", ticketId, callerEmail);
        return ticketService.convertToDto(current);
    }

    /**
     * PENDING or APPROVED to REJECTED, which is terminal. Also frees the ticket's advertisement slot.
     */
    @CacheEvict(value = {TicketService.ADVERTISED_CACHE, TicketService.DETAILS_CACHE}, allEntries = true)
    @Transactional
    public TicketDto rejectTicket(Long ticketId, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        loadTicket(ticketId);

        int updated = ticketRepository.reject(ticketId, VerificationStatus.REJECTED);
        if (updated == 0) {
            throw MarketplaceException.invalidTransition("Ticket " + ticketId + " is already rejected");
        }

        log.info("Ticket rejected: id={} by {}", ticketId, callerEmail);
        return ticketService.convertToDto(loadTicket(ticketId));
    }

    /**
     * Toggle the advertised flag. Turning it on takes one of the limited slots; the slot
     * count and the write are a single conditional update made while holding the slot lock.
     */
    @CacheEvict(value = {TicketService.ADVERTISED_CACHE, TicketService.DETAILS_CACHE}, allEntries = true)
    public TicketDto setAdvertised(Long ticketId, boolean advertised, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        Ticket ticket = loadTicket(ticketId);

        if (!advertised) {
            ticketRepository.unadvertise(ticketId);
            log.info("Ticket unadvertised: id={} by {}", ticketId, callerEmail);
            return ticketService.convertToDto(loadTicket(ticketId));
        }

        requireAdvertisable(ticket);
        if (ticket.isAdvertised()) {
            return ticketService.convertToDto(ticket);
        }

        int updated = lockService.executeWithLock(
            DistributedLockService.advertiseSlotsLock(),
            Duration.ofSeconds(lockTimeoutSeconds),
            () -> ticketRepository.advertiseIfSlotAvailable(ticketId, VerificationStatus.APPROVED, maxAdvertisedSlots));

        Ticket current = loadTicket(ticketId);
        if (updated == 0 && !current.isAdvertised()) {
            requireAdvertisable(current);
            log.warn("Advertise refused for ticket {}: all {} slots taken", ticketId, maxAdvertisedSlots);
            throw new MarketplaceException(ErrorKind.SLOT_LIMIT_EXCEEDED,
                "Cannot advertise more than " + maxAdvertisedSlots + " tickets");
        }

        log.info("Ticket advertised: id={} by {}", ticketId, callerEmail);
        return ticketService.convertToDto(current);
    }

    /**
     * Suspend a vendor and hide every one of their tickets in the same transaction.
     */
    @CacheEvict(value = {TicketService.ADVERTISED_CACHE, TicketService.DETAILS_CACHE}, allEntries = true)
    @Transactional
    public UserDto markFraud(Long userId, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        UserAccount user = loadUser(userId);

        if (!user.isVendor()) {
            throw MarketplaceException.validation("User " + userId + " is not a vendor");
        }

        user.setFraud(true);
        UserAccount saved = userRepository.save(user);
        int hiddenTickets = ticketRepository.hideAllByVendor(user.getEmail());

        log.warn("Vendor {} marked fraudulent by {}, {} tickets hidden", user.getEmail(), callerEmail, hiddenTickets);
        return userAccountService.convertToDto(saved);
    }

    /**
     * Grants the vendor role and lifts any suspension. Tickets hidden by a suspension stay hidden.
     */
    @Transactional
    public UserDto makeVendor(Long userId, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        UserAccount user = loadUser(userId);

        user.setRole(UserRole.VENDOR);
        user.setFraud(false);

        log.info("User {} made vendor by {}", user.getEmail(), callerEmail);
        return userAccountService.convertToDto(userRepository.save(user));
    }

    @Transactional
    public UserDto makeAdmin(Long userId, String callerEmail) {
        userAccountService.requireAdmin(callerEmail);
        UserAccount user = loadUser(userId);

        user.setRole(UserRole.ADMIN);

        log.info("User {} made admin by {}", user.getEmail(), callerEmail);
        return userAccountService.convertToDto(userRepository.save(user));
    }

    private void requireAdvertisable(Ticket ticket) {
        if (!ticket.isBookable()) {
            throw new MarketplaceException(ErrorKind.NOT_APPROVED,
                "Only approved, visible tickets can be advertised, ticket " + ticket.getId() + " is not");
        }
    }

    private Ticket loadTicket(Long ticketId) {
        return ticketRepository.findById(ticketId)
            .orElseThrow(() -> MarketplaceException.notFound("Ticket", ticketId));
    }

    private UserAccount loadUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> MarketplaceException.notFound("User", userId));
    }
}
