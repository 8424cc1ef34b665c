package com.tixgo.booking.service;

import com.tixgo.booking.repository.TicketInventoryRepository;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.enums.VerificationStatus;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Available-quantity counter for tickets. Callers guarantee at most one release per
 * reservation; neither operation is idempotent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InventoryService {

    private final TicketInventoryRepository inventoryRepository;

    @Transactional
    public void reserve(Long ticketId, int quantity) {
        if (quantity <= 0) {
            throw MarketplaceException.validation("Quantity must be positive");
        }

        int updated = inventoryRepository.reserve(ticketId, quantity, VerificationStatus.APPROVED);
        if (updated == 0) {
            Ticket ticket = inventoryRepository.findById(ticketId)
                .orElseThrow(() -> MarketplaceException.notFound("Ticket", ticketId));
            if (!ticket.isBookable()) {
                log.warn("Reservation refused for ticket {}: status={} hidden={}",
                        ticketId, ticket.getVerificationStatus(), ticket.isHidden());
                throw new MarketplaceException(ErrorKind.NOT_APPROVED,
                    "Ticket " + ticketId + " is not approved for booking");
            }
            log.warn("Reservation refused for ticket {}: fewer than {} units left", ticketId, quantity);
            throw new MarketplaceException(ErrorKind.INSUFFICIENT_STOCK,
                "Not enough tickets available for ticket " + ticketId);
        }

        log.debug("Reserved {} units of ticket {}", quantity, ticketId);
    }

    @Transactional
    public void release(Long ticketId, int quantity) {
        if (quantity <= 0) {
            throw MarketplaceException.validation("Quantity must be positive");
        }

        int updated = inventoryRepository.release(ticketId, quantity);
        if (updated == 0) {
            log.warn("Ticket {} no longer exists, {} released units were dropped", ticketId, quantity);
            return;
        }

        log.debug("Released {} units of ticket {}", quantity, ticketId);
    }
}
