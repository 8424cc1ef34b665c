package com.tixgo.catalog.service;

import com.tixgo.catalog.repository.TicketRepository;
import com.tixgo.common.dto.TicketDto;
import com.tixgo.common.dto.TicketRequest;
import com.tixgo.common.dto.TicketUpdateRequest;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.entity.UserAccount;
import com.tixgo.common.enums.UserRole;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class TicketServiceIntegrationTest {

    private static final String ADMIN = "admin@example.com";
    private static final String VENDOR = "shohagh@example.com";

    @Autowired
    private TicketService ticketService;

    @Autowired
    private ModerationService moderationService;

    @Autowired
    private TicketRepository ticketRepository;

    @Autowired
    private EntityManager entityManager;

    @MockBean
    private DistributedLockService lockService;

    @BeforeEach
    void setUp() {
        entityManager.persist(UserAccount.builder().email(ADMIN).role(UserRole.ADMIN).build());
        entityManager.persist(UserAccount.builder().email(VENDOR).role(UserRole.VENDOR).build());
        entityManager.flush();
    }

    private TicketRequest request() {
        return TicketRequest.builder()
            .vendorName("Shohagh Paribahan")
            .title("Dhaka to Jessore")
            .from("Dhaka")
            .to("Jessore")
            .departure(LocalDateTime.now().plusDays(8))
            .transportType("bus")
            .price(new BigDecimal("14.00"))
            .quantity(25)
            .perks(List.of("AC", "Blanket"))
            .build();
    }

    @Test
    void pendingTicket_InvisibleUntilApproved() {
        TicketDto created = ticketService.createTicket(request(), VENDOR);

        assertEquals("PENDING", created.getVerificationStatus());
        assertEquals(0, ticketService.getPublicTickets(null, null, 0, 20).getTotalElements());
        assertEquals(1, ticketService.getVendorTickets(VENDOR, VENDOR).size());

        moderationService.approveTicket(created.getId(), ADMIN);

        List<TicketDto> visible = ticketService.getPublicTickets(VENDOR, null, 0, 20).getContent();
        assertEquals(1, visible.size());
        assertEquals(List.of("AC", "Blanket"), visible.get(0).getPerks());
    }

    @Test
    void update_ChangesFieldsAndBumpsVersion() {
        TicketDto created = ticketService.createTicket(request(), VENDOR);
        Long before = ticketRepository.findById(created.getId()).orElseThrow().getVersion();

        TicketDto updated = ticketService.updateTicket(created.getId(),
            TicketUpdateRequest.builder().quantity(40).title("Dhaka to Jessore AC").build(), VENDOR);

        assertEquals(40, updated.getQuantity());
        assertEquals("Dhaka to Jessore AC", updated.getTitle());
        assertEquals("Jessore", updated.getTo());
        assertTrue(ticketRepository.findById(created.getId()).orElseThrow().getVersion() > before);
    }

    @Test
    void rejectedTicket_FrozenForVendor() {
        TicketDto created = ticketService.createTicket(request(), VENDOR);
        moderationService.rejectTicket(created.getId(), ADMIN);

        MarketplaceException update = assertThrows(MarketplaceException.class,
            () -> ticketService.updateTicket(created.getId(), TicketUpdateRequest.builder().quantity(1).build(), VENDOR));
        MarketplaceException delete = assertThrows(MarketplaceException.class,
            () -> ticketService.deleteTicket(created.getId(), VENDOR));

        assertEquals(ErrorKind.FORBIDDEN, update.getKind());
        assertEquals(ErrorKind.FORBIDDEN, delete.getKind());
    }

    @Test
    void delete_BlockedByOpenBookingThenAllowed() {
        TicketDto created = ticketService.createTicket(request(), VENDOR);
        Booking booking = Booking.builder()
            .ticketId(created.getId())
            .customerEmail("rahim@example.com")
            .vendorEmail(VENDOR)
            .title(created.getTitle())
            .price(created.getPrice())
            .quantity(2)
            .status(BookingStatus.ACCEPTED)
            .build();
        entityManager.persist(booking);
        entityManager.flush();

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> ticketService.deleteTicket(created.getId(), VENDOR));
        assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind());

        booking.setStatus(BookingStatus.PAID);
        entityManager.flush();

        ticketService.deleteTicket(created.getId(), VENDOR);
        entityManager.flush();
        assertTrue(ticketRepository.findById(created.getId()).isEmpty());
    }
}
