package com.tixgo.booking.service;

import com.tixgo.booking.repository.BookingRepository;
import com.tixgo.booking.repository.PaymentRepository;
import com.tixgo.booking.repository.TicketInventoryRepository;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.BookingRequest;
import com.tixgo.common.dto.CheckoutResponse;
import com.tixgo.common.dto.PaymentVerificationResult;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.enums.VerificationStatus;
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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PaymentServiceIntegrationTest {

    private static final String VENDOR = "vendor@example.com";
    private static final String ALICE = "alice@example.com";

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private BookingService bookingService;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private TicketInventoryRepository ticketRepository;

    @Autowired
    private EntityManager entityManager;

    @MockBean
    private BookingEventPublisher eventPublisher;

    @MockBean
    private CheckoutGateway checkoutGateway;

    private Ticket ticket;
    private BookingDto accepted;

    @BeforeEach
    void setUp() {
        ticket = Ticket.builder()
            .vendorEmail(VENDOR)
            .title("Launch to Barisal")
            .fromLocation("Dhaka")
            .toLocation("Barisal")
            .departure(LocalDateTime.now().plusDays(2))
            .transportType("launch")
            .price(new BigDecimal("25.00"))
            .quantity(10)
            .verificationStatus(VerificationStatus.APPROVED)
            .build();
        entityManager.persist(ticket);
        entityManager.flush();

        BookingDto created = bookingService.createBooking(
            BookingRequest.builder().ticketId(ticket.getId()).quantity(2).customerEmail(ALICE).build(), ALICE);
        accepted = bookingService.acceptBooking(created.getId(), VENDOR);
    }

    private CheckoutSession paidSession(String sessionId, String paymentIntent) {
        return CheckoutSession.builder()
            .id(sessionId)
            .paymentStatus("paid")
            .amountTotal(5000L)
            .currency("usd")
            .transactionRef(paymentIntent)
            .metadata(Map.of(CheckoutSession.BOOKING_ID_KEY, String.valueOf(accepted.getId())))
            .build();
    }

    @Test
    void createCheckout_AttachesSessionToBooking() {
        when(checkoutGateway.createSession(any(CheckoutSessionRequest.class)))
            .thenReturn(CheckoutSession.builder().id("cs_int_1").url("https://checkout.test/cs_int_1").build());

        CheckoutResponse response = paymentService.createCheckout(accepted.getId(), ALICE);

        assertEquals("cs_int_1", response.getSessionId());
        assertEquals("cs_int_1", bookingRepository.findById(accepted.getId()).orElseThrow().getCheckoutSessionId());
    }

    @Test
    void verifyPayment_Twice_RecordsOnePayment() {
        when(checkoutGateway.retrieveSession("cs_int_1")).thenReturn(paidSession("cs_int_1", "pi_int_1"));

        PaymentVerificationResult first = paymentService.verifyPayment("cs_int_1");
        PaymentVerificationResult second = paymentService.verifyPayment("cs_int_1");

        assertFalse(first.isAlreadyProcessed());
        assertTrue(second.isAlreadyProcessed());
        assertEquals("PAID", second.getBooking().getStatus());
        assertEquals(1, paymentRepository.countByBookingId(accepted.getId()));

        BigDecimal expected = new BigDecimal("25.00").multiply(BigDecimal.valueOf(2));
        assertEquals(0, expected.compareTo(first.getPayment().getAmount()));
        assertEquals("USD", first.getPayment().getCurrency());
        assertEquals("pi_int_1", first.getPayment().getTransactionId());
    }

    @Test
    void verifyPayment_DoesNotTouchStock() {
        when(checkoutGateway.retrieveSession("cs_int_1")).thenReturn(paidSession("cs_int_1", "pi_int_1"));

        paymentService.verifyPayment("cs_int_1");

        assertEquals(8, ticketRepository.findById(ticket.getId()).orElseThrow().getQuantity());
    }

    @Test
    void createCheckout_AfterPayment_AlreadyPaid() {
        when(checkoutGateway.retrieveSession("cs_int_1")).thenReturn(paidSession("cs_int_1", "pi_int_1"));
        paymentService.verifyPayment("cs_int_1");

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> paymentService.createCheckout(accepted.getId(), ALICE));

        assertEquals(ErrorKind.ALREADY_PAID, e.getKind());
    }

    @Test
    void cancelCheckout_AfterPayment_NoOp() {
        when(checkoutGateway.retrieveSession("cs_int_1")).thenReturn(paidSession("cs_int_1", "pi_int_1"));
        paymentService.verifyPayment("cs_int_1");

        BookingDto result = paymentService.cancelCheckout(accepted.getId());

        assertEquals("PAID", result.getStatus());
        assertEquals(8, ticketRepository.findById(ticket.getId()).orElseThrow().getQuantity());
    }

    @Test
    void cancelCheckout_Unpaid_ReleasesStock() {
        BookingDto result = paymentService.cancelCheckout(accepted.getId());

        assertEquals("CANCELLED", result.getStatus());
        assertEquals(10, ticketRepository.findById(ticket.getId()).orElseThrow().getQuantity());
    }

    @Test
    void verifyPayment_CancelledBooking_InvalidTransition() {
        bookingService.cancelBooking(accepted.getId());
        when(checkoutGateway.retrieveSession("cs_int_2")).thenReturn(paidSession("cs_int_2", "pi_int_2"));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> paymentService.verifyPayment("cs_int_2"));

        assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind());
        assertEquals(BookingStatus.CANCELLED, bookingRepository.findById(accepted.getId()).orElseThrow().getStatus());
    }
}
