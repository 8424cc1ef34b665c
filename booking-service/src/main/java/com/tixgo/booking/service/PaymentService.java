package com.tixgo.booking.service;

import com.tixgo.booking.config.CheckoutProperties;
import com.tixgo.booking.repository.BookingRepository;
import com.tixgo.booking.repository.PaymentRepository;
import com.tixgo.booking.repository.TicketInventoryRepository;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.CheckoutResponse;
import com.tixgo.common.dto.PaymentDto;
import com.tixgo.common.dto.PaymentVerificationResult;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Booking.BookingStatus;
import com.tixgo.common.entity.Payment;
import com.tixgo.common.entity.Ticket;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bridges hosted checkout sessions to bookings. Completion signals may arrive more than
 * once; the unique transaction id on payments is the only deduplication.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentService {

    private final BookingRepository bookingRepository;
    private final TicketInventoryRepository ticketRepository;
    private final PaymentRepository paymentRepository;
    private final CheckoutGateway checkoutGateway;
    private final PaymentFinalizer paymentFinalizer;
    private final BookingService bookingService;
    private final CheckoutProperties checkoutProperties;

    /**
     * Open a checkout session for an accepted booking. All checks run before the provider is called.
     */
    public CheckoutResponse createCheckout(Long bookingId, String callerEmail) {
        log.info("Checkout requested for booking: {} by {}", bookingId, callerEmail);

        Booking booking = bookingRepository.findById(bookingId)
            .orElseThrow(() -> MarketplaceException.notFound("Booking", bookingId));

        if (!booking.isOwnedByCustomer(callerEmail)) {
            throw MarketplaceException.forbidden("Only the booking's customer can pay for booking " + bookingId);
        }
        if (booking.getStatus() == BookingStatus.PAID) {
            throw new MarketplaceException(ErrorKind.ALREADY_PAID, "Booking " + bookingId + " is already paid");
        }
        if (booking.getStatus() != BookingStatus.ACCEPTED) {
            throw new MarketplaceException(ErrorKind.NOT_ACCEPTED,
                "Booking " + bookingId + " has not been accepted by the vendor (status " + booking.getStatus() + ")");
        }

        Ticket ticket = ticketRepository.findById(booking.getTicketId())
            .orElseThrow(() -> MarketplaceException.notFound("Ticket", booking.getTicketId()));

        if (!ticket.getDeparture().isAfter(LocalDateTime.now())) {
            throw new MarketplaceException(ErrorKind.DEPARTURE_PASSED,
                "Departure time has passed for ticket " + ticket.getId());
        }
        if (booking.getPrice() == null || booking.getPrice().signum() <= 0) {
            throw MarketplaceException.validation("Booking " + bookingId + " has no payable price");
        }
        if (booking.getQuantity() == null || booking.getQuantity() <= 0) {
            throw MarketplaceException.validation("Booking " + bookingId + " has no payable quantity");
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(CheckoutSession.BOOKING_ID_KEY, String.valueOf(booking.getId()));
        metadata.put("ticketId", String.valueOf(booking.getTicketId()));
        metadata.put("customerEmail", booking.getCustomerEmail());
        metadata.put("quantity", String.valueOf(booking.getQuantity()));

        CheckoutSessionRequest sessionRequest = CheckoutSessionRequest.builder()
            .productName(booking.getTitle())
            .unitAmount(toMinorUnits(booking.getPrice()))
            .quantity(booking.getQuantity())
            .currency(checkoutProperties.getCurrency())
            .successUrl(checkoutProperties.successCallbackUrl())
            .cancelUrl(checkoutProperties.cancelCallbackUrl(booking.getId()))
            .metadata(metadata)
            .build();

        CheckoutSession session = checkoutGateway.createSession(sessionRequest);

        int attached = bookingRepository.attachCheckoutSession(bookingId, session.getId(), BookingStatus.ACCEPTED);
        if (attached == 0) {
            log.warn("Booking {} left ACCEPTED while session {} was being created", bookingId, session.getId());
        }

        return CheckoutResponse.builder()
            .bookingId(bookingId)
            .sessionId(session.getId())
            .url(session.getUrl())
            .build();
    }

    /**
     * Confirm a completed checkout session and finalize its booking exactly once.
     */
    public PaymentVerificationResult verifyPayment(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw MarketplaceException.validation("Checkout session id is required");
        }

        CheckoutSession session = checkoutGateway.retrieveSession(sessionId);
        if (!session.isPaid()) {
            log.warn("Session {} not paid yet: status={}", sessionId, session.getPaymentStatus());
            throw new MarketplaceException(ErrorKind.PAYMENT_NOT_COMPLETED,
                "Payment for session " + sessionId + " is not completed");
        }

        Long bookingId = parseBookingId(session);
        Booking booking = bookingRepository.findById(bookingId)
            .orElseThrow(() -> MarketplaceException.notFound("Booking", bookingId));

        String transactionId = session.getTransactionKey();
        Optional<Payment> existing = paymentRepository.findByTransactionId(transactionId);
        if (existing.isPresent()) {
            log.info("Transaction {} already recorded, re-checking booking {}", transactionId, bookingId);
            return alreadyProcessed(existing.get(), bookingId);
        }

        try {
            return paymentFinalizer.recordAndFinalize(booking, session, checkoutProperties.getCurrency());
        } catch (DataIntegrityViolationException e) {
            Payment recorded = paymentRepository.findByTransactionId(transactionId).orElseThrow(() -> e);
            log.info("Transaction {} recorded by a concurrent delivery", transactionId);
            return alreadyProcessed(recorded, bookingId);
        } catch (MarketplaceException e) {
            if (e.getKind() == ErrorKind.INVALID_TRANSITION) {
                log.error("Paid session {} could not finalize booking {}: {}", sessionId, bookingId, e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Provider cancel callback. A session the provider already reports as paid is verified
     * instead of cancelled.
     */
    public BookingDto cancelCheckout(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
            .orElseThrow(() -> MarketplaceException.notFound("Booking", bookingId));

        if (booking.getStatus() == BookingStatus.ACCEPTED && StringUtils.hasText(booking.getCheckoutSessionId())) {
            CheckoutSession session = checkoutGateway.retrieveSession(booking.getCheckoutSessionId());
            if (session.isPaid()) {
                log.warn("Cancel callback for booking {} but session {} is paid, finalizing instead",
                        bookingId, session.getId());
                return verifyPayment(session.getId()).getBooking();
            }
        }

        return bookingService.cancelBooking(bookingId);
    }

    public List<PaymentDto> getPaymentHistory(String customerEmail, String callerEmail) {
        if (customerEmail == null || !customerEmail.equalsIgnoreCase(callerEmail)) {
            throw MarketplaceException.forbidden("Cannot read payments of another account");
        }

        return paymentRepository.findByCustomerEmailIgnoreCaseOrderByPaidAtDesc(customerEmail).stream()
            .map(PaymentFinalizer::convertToDto)
            .toList();
    }

    static long toMinorUnits(BigDecimal price) {
        return price.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private PaymentVerificationResult alreadyProcessed(Payment payment, Long bookingId) {
        BookingDto booking = bookingService.finalizePaid(bookingId);
        return PaymentVerificationResult.builder()
            .payment(PaymentFinalizer.convertToDto(payment))
            .booking(booking)
            .alreadyProcessed(true)
            .build();
    }

    private Long parseBookingId(CheckoutSession session) {
        String raw = session.getMetadata() != null ? session.getMetadata().get(CheckoutSession.BOOKING_ID_KEY) : null;
        if (!StringUtils.hasText(raw)) {
            throw MarketplaceException.validation("Checkout session " + session.getId() + " carries no booking id");
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new MarketplaceException(ErrorKind.VALIDATION_ERROR,
                "Checkout session " + session.getId() + " carries a malformed booking id", e);
        }
    }
}
