package com.tixgo.booking.service;

import com.tixgo.booking.repository.PaymentRepository;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.PaymentDto;
import com.tixgo.common.dto.PaymentVerificationResult;
import com.tixgo.common.entity.Booking;
import com.tixgo.common.entity.Payment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Records a confirmed payment and marks its booking paid in one transaction. The insert is
 * flushed first so a duplicate transaction id fails on the unique constraint before the
 * booking is touched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentFinalizer {

    private final PaymentRepository paymentRepository;
    private final BookingService bookingService;

    @Transactional
    public PaymentVerificationResult recordAndFinalize(Booking booking, CheckoutSession session,
                                                       String defaultCurrency) {
        BigDecimal amount = session.getAmountTotal() != null
            ? BigDecimal.valueOf(session.getAmountTotal()).movePointLeft(2)
            : booking.getTotalAmount();
        String currency = session.getCurrency() != null ? session.getCurrency() : defaultCurrency;

        Payment payment = Payment.builder()
            .bookingId(booking.getId())
            .ticketId(booking.getTicketId())
            .customerEmail(booking.getCustomerEmail())
            .amount(amount)
            .currency(currency.toUpperCase(Locale.ROOT))
            .quantity(booking.getQuantity())
            .transactionId(session.getTransactionKey())
            .checkoutSessionId(session.getId())
            .paidAt(LocalDateTime.now())
            .build();

        Payment savedPayment = paymentRepository.saveAndFlush(payment);
        BookingDto paidBooking = bookingService.finalizePaid(booking.getId());

        log.info("Payment recorded: id={} transaction={} booking={} amount={} {}",
                savedPayment.getId(), savedPayment.getTransactionId(), booking.getId(),
                savedPayment.getAmount(), savedPayment.getCurrency());

        return PaymentVerificationResult.builder()
            .payment(convertToDto(savedPayment))
            .booking(paidBooking)
            .alreadyProcessed(false)
            .build();
    }

    static PaymentDto convertToDto(Payment payment) {
        return PaymentDto.builder()
            .id(payment.getId())
            .bookingId(payment.getBookingId())
            .ticketId(payment.getTicketId())
            .customerEmail(payment.getCustomerEmail())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .quantity(payment.getQuantity())
            .transactionId(payment.getTransactionId())
            .paidAt(payment.getPaidAt())
            .build();
    }
}
