package com.tixgo.booking.controller;

import com.tixgo.booking.config.CheckoutProperties;
import com.tixgo.booking.service.PaymentService;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.CheckoutResponse;
import com.tixgo.common.dto.PaymentDto;
import com.tixgo.common.dto.PaymentVerificationResult;
import com.tixgo.common.exception.ErrorKind;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.IdentityVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentControllerTest {

    private static final String TOKEN = "Bearer token-alice";
    private static final String CUSTOMER = "alice@example.com";

    @Mock
    private PaymentService paymentService;

    @Mock
    private IdentityVerifier identityVerifier;

    private PaymentController paymentController;

    @BeforeEach
    void setUp() {
        CheckoutProperties properties = new CheckoutProperties();
        properties.setSiteBaseUrl("https://tixgo.test");
        paymentController = new PaymentController(paymentService, identityVerifier, properties);
    }

    private PaymentVerificationResult verified() {
        return PaymentVerificationResult.builder()
            .payment(PaymentDto.builder().id(7L).build())
            .booking(BookingDto.builder().id(100L).status("PAID").build())
            .build();
    }

    @Test
    void createCheckout_Returns201() {
        when(identityVerifier.verify(TOKEN)).thenReturn(CUSTOMER);
        when(paymentService.createCheckout(100L, CUSTOMER))
            .thenReturn(CheckoutResponse.builder().bookingId(100L).sessionId("cs_test_1").url("https://pay").build());

        ResponseEntity<CheckoutResponse> result = paymentController.createCheckout(TOKEN, 100L);

        assertEquals(HttpStatus.CREATED, result.getStatusCode());
        assertEquals("cs_test_1", result.getBody().getSessionId());
    }

    @Test
    void createCheckout_NotAccepted_Rethrown() {
        when(identityVerifier.verify(TOKEN)).thenReturn(CUSTOMER);
        when(paymentService.createCheckout(100L, CUSTOMER))
            .thenThrow(new MarketplaceException(ErrorKind.NOT_ACCEPTED, "Booking 100 has not been accepted"));

        MarketplaceException e = assertThrows(MarketplaceException.class,
            () -> paymentController.createCheckout(TOKEN, 100L));
        assertEquals(ErrorKind.NOT_ACCEPTED, e.getKind());
    }

    @Test
    void verifyPayment_Returns200() {
        when(paymentService.verifyPayment("cs_test_1")).thenReturn(verified());

        ResponseEntity<PaymentVerificationResult> result = paymentController.verifyPayment("cs_test_1");

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals("PAID", result.getBody().getBooking().getStatus());
    }

    @Test
    void checkoutSuccess_RedirectsToSuccessPage() {
        when(paymentService.verifyPayment("cs_test_1")).thenReturn(verified());

        ResponseEntity<Void> result = paymentController.checkoutSuccess("cs_test_1");

        assertEquals(HttpStatus.FOUND, result.getStatusCode());
        assertEquals("https://tixgo.test/payment-success?bookingId=100", result.getHeaders().getLocation().toString());
    }

    @Test
    void checkoutSuccess_NotPaid_RedirectsToFailurePage() {
        when(paymentService.verifyPayment("cs_test_1"))
            .thenThrow(new MarketplaceException(ErrorKind.PAYMENT_NOT_COMPLETED, "not paid"));

        ResponseEntity<Void> result = paymentController.checkoutSuccess("cs_test_1");

        assertEquals(HttpStatus.FOUND, result.getStatusCode());
        assertEquals("https://tixgo.test/payment-failed?reason=PAYMENT_NOT_COMPLETED",
            result.getHeaders().getLocation().toString());
    }

    @Test
    void checkoutCancel_RedirectsToCancelledPage() {
        when(paymentService.cancelCheckout(100L)).thenReturn(BookingDto.builder().id(100L).status("CANCELLED").build());

        ResponseEntity<Void> result = paymentController.checkoutCancel(100L);

        assertEquals(HttpStatus.FOUND, result.getStatusCode());
        assertEquals("https://tixgo.test/payment-cancelled?bookingId=100", result.getHeaders().getLocation().toString());
    }

    @Test
    void getPaymentHistory_Returns200() {
        when(identityVerifier.verify(TOKEN)).thenReturn(CUSTOMER);
        when(paymentService.getPaymentHistory(CUSTOMER, CUSTOMER)).thenReturn(List.of(PaymentDto.builder().id(7L).build()));

        ResponseEntity<List<PaymentDto>> result = paymentController.getPaymentHistory(TOKEN, CUSTOMER);

        assertEquals(1, result.getBody().size());
    }
}
