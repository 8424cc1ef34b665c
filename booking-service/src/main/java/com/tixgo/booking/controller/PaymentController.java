package com.tixgo.booking.controller;

import com.tixgo.booking.config.CheckoutProperties;
import com.tixgo.booking.service.PaymentService;
import com.tixgo.common.dto.BookingDto;
import com.tixgo.common.dto.CheckoutResponse;
import com.tixgo.common.dto.PaymentDto;
import com.tixgo.common.dto.PaymentVerificationResult;
import com.tixgo.common.exception.MarketplaceException;
import com.tixgo.common.identity.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payment Controller", description = "Hosted checkout and payment reconciliation")
public class PaymentController {

    private final PaymentService paymentService;
    private final IdentityVerifier identityVerifier;
    private final CheckoutProperties checkoutProperties;

    @PostMapping("/checkout/{bookingId}")
    @Operation(
        summary = "Create a checkout session",
        description = "Open a hosted checkout session for an accepted booking. The booking id travels " +
                     "with the session as correlation metadata."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Session created, redirect the customer to url"),
        @ApiResponse(responseCode = "403", description = "Caller is not the booking's customer"),
        @ApiResponse(responseCode = "404", description = "Booking or ticket not found"),
        @ApiResponse(responseCode = "409", description = "Booking already paid, not accepted, or departure passed"),
        @ApiResponse(responseCode = "503", description = "Payment provider unavailable")
    })
    public ResponseEntity<CheckoutResponse> createCheckout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Booking ID") @PathVariable Long bookingId) {

        String caller = identityVerifier.verify(authorization);

        try {
            CheckoutResponse response = paymentService.createCheckout(bookingId, caller);
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (MarketplaceException e) {
            log.warn("Checkout failed for booking: {} - {}", bookingId, e.getMessage());
            throw e;
        }
    }

    @PostMapping("/verify")
    @Operation(
        summary = "Verify a checkout session",
        description = "Record the payment and mark the booking paid. Safe to call repeatedly with the " +
                     "same session; later calls report alreadyProcessed."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Payment recorded or already recorded"),
        @ApiResponse(responseCode = "404", description = "Session or booking not found"),
        @ApiResponse(responseCode = "409", description = "Payment not completed or booking cannot be finalized")
    })
    public ResponseEntity<PaymentVerificationResult> verifyPayment(
            @Parameter(description = "Checkout session ID") @RequestParam("session_id") String sessionId) {

        log.info("Payment verification requested for session: {}", sessionId);
        return ResponseEntity.ok(paymentService.verifyPayment(sessionId));
    }

    @GetMapping("/checkout/success")
    @Operation(summary = "Provider success callback", description = "Verifies the session and redirects the browser to the site.")
    public ResponseEntity<Void> checkoutSuccess(@RequestParam("session_id") String sessionId) {
        try {
            PaymentVerificationResult result = paymentService.verifyPayment(sessionId);
            return redirect(UriComponentsBuilder.fromUriString(checkoutProperties.siteUrl("payment-success"))
                .queryParam("bookingId", result.getBooking().getId())
                .build().toUri());
        } catch (MarketplaceException e) {
            log.warn("Success callback could not verify session: {} - {}", sessionId, e.getMessage());
            return redirect(UriComponentsBuilder.fromUriString(checkoutProperties.siteUrl("payment-failed"))
                .queryParam("reason", e.getKind().name())
                .build().toUri());
        }
    }

    @GetMapping("/checkout/cancel")
    @Operation(summary = "Provider cancel callback", description = "Cancels the accepted booking, releases its stock and redirects the browser.")
    public ResponseEntity<Void> checkoutCancel(@RequestParam("booking_id") Long bookingId) {
        BookingDto booking = paymentService.cancelCheckout(bookingId);
        log.info("Cancel callback handled for booking: {} now {}", bookingId, booking.getStatus());

        return redirect(UriComponentsBuilder.fromUriString(checkoutProperties.siteUrl("payment-cancelled"))
            .queryParam("bookingId", bookingId)
            .build().toUri());
    }

    @GetMapping
    @Operation(summary = "Payment history", description = "The caller's own payments, newest first.")
    public ResponseEntity<List<PaymentDto>> getPaymentHistory(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Customer email") @RequestParam String email) {

        String caller = identityVerifier.verify(authorization);
        return ResponseEntity.ok(paymentService.getPaymentHistory(email, caller));
    }

    private ResponseEntity<Void> redirect(URI location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
